package com.scholary.audiobook.handler.auth;

import java.time.Instant;

/** An access token and the instant it stops being accepted. */
public record IssuedToken(String value, Instant expiresAt) {

  public IssuedToken {
    if (value == null) {
      throw new IllegalArgumentException("Token value is required");
    }
    if (expiresAt == null) {
      throw new IllegalArgumentException("Token expiry is required");
    }
  }
}
