package com.scholary.audiobook.handler.auth;

import java.time.Duration;

/**
 * Exception thrown when no valid credentials can be obtained.
 *
 * <p>When the provider is backing off after failed fetches, {@link #retryAfter()} says how long
 * until the next fetch will be attempted.
 */
public class AuthException extends RuntimeException {

  private final Duration retryAfter;

  public AuthException(String message) {
    this(message, null, Duration.ZERO);
  }

  public AuthException(String message, Throwable cause) {
    this(message, cause, Duration.ZERO);
  }

  public AuthException(String message, Throwable cause, Duration retryAfter) {
    super(message, cause);
    this.retryAfter = retryAfter;
  }

  public Duration retryAfter() {
    return retryAfter;
  }
}
