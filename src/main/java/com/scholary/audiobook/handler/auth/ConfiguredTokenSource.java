package com.scholary.audiobook.handler.auth;

import java.time.Clock;
import java.time.Duration;

/**
 * Issues a token configured up front, such as a gateway API key.
 *
 * <p>The configured lifetime makes the provider re-read it periodically, which matters once the
 * value is rotated underneath a running service.
 */
public class ConfiguredTokenSource implements TokenSource {

  private final String token;
  private final Duration lifetime;
  private final Clock clock;

  public ConfiguredTokenSource(String token, Duration lifetime, Clock clock) {
    this.token = token;
    this.lifetime = lifetime;
    this.clock = clock;
  }

  @Override
  public IssuedToken fetch() {
    if (token == null || token.isBlank()) {
      throw new AuthException("No access token configured");
    }
    return new IssuedToken(token, clock.instant().plus(lifetime));
  }
}
