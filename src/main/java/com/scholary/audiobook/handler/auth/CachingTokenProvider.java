package com.scholary.audiobook.handler.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches the token from a {@link TokenSource} until shortly before it expires.
 *
 * <p>Failed fetches open a backoff window that starts at {@code initialBackoff} and doubles per
 * consecutive failure up to {@code maxBackoff}. Inside the window no fetch is attempted and callers
 * get an {@link AuthException} carrying the remaining wait. A successful fetch resets the window.
 * The backoff state belongs to this instance; two providers never share it.
 */
public class CachingTokenProvider implements TokenProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachingTokenProvider.class);

  private final TokenSource source;
  private final Clock clock;
  private final Duration refreshSkew;
  private final Duration initialBackoff;
  private final Duration maxBackoff;

  private IssuedToken cached;
  private Duration nextBackoff;
  private Instant blockedUntil = Instant.MIN;

  public CachingTokenProvider(
      TokenSource source,
      Clock clock,
      Duration refreshSkew,
      Duration initialBackoff,
      Duration maxBackoff) {
    if (initialBackoff.isNegative() || initialBackoff.isZero()) {
      throw new IllegalArgumentException("Initial backoff must be positive");
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("Max backoff must be >= initial backoff");
    }
    this.source = source;
    this.clock = clock;
    this.refreshSkew = refreshSkew;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
    this.nextBackoff = initialBackoff;
  }

  @Override
  public synchronized String bearerToken() {
    Instant now = clock.instant();
    if (cached != null && now.isBefore(cached.expiresAt().minus(refreshSkew))) {
      return cached.value();
    }

    if (now.isBefore(blockedUntil)) {
      Duration wait = Duration.between(now, blockedUntil);
      throw new AuthException("Token fetch backing off for " + wait.toMillis() + "ms", null, wait);
    }

    try {
      IssuedToken token = source.fetch();
      cached = token;
      nextBackoff = initialBackoff;
      blockedUntil = Instant.MIN;
      LOGGER.debug("Fetched access token, expires at {}", token.expiresAt());
      return token.value();

    } catch (RuntimeException e) {
      cached = null;
      Duration wait = nextBackoff;
      blockedUntil = now.plus(wait);
      Duration doubled = nextBackoff.multipliedBy(2);
      nextBackoff = doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
      LOGGER.warn("Failed to fetch access token, next attempt in {}ms", wait.toMillis(), e);
      throw new AuthException("Failed to fetch access token", e, wait);
    }
  }

  @Override
  public synchronized void invalidate() {
    LOGGER.debug("Invalidating cached access token");
    cached = null;
  }
}
