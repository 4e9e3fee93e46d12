package com.scholary.audiobook.handler.auth;

/**
 * Hands out a bearer token for requests against the library.
 *
 * <p>Callers that get an {@link AuthExpiredException} back from a request call {@link #invalidate()}
 * and ask again, once.
 */
public interface TokenProvider {

  /**
   * @return a token that is valid now
   * @throws AuthException if no token is available, including while fetches are backing off
   */
  String bearerToken();

  /** Drop the cached token so the next call fetches a new one. */
  void invalidate();
}
