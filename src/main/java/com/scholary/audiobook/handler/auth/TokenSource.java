package com.scholary.audiobook.handler.auth;

/** Issues fresh access tokens. Implementations may block on the network. */
@FunctionalInterface
public interface TokenSource {

  /**
   * @throws AuthException if no token can be issued
   */
  IssuedToken fetch();
}
