package com.scholary.audiobook.handler.auth;

/** A request was rejected because the credentials it carried are no longer accepted. */
public class AuthExpiredException extends AuthException {

  public AuthExpiredException(String message, Throwable cause) {
    super(message, cause);
  }
}
