package com.scholary.audiobook.handler.objectstore;

/** The store rejected our credentials (401/403, expired token). Worth one retry after re-auth. */
public class ObjectStoreAuthException extends ObjectStoreException {

  public ObjectStoreAuthException(String message, Throwable cause) {
    super(message, cause, false);
  }
}
