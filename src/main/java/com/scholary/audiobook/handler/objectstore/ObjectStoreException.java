package com.scholary.audiobook.handler.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Transient failures (connection problems, throttling, 5xx responses) are flagged so callers
 * that retry can tell them apart from a missing object or a misconfigured bucket.
 */
public class ObjectStoreException extends RuntimeException {

  private final boolean transientFailure;

  public ObjectStoreException(String message) {
    this(message, null, false);
  }

  public ObjectStoreException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public ObjectStoreException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
