package com.scholary.audiobook.handler.playback;

/** Exception thrown when the saved position cannot be read or written. */
public class PositionStoreException extends RuntimeException {

  public PositionStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
