package com.scholary.audiobook.handler.playback;

/** The player refused a seek, typically because the target lies beyond the loaded media. */
public class SeekRejectedException extends RuntimeException {

  public SeekRejectedException(String message) {
    super(message);
  }
}
