package com.scholary.audiobook.handler.playback;

/** An operation was invoked in a state that does not allow it. Never retried. */
public class PlaybackStateException extends RuntimeException {

  public PlaybackStateException(String message) {
    super(message);
  }
}
