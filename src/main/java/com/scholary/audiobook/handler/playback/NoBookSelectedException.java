package com.scholary.audiobook.handler.playback;

public class NoBookSelectedException extends PlaybackStateException {

  public NoBookSelectedException() {
    super("No book selected");
  }
}
