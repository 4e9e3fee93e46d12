package com.scholary.audiobook.handler.playback;

/** A message meant for the listener's user. */
public record PlaybackNotice(Kind kind, String message) {

  public enum Kind {
    PLAYBACK_ERROR,
    SKIPPING_SEGMENT,
    TERMINAL_ERROR
  }
}
