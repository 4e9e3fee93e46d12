package com.scholary.audiobook.handler.playback;

/** Where a playback session stands. */
public enum PlaybackState {
  /** No segment loaded. */
  IDLE,
  /** A segment is being resolved or buffered by the player. */
  LOADING,
  /** Loaded and paused, waiting for play. */
  READY,
  PLAYING,
  PAUSED,
  /** The current segment played to its end; the next one is about to load. */
  ENDED,
  /** The last segment of the book played to its end. */
  FINISHED,
  ERROR
}
