package com.scholary.audiobook.handler.playback;

/** Handle to a scheduled task. Cancelling twice, or after the task ran, does nothing. */
@FunctionalInterface
public interface Cancellable {

  void cancel();
}
