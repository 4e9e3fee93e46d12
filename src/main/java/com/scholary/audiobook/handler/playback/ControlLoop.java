package com.scholary.audiobook.handler.playback;

import java.time.Duration;

/**
 * A single sequential thread of control.
 *
 * <p>Tasks run one at a time in submission order, so anything touched only from inside the loop
 * needs no locking.
 */
public interface ControlLoop {

  void execute(Runnable task);

  Cancellable schedule(Runnable task, Duration delay);

  Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);
}
