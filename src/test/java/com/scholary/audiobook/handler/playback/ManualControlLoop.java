package com.scholary.audiobook.handler.playback;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Control loop driven by the test thread with a virtual clock.
 *
 * <p>Nothing runs until {@link #runPending()} or {@link #advance(Duration)} is called.
 */
class ManualControlLoop implements ControlLoop {

  private final Deque<Runnable> ready = new ArrayDeque<>();
  private final List<Timer> timers = new ArrayList<>();
  private long nowMillis;
  private long sequence;

  @Override
  public void execute(Runnable task) {
    ready.add(task);
  }

  @Override
  public Cancellable schedule(Runnable task, Duration delay) {
    Timer timer = new Timer(task, nowMillis + delay.toMillis(), 0, sequence++);
    timers.add(timer);
    return () -> timer.cancelled = true;
  }

  @Override
  public Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
    Timer timer =
        new Timer(task, nowMillis + initialDelay.toMillis(), period.toMillis(), sequence++);
    timers.add(timer);
    return () -> timer.cancelled = true;
  }

  /** Run queued tasks, including the ones they queue, until none are left. */
  void runPending() {
    while (!ready.isEmpty()) {
      ready.removeFirst().run();
    }
  }

  /** Move the clock forward, firing due timers in order and draining the queue after each. */
  void advance(Duration duration) {
    long target = nowMillis + duration.toMillis();
    runPending();
    while (true) {
      Optional<Timer> next =
          timers.stream()
              .filter(timer -> !timer.cancelled && timer.dueMillis <= target)
              .min(Comparator.comparingLong((Timer timer) -> timer.dueMillis)
                  .thenComparingLong(timer -> timer.sequence));
      if (next.isEmpty()) {
        break;
      }
      Timer timer = next.get();
      nowMillis = timer.dueMillis;
      if (timer.periodMillis > 0) {
        timer.dueMillis += timer.periodMillis;
      } else {
        timer.cancelled = true;
      }
      timer.task.run();
      runPending();
    }
    timers.removeIf(timer -> timer.cancelled);
    nowMillis = target;
  }

  long activeTimers() {
    return timers.stream().filter(timer -> !timer.cancelled).count();
  }

  private static final class Timer {
    private final Runnable task;
    private final long periodMillis;
    private final long sequence;
    private long dueMillis;
    private boolean cancelled;

    private Timer(Runnable task, long dueMillis, long periodMillis, long sequence) {
      this.task = task;
      this.dueMillis = dueMillis;
      this.periodMillis = periodMillis;
      this.sequence = sequence;
    }
  }
}
