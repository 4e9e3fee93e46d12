package com.scholary.audiobook.handler.playback;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Control loop backed by a single-threaded scheduled executor. */
public class ExecutorControlLoop implements ControlLoop, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorControlLoop.class);

  private final ScheduledExecutorService executor;

  public ExecutorControlLoop(String threadName) {
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, threadName);
              thread.setDaemon(true);
              return thread;
            });
  }

  @Override
  public void execute(Runnable task) {
    executor.execute(guarded(task));
  }

  @Override
  public Cancellable schedule(Runnable task, Duration delay) {
    ScheduledFuture<?> future =
        executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
    ScheduledFuture<?> future =
        executor.scheduleAtFixedRate(
            guarded(task), initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  // A failing task must not kill the loop thread or silently cancel a periodic task
  private static Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.error("Control loop task failed", e);
      }
    };
  }
}
