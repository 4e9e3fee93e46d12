package com.scholary.audiobook.handler.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetrySchedulerTest {

  private final BackoffPolicy policy =
      new BackoffPolicy(Duration.ofMillis(5), Duration.ofMillis(20), 2.0, 3);

  private ScheduledExecutorService executor;
  private RetryScheduler scheduler;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadScheduledExecutor();
    scheduler = new RetryScheduler(executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void submit_shouldRetryRetryableFailuresUntilSuccess() throws Exception {
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result =
        scheduler.submit(
            "op",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new IOException("flaky");
              }
              return "done";
            },
            IOException.class::isInstance,
            policy);

    assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("done");
    assertThat(calls).hasValue(3);
  }

  @Test
  void submit_shouldStopAfterMaxAttempts() {
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result =
        scheduler.submit(
            "op",
            () -> {
              calls.incrementAndGet();
              throw new IOException("down");
            },
            IOException.class::isInstance,
            policy);

    assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(IOException.class);
    assertThat(calls).hasValue(3);
  }

  @Test
  void submit_shouldFailFastOnNonRetryableError() {
    AtomicInteger calls = new AtomicInteger();

    CompletableFuture<String> result =
        scheduler.submit(
            "op",
            () -> {
              calls.incrementAndGet();
              throw new IllegalStateException("bad");
            },
            IOException.class::isInstance,
            policy);

    assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
        .hasCauseInstanceOf(IllegalStateException.class);
    assertThat(calls).hasValue(1);
  }
}
