package com.scholary.audiobook.handler.retry;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation off the caller's thread and re-runs it on a timer while it keeps failing with
 * a retryable error.
 *
 * <p>Every {@link #submit} call has its own attempt counter. No thread sleeps between attempts:
 * the next one is scheduled on the executor.
 */
public class RetryScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryScheduler.class);

  private final ScheduledExecutorService executor;

  public RetryScheduler(ScheduledExecutorService executor) {
    this.executor = executor;
  }

  /**
   * @param name used in log messages
   * @param retryable decides whether a failure is worth another attempt
   * @return completes with the first successful result, or exceptionally with the last failure
   */
  public <T> CompletableFuture<T> submit(
      String name, Callable<T> operation, Predicate<Throwable> retryable, BackoffPolicy policy) {
    CompletableFuture<T> result = new CompletableFuture<>();
    executor.execute(() -> attempt(name, operation, retryable, policy, 1, result));
    return result;
  }

  private <T> void attempt(
      String name,
      Callable<T> operation,
      Predicate<Throwable> retryable,
      BackoffPolicy policy,
      int attempt,
      CompletableFuture<T> result) {
    if (result.isDone()) {
      return;
    }

    try {
      result.complete(operation.call());

    } catch (Exception e) {
      Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
      if (attempt >= policy.maxAttempts() || !retryable.test(cause)) {
        LOGGER.warn("{} failed after {} attempt(s): {}", name, attempt, cause.getMessage());
        result.completeExceptionally(cause);
        return;
      }

      Duration delay = policy.delayBeforeRetry(attempt);
      LOGGER.info(
          "{} failed (attempt {}/{}), retrying in {}ms: {}",
          name,
          attempt,
          policy.maxAttempts(),
          delay.toMillis(),
          cause.getMessage());
      executor.schedule(
          () -> attempt(name, operation, retryable, policy, attempt + 1, result),
          delay.toMillis(),
          TimeUnit.MILLISECONDS);
    }
  }
}
