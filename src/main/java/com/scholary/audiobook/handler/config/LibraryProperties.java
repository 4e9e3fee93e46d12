package com.scholary.audiobook.handler.config;

import com.scholary.audiobook.handler.retry.BackoffPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for reading the library back.
 *
 * <p>{@code refresh} bounds the retries of a library refresh; {@code executorThreads} sizes the
 * pool that runs refreshes and segment URL resolution.
 */
@ConfigurationProperties(prefix = "library")
@Validated
public record LibraryProperties(
    @NotNull @Valid RefreshProperties refresh, @Positive int executorThreads) {

  public record RefreshProperties(
      @NotNull Duration initialDelay,
      @NotNull Duration maxDelay,
      @DecimalMin("1.0") double multiplier,
      @Positive int maxAttempts) {

    public BackoffPolicy toPolicy() {
      return new BackoffPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
    }
  }
}
