package com.scholary.audiobook.handler.config;

import com.scholary.audiobook.handler.planning.SegmentLimits;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for book ingestion.
 *
 * <p>Controls segment bounds, the scratch directory used while assembling segments, and the thread
 * pool that runs ingestion jobs.
 */
@ConfigurationProperties(prefix = "ingestion")
@Validated
public record IngestionProperties(
    @NotNull @Valid SegmentingProperties segmenting,
    @NotBlank String workDir,
    @Positive long estimatedBytesPerSecond,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record SegmentingProperties(
      @PositiveOrZero long minSegmentSeconds,
      @Positive long maxSegmentSeconds,
      @Positive long maxSegmentBytes,
      @PositiveOrZero double reprocessSizeTolerance) {

    public SegmentLimits toLimits() {
      return new SegmentLimits(minSegmentSeconds, maxSegmentSeconds, maxSegmentBytes);
    }
  }
}
