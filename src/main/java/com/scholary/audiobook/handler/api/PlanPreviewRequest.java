package com.scholary.audiobook.handler.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * Request for previewing a segment plan without touching any files.
 *
 * <p>Useful for checking how a book will be split before downloading or ingesting it. A file
 * without a duration gets one estimated from its size.
 */
public record PlanPreviewRequest(@NotBlank String bookTitle, @NotNull List<@Valid FileDescriptor> files) {

  public record FileDescriptor(
      @PositiveOrZero int index,
      String name,
      @PositiveOrZero long sizeBytes,
      @PositiveOrZero Double durationSeconds) {}
}
