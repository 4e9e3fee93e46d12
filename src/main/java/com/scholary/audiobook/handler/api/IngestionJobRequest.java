package com.scholary.audiobook.handler.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to ingest a downloaded book.
 *
 * <p>{@code sourceDir} is a path on the service's host. {@code force} defaults to false.
 */
public record IngestionJobRequest(@NotBlank String bookTitle, @NotBlank String sourceDir, Boolean force) {

  public IngestionJobRequest {
    if (force == null) {
      force = false;
    }
  }
}
