package com.scholary.audiobook.handler.api;

import com.scholary.audiobook.handler.ingest.IngestionResult;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an ingestion job and includes the result once completed.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    int progress,
    String phase,
    IngestionResult result,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
