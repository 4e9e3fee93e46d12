package com.scholary.audiobook.handler.job;

import com.scholary.audiobook.handler.api.JobStatusResponse.Status;
import com.scholary.audiobook.handler.ingest.IngestionRequest;
import com.scholary.audiobook.handler.ingest.IngestionResult;
import java.time.Instant;

/**
 * Represents an async ingestion job.
 *
 * <p>Tracks the job's state, progress, and result. Stored in memory using Caffeine cache. Fields
 * are written by the worker thread and read by status requests, hence volatile.
 */
public class IngestionJob {

  private final String jobId;
  private final IngestionRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile int progress; // 0-100
  private volatile String phase;
  private volatile IngestionResult result;
  private volatile String error;

  public IngestionJob(String jobId, IngestionRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public IngestionRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public int getProgress() {
    return progress;
  }

  public void setProgress(int progress) {
    this.progress = progress;
  }

  public String getPhase() {
    return phase;
  }

  public void setPhase(String phase) {
    this.phase = phase;
  }

  public IngestionResult getResult() {
    return result;
  }

  public void setResult(IngestionResult result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
