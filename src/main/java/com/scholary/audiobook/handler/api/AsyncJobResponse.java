package com.scholary.audiobook.handler.api;

/** Response for an accepted ingestion request: poll {@code statusUrl} for progress. */
public record AsyncJobResponse(String jobId, String statusUrl) {}
