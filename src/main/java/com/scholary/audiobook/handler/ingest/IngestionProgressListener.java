package com.scholary.audiobook.handler.ingest;

/** Receives progress of an ingestion run, phase by phase. */
@FunctionalInterface
public interface IngestionProgressListener {

  IngestionProgressListener NONE = (phase, done, total) -> {};

  void onProgress(Phase phase, int done, int total);

  enum Phase {
    PLANNING,
    ASSEMBLING,
    UPLOADING,
    CLEANING_UP
  }
}
