package com.scholary.audiobook.handler.ingest;

import java.util.List;

/** Outcome of one ingestion run. */
public record IngestionResult(
    String bookId,
    String bookTitle,
    Outcome outcome,
    int segmentCount,
    String tocKey,
    List<String> segmentKeys,
    int deletedObjects) {

  public enum Outcome {
    /** Segments and TOC were written. */
    UPLOADED,
    /** The library already held a book matching the plan; nothing was written. */
    UNCHANGED
  }

  public IngestionResult {
    segmentKeys = segmentKeys == null ? List.of() : List.copyOf(segmentKeys);
  }
}
