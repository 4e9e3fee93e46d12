package com.scholary.audiobook.handler.catalog;

/**
 * One playable file of a book.
 *
 * @param fileId object key in the library bucket
 */
public record Segment(String fileId, String displayName, double durationSeconds, long sizeBytes) {

  public Segment {
    if (fileId == null || fileId.isBlank()) {
      throw new IllegalArgumentException("Segment file id is required");
    }
  }
}
