package com.scholary.audiobook.handler.planning;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Table of contents for one book, stored next to its segments.
 *
 * <p>Format:
 *
 * <pre>
 * {
 *   "book_id": "well_of_ascension",
 *   "book_title": "Well Of Ascension",
 *   "total_segments": 2,
 *   "total_duration_seconds": 8100.0,
 *   "segments": [
 *     {"sequence": 1, "file_name": "well_of_ascension_segment_01.mp3",
 *      "display_name": "Well Of Ascension - Segment 01", "start_offset_seconds": 0.0,
 *      "duration_seconds": 4320.0, "size_bytes": 69120000, "source_indices": [1]}
 *   ]
 * }
 * </pre>
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TableOfContents(
    String bookId,
    String bookTitle,
    int totalSegments,
    double totalDurationSeconds,
    List<Entry> segments) {

  public TableOfContents {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Entry(
      int sequence,
      String fileName,
      String displayName,
      double startOffsetSeconds,
      double durationSeconds,
      long sizeBytes,
      List<Integer> sourceIndices) {}
}
