package com.scholary.audiobook.handler.catalog;

import java.util.List;

/**
 * A book in the library, with its segments in playback order.
 *
 * @param id the book's storage slug, also the name of its folder
 * @param tocFileId key of the table of contents object, or null when the book has none
 */
public record Book(String id, String displayName, List<Segment> segments, String tocFileId) {

  public Book {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Book id is required");
    }
    if (segments == null || segments.isEmpty()) {
      throw new IllegalArgumentException("Book " + id + " has no segments");
    }
    segments = List.copyOf(segments);
  }

  public int segmentCount() {
    return segments.size();
  }

  public double totalDurationSeconds() {
    return segments.stream().mapToDouble(Segment::durationSeconds).sum();
  }
}
