package com.scholary.audiobook.handler.planning;

import java.util.List;

/**
 * One planned playback segment.
 *
 * <p>A segment is either a single source file used as-is ({@link PassThrough}) or an ordered run of
 * source files that will be concatenated ({@link Combine}).
 */
public interface SegmentPlan {

  /** Source files making up this segment, in playback order. */
  List<SourceFile> sources();

  default long sizeBytes() {
    return sources().stream().mapToLong(SourceFile::sizeBytes).sum();
  }

  default double durationSeconds() {
    return sources().stream().mapToDouble(SourceFile::durationSeconds).sum();
  }

  default List<Integer> sourceIndices() {
    return sources().stream().map(SourceFile::index).toList();
  }

  /** Container format of the segment; the planner never groups files of different formats. */
  default String audioExtension() {
    return BookNames.audioExtension(sources().get(0).name());
  }

  /** A source file that already fits the segment bounds. */
  record PassThrough(SourceFile source) implements SegmentPlan {

    @Override
    public List<SourceFile> sources() {
      return List.of(source);
    }
  }

  /** Consecutive source files merged into one segment. */
  record Combine(List<SourceFile> sources) implements SegmentPlan {

    public Combine {
      if (sources == null || sources.isEmpty()) {
        throw new IllegalArgumentException("Combine group must contain at least one file");
      }
      sources = List.copyOf(sources);
    }
  }
}
