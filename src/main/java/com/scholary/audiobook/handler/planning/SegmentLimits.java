package com.scholary.audiobook.handler.planning;

/**
 * Size and duration bounds for a playback segment.
 *
 * <p>The byte ceiling is hard. The duration window is a target: the final remainder of a book may be
 * shorter than the minimum.
 */
public record SegmentLimits(double minSegmentSeconds, double maxSegmentSeconds, long maxSegmentBytes) {

  /** 60-120 minutes, 150 MB. */
  public static final SegmentLimits DEFAULT = new SegmentLimits(3600, 7200, 150L * 1024 * 1024);

  public SegmentLimits {
    if (minSegmentSeconds < 0) {
      throw new IllegalArgumentException("Minimum segment duration cannot be negative");
    }
    if (maxSegmentSeconds <= 0 || maxSegmentSeconds < minSegmentSeconds) {
      throw new IllegalArgumentException(
          "Maximum segment duration must be positive and >= minimum segment duration");
    }
    if (maxSegmentBytes <= 0) {
      throw new IllegalArgumentException("Maximum segment size must be positive");
    }
  }

  public boolean fitsAsIs(SourceFile file) {
    return file.durationSeconds() >= minSegmentSeconds
        && file.durationSeconds() <= maxSegmentSeconds
        && file.sizeBytes() <= maxSegmentBytes;
  }
}
