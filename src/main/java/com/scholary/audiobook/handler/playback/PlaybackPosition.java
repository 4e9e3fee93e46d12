package com.scholary.audiobook.handler.playback;

/**
 * A resumable place in a book.
 *
 * @param segmentIndex 0-based index into the book's segments
 * @param offsetMillis offset inside that segment
 */
public record PlaybackPosition(
    String bookId, int segmentIndex, long offsetMillis, float playbackSpeed) {

  public static final float MIN_SPEED = 0.5f;
  public static final float MAX_SPEED = 2.0f;

  public PlaybackPosition {
    if (bookId == null || bookId.isBlank()) {
      throw new IllegalArgumentException("Book id is required");
    }
    if (segmentIndex < 0) {
      throw new IllegalArgumentException("Segment index cannot be negative: " + segmentIndex);
    }
    if (offsetMillis < 0) {
      throw new IllegalArgumentException("Offset cannot be negative: " + offsetMillis);
    }
    if (!(playbackSpeed >= MIN_SPEED && playbackSpeed <= MAX_SPEED)) {
      throw new IllegalArgumentException("Playback speed out of range: " + playbackSpeed);
    }
  }

  /**
   * Clamp a requested speed into the supported range.
   *
   * @throws IllegalArgumentException for NaN, which has no meaningful clamp
   */
  public static float clampSpeed(float requested) {
    if (Float.isNaN(requested)) {
      throw new IllegalArgumentException("Playback speed must be a number");
    }
    return Math.max(MIN_SPEED, Math.min(MAX_SPEED, requested));
  }
}
