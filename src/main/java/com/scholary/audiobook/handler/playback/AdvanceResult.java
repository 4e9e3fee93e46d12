package com.scholary.audiobook.handler.playback;

/**
 * Outcome of moving to the next or previous segment.
 *
 * @param segmentIndex the current index after the call
 */
public record AdvanceResult(Outcome outcome, int segmentIndex) {

  public enum Outcome {
    MOVED,
    AT_BOOK_START,
    AT_BOOK_END
  }

  public enum Direction {
    NEXT,
    PREVIOUS
  }

  public boolean moved() {
    return outcome == Outcome.MOVED;
  }
}
