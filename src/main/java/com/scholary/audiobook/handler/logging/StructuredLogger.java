package com.scholary.audiobook.handler.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts the event's fields into the MDC for the duration of one log call, so log
 * shippers can index them. Job and book context is set separately and spans a whole ingestion.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log segment planning event. */
  public void logSegmentPlanned(
      String bookId, int sequence, int sourceCount, double durationSeconds, long sizeBytes) {
    try {
      MDC.put("event_type", "segment_planned");
      MDC.put("segment_sequence", String.valueOf(sequence));
      MDC.put("sourceCount", String.valueOf(sourceCount));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));
      MDC.put("sizeBytes", String.valueOf(sizeBytes));

      logger.debug(
          "Segment planned: book={}, sequence={}, sources={}, duration={}s, size={} bytes",
          bookId,
          sequence,
          sourceCount,
          durationSeconds,
          sizeBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log segment upload event. */
  public void logSegmentUploaded(
      String bookId, int sequence, int totalSegments, long sizeBytes, long uploadMs) {
    try {
      MDC.put("event_type", "segment_uploaded");
      MDC.put("segment_sequence", String.valueOf(sequence));
      MDC.put("totalSegments", String.valueOf(totalSegments));
      MDC.put("sizeBytes", String.valueOf(sizeBytes));
      MDC.put("uploadMs", String.valueOf(uploadMs));

      logger.info(
          "Segment uploaded: book={}, segment={}/{}, size={} bytes, upload={}ms",
          bookId,
          sequence,
          totalSegments,
          sizeBytes,
          uploadMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log ingestion progress event. */
  public void logIngestProgress(
      String jobId, String phase, int done, int total, int percentComplete) {
    try {
      MDC.put("event_type", "ingest_progress");
      MDC.put("phase", phase);
      MDC.put("done", String.valueOf(done));
      MDC.put("total", String.valueOf(total));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Ingest progress: jobId={}, phase={}, items={}/{}, progress={}%",
          jobId,
          phase,
          done,
          total,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log playback state transition. */
  public void logPlaybackTransition(String bookId, int segmentIndex, Enum<?> from, Enum<?> to) {
    try {
      MDC.put("event_type", "playback_transition");
      MDC.put("playback_book", bookId);
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("from", String.valueOf(from));
      MDC.put("to", String.valueOf(to));

      logger.debug(
          "Playback transition: book={}, segment={}, {} -> {}", bookId, segmentIndex, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log position persistence. */
  public void logPositionSaved(String bookId, int segmentIndex, long offsetMillis, float speed) {
    try {
      MDC.put("event_type", "position_saved");
      MDC.put("playback_book", bookId);
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("offsetMillis", String.valueOf(offsetMillis));
      MDC.put("speed", String.valueOf(speed));

      logger.debug(
          "Position saved: book={}, segment={}, offset={}ms, speed={}",
          bookId,
          segmentIndex,
          offsetMillis,
          speed);
    } finally {
      clearEventFields();
    }
  }

  /** Log the skip decision after a playback error. */
  public void logPlaybackErrorSkip(
      String bookId, int segmentIndex, boolean terminal, String message) {
    try {
      MDC.put("event_type", "playback_error_skip");
      MDC.put("playback_book", bookId);
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("terminal", String.valueOf(terminal));

      if (terminal) {
        logger.error(
            "Playback failed on last segment: book={}, segment={}, error={}",
            bookId,
            segmentIndex,
            message);
      } else {
        logger.warn(
            "Playback failed, skipping ahead: book={}, segment={}, error={}",
            bookId,
            segmentIndex,
            message);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String bookId) {
    MDC.put("jobId", jobId);
    MDC.put("bookId", bookId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("bookId");
  }

  /** Clear event-specific fields from MDC. Job context set by the caller survives. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("segment_sequence");
    MDC.remove("segment_index");
    MDC.remove("sourceCount");
    MDC.remove("durationSeconds");
    MDC.remove("sizeBytes");
    MDC.remove("totalSegments");
    MDC.remove("uploadMs");
    MDC.remove("phase");
    MDC.remove("done");
    MDC.remove("total");
    MDC.remove("percentComplete");
    MDC.remove("from");
    MDC.remove("to");
    MDC.remove("offsetMillis");
    MDC.remove("speed");
    MDC.remove("terminal");
    MDC.remove("playback_book");
  }
}
