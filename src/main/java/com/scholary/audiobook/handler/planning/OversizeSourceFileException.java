package com.scholary.audiobook.handler.planning;

/**
 * A single source file is larger than the segment size ceiling on its own.
 *
 * <p>Such a file cannot be split without re-encoding, which is outside what the planner does. It is
 * reported rather than truncated.
 */
public class OversizeSourceFileException extends PlanningException {

  private final SourceFile sourceFile;
  private final long maxSegmentBytes;

  public OversizeSourceFileException(SourceFile sourceFile, long maxSegmentBytes) {
    super(
        String.format(
            "Source file %s (index %d) is %d bytes, above the %d byte segment limit",
            sourceFile.name(), sourceFile.index(), sourceFile.sizeBytes(), maxSegmentBytes));
    this.sourceFile = sourceFile;
    this.maxSegmentBytes = maxSegmentBytes;
  }

  public SourceFile getSourceFile() {
    return sourceFile;
  }

  public long getMaxSegmentBytes() {
    return maxSegmentBytes;
  }
}
