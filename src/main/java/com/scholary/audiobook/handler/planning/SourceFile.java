package com.scholary.audiobook.handler.planning;

/**
 * One downloaded audio file, as found in the source directory.
 *
 * <p>The index is the file's ordinal in the source series (audio_01.mp3 has index 1). Duration is
 * either measured or estimated from the size; the planner treats both the same way.
 */
public record SourceFile(int index, String name, long sizeBytes, double durationSeconds) {

  public SourceFile {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Source file name is required");
    }
  }
}
