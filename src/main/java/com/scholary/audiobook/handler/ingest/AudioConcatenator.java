package com.scholary.audiobook.handler.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Joins audio files end to end into a single file without re-encoding. */
public interface AudioConcatenator {

  /**
   * Concatenate the inputs, in order, into {@code output}.
   *
   * @throws IOException if the inputs cannot be read or the tool fails
   */
  void concatenate(List<Path> inputs, Path output) throws IOException;
}
