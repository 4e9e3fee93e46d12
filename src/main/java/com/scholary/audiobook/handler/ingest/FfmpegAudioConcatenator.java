package com.scholary.audiobook.handler.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Concatenates audio files with ffmpeg's concat demuxer.
 *
 * <p>The inputs are written to a list file and joined with {@code -c copy}, so the audio frames are
 * copied as they are. The planner only groups files of one container format, which is what the
 * demuxer requires; the output format follows the output file's extension.
 */
@Component
public class FfmpegAudioConcatenator implements AudioConcatenator {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioConcatenator.class);

  private static final int MAX_ERROR_CHARS = 2000;

  private final FfmpegProperties properties;

  public FfmpegAudioConcatenator(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void concatenate(List<Path> inputs, Path output) throws IOException {
    if (inputs.isEmpty()) {
      throw new IllegalArgumentException("Nothing to concatenate");
    }

    Path listFile = output.resolveSibling(output.getFileName() + ".txt");
    Path logFile = output.resolveSibling(output.getFileName() + ".log");
    Files.write(listFile, toConcatList(inputs), StandardCharsets.UTF_8);

    // -f concat: read the list file
    // -safe 0: allow absolute paths in the list
    // -c copy: no re-encode
    ProcessBuilder pb =
        new ProcessBuilder(
            properties.binary(),
            "-hide_banner",
            "-loglevel", "error",
            "-f", "concat",
            "-safe", "0",
            "-i", listFile.toString(),
            "-c", "copy",
            "-y",
            output.toString());
    // Output goes to a file so a chatty ffmpeg can never block on a full pipe
    pb.redirectErrorStream(true);
    pb.redirectOutput(logFile.toFile());

    LOGGER.info("Concatenating {} files into {}", inputs.size(), output.getFileName());
    LOGGER.debug("Executing: {}", pb.command());

    Process process = null;
    try {
      process = pb.start();
      boolean finished =
          process.waitFor(properties.concatTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new IOException(
            "ffmpeg concatenation timed out after " + properties.concatTimeout());
      }

      int exitCode = process.exitValue();
      if (exitCode != 0) {
        throw new IOException(
            "ffmpeg concatenation failed with exit code " + exitCode + ": " + tail(logFile));
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException("ffmpeg concatenation interrupted", e);
    } finally {
      Files.deleteIfExists(listFile);
      Files.deleteIfExists(logFile);
    }
  }

  private static String tail(Path logFile) throws IOException {
    String log = Files.readString(logFile, StandardCharsets.UTF_8).strip();
    return log.length() <= MAX_ERROR_CHARS ? log : log.substring(log.length() - MAX_ERROR_CHARS);
  }

  static List<String> toConcatList(List<Path> inputs) {
    // Single quotes inside a quoted path are written as '\''
    return inputs.stream()
        .map(path -> "file '" + path.toAbsolutePath().toString().replace("'", "'\\''") + "'")
        .toList();
  }
}
