package com.scholary.audiobook.handler.ingest;

import com.scholary.audiobook.handler.config.IngestionProperties;
import com.scholary.audiobook.handler.planning.BookNames;
import com.scholary.audiobook.handler.planning.InvalidSourceSetException;
import com.scholary.audiobook.handler.planning.SourceFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a directory of downloaded audio files into planner input.
 *
 * <p>Downloads are named after their position in the series ({@code audio_07.mp3}, {@code Chapter
 * 12.m4a}), so the last run of digits in the file name is taken as the index. Duration is estimated
 * from the file size and a nominal bitrate; 16000 bytes per second is 128 kbit/s, which is what the
 * source sites serve.
 */
@Component
public class SourceFileScanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourceFileScanner.class);

  private static final Pattern DIGITS = Pattern.compile("(\\d+)");

  private final long bytesPerSecond;

  @Autowired
  public SourceFileScanner(IngestionProperties properties) {
    this(properties.estimatedBytesPerSecond());
  }

  public SourceFileScanner(long bytesPerSecond) {
    if (bytesPerSecond <= 0) {
      throw new IllegalArgumentException("Byte rate must be positive");
    }
    this.bytesPerSecond = bytesPerSecond;
  }

  /**
   * Scan a source directory.
   *
   * @return the audio files found, ordered by index
   * @throws InvalidSourceSetException if the directory is missing or a file name carries no number
   * @throws UncheckedIOException if the directory cannot be read
   */
  public List<SourceFile> scan(Path directory) {
    if (!Files.isDirectory(directory)) {
      throw new InvalidSourceSetException("Source directory does not exist: " + directory);
    }

    List<SourceFile> files = new ArrayList<>();
    try (Stream<Path> entries = Files.list(directory)) {
      for (Path path : entries.filter(Files::isRegularFile).filter(this::isAudio).toList()) {
        String name = path.getFileName().toString();
        long size = Files.size(path);
        files.add(new SourceFile(indexOf(name), name, size, (double) size / bytesPerSecond));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to scan source directory: " + directory, e);
    }

    files.sort(Comparator.comparingInt(SourceFile::index).thenComparing(SourceFile::name));
    LOGGER.info("Scanned {}: {} audio files", directory, files.size());
    return files;
  }

  static int indexOf(String fileName) {
    String base = stripExtension(fileName);
    Matcher matcher = DIGITS.matcher(base);
    String last = null;
    while (matcher.find()) {
      last = matcher.group(1);
    }
    if (last == null) {
      throw new InvalidSourceSetException("File name has no sequence number: " + fileName);
    }
    try {
      return Integer.parseInt(last);
    } catch (NumberFormatException e) {
      throw new InvalidSourceSetException("Sequence number out of range in: " + fileName);
    }
  }

  private boolean isAudio(Path path) {
    return BookNames.isAudioFileName(path.getFileName().toString());
  }

  private static String stripExtension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }
}
