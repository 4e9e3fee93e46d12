package com.scholary.audiobook.handler.playback;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the position in a small JSON file.
 *
 * <p>Format:
 *
 * <pre>
 * {"last_book_id": "mistborn", "last_segment_index": 3, "last_position_ms": 125000, "last_speed": 1.25}
 * </pre>
 *
 * <p>A write goes to a temporary file in the same directory which then replaces the old file, so a
 * crash mid-write leaves the previous position intact.
 */
public class JsonFilePositionStore implements PositionStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFilePositionStore.class);

  private final Path file;
  private final ObjectMapper objectMapper;

  private PlaybackPosition lastWritten;

  public JsonFilePositionStore(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
  }

  @Override
  public synchronized Optional<PlaybackPosition> load() {
    if (!Files.exists(file)) {
      LOGGER.debug("No saved position at {}", file);
      return Optional.empty();
    }

    try {
      StoredPosition stored = objectMapper.readValue(file.toFile(), StoredPosition.class);
      PlaybackPosition position =
          new PlaybackPosition(
              stored.bookId(),
              Math.max(0, stored.segmentIndex()),
              Math.max(0, stored.positionMs()),
              stored.speed() == null ? 1.0f : PlaybackPosition.clampSpeed(stored.speed()));
      lastWritten = position;
      LOGGER.info(
          "Loaded saved position: book={}, segment={}, offset={}ms",
          position.bookId(),
          position.segmentIndex(),
          position.offsetMillis());
      return Optional.of(position);

    } catch (IOException | IllegalArgumentException e) {
      throw new PositionStoreException("Failed to read saved position from " + file, e);
    }
  }

  @Override
  public synchronized void save(PlaybackPosition position) {
    if (position.equals(lastWritten)) {
      return;
    }

    StoredPosition stored =
        new StoredPosition(
            position.bookId(),
            position.segmentIndex(),
            position.offsetMillis(),
            position.playbackSpeed());

    try {
      Path parent = file.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      try {
        objectMapper.writeValue(temp.toFile(), stored);
        moveIntoPlace(temp);
      } finally {
        Files.deleteIfExists(temp);
      }
      lastWritten = position;
      LOGGER.debug("Saved position to {}", file);

    } catch (IOException e) {
      throw new PositionStoreException("Failed to write position to " + file, e);
    }
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(
          temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.debug("Atomic move not supported for {}, replacing in place", file);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  record StoredPosition(
      @JsonProperty("last_book_id") String bookId,
      @JsonProperty("last_segment_index") int segmentIndex,
      @JsonProperty("last_position_ms") long positionMs,
      @JsonProperty("last_speed") Float speed) {}
}
