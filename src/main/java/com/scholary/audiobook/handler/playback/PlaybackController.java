package com.scholary.audiobook.handler.playback;

import com.scholary.audiobook.handler.catalog.Book;
import com.scholary.audiobook.handler.catalog.LibrarySnapshot;
import com.scholary.audiobook.handler.playback.AdvanceResult.Direction;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe front of a {@link PlaybackSession}.
 *
 * <p>Each command is posted to the session's control loop; the returned future completes with the
 * command's result, or exceptionally with what it threw.
 */
public class PlaybackController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaybackController.class);

  private final PlaybackSession session;
  private final ControlLoop loop;
  private final PositionStore positionStore;
  private final Duration skipInterval;

  public PlaybackController(
      PlaybackSession session,
      ControlLoop loop,
      PositionStore positionStore,
      Duration skipInterval) {
    this.session = session;
    this.loop = loop;
    this.positionStore = positionStore;
    this.skipInterval = skipInterval;
  }

  public CompletableFuture<Void> selectBook(Book book) {
    return run(s -> {
      s.selectBook(book);
      return null;
    });
  }

  /**
   * Resume where the stored position left off.
   *
   * @return true if a saved position was found and its book is in the library
   */
  public CompletableFuture<Boolean> resumeLastSession(LibrarySnapshot library) {
    return run(
        s -> {
          Optional<PlaybackPosition> saved;
          try {
            saved = positionStore.load();
          } catch (PositionStoreException e) {
            LOGGER.error("Saved position is unreadable, starting fresh", e);
            return false;
          }
          return saved.map(position -> s.resumeFromSaved(position, library)).orElse(false);
        });
  }

  public CompletableFuture<Boolean> resumeFromSaved(
      PlaybackPosition position, LibrarySnapshot library) {
    return run(s -> s.resumeFromSaved(position, library));
  }

  public CompletableFuture<PlaybackState> playPause() {
    return run(s -> {
      s.playPause();
      return s.state();
    });
  }

  public CompletableFuture<AdvanceResult> advance(Direction direction) {
    return run(s -> s.advance(direction));
  }

  public CompletableFuture<Long> skipForward() {
    return run(s -> s.skipBy(skipInterval.toMillis()));
  }

  public CompletableFuture<Long> skipBackward() {
    return run(s -> s.skipBy(-skipInterval.toMillis()));
  }

  public CompletableFuture<Long> skipBy(long deltaMillis) {
    return run(s -> s.skipBy(deltaMillis));
  }

  public CompletableFuture<Float> setSpeed(float speed) {
    return run(s -> s.setSpeed(speed));
  }

  public CompletableFuture<PlaybackState> state() {
    return run(PlaybackSession::state);
  }

  public CompletableFuture<Optional<PlaybackPosition>> currentPosition() {
    return run(PlaybackSession::currentPosition);
  }

  public CompletableFuture<Void> shutdown() {
    CompletableFuture<Void> done = run(s -> {
      s.shutdown();
      return null;
    });
    if (loop instanceof AutoCloseable closeable) {
      return done.whenComplete((ignored, error) -> closeQuietly(closeable));
    }
    return done;
  }

  private <T> CompletableFuture<T> run(Function<PlaybackSession, T> command) {
    CompletableFuture<T> result = new CompletableFuture<>();
    loop.execute(
        () -> {
          try {
            result.complete(command.apply(session));
          } catch (RuntimeException e) {
            result.completeExceptionally(e);
          }
        });
    return result;
  }

  private static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception e) {
      LOGGER.warn("Failed to close control loop", e);
    }
  }
}
