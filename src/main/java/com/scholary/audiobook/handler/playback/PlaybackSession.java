package com.scholary.audiobook.handler.playback;

import com.scholary.audiobook.handler.catalog.Book;
import com.scholary.audiobook.handler.catalog.LibrarySnapshot;
import com.scholary.audiobook.handler.catalog.Segment;
import com.scholary.audiobook.handler.logging.StructuredLogger;
import com.scholary.audiobook.handler.playback.AdvanceResult.Direction;
import com.scholary.audiobook.handler.playback.AdvanceResult.Outcome;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one media player through the segments of one book.
 *
 * <p>Every method must be called on the session's {@link ControlLoop}. Player callbacks and
 * resolver completions arrive from other threads; they are posted to the loop stamped with the load
 * generation that produced them, and dropped if another load has started since. That is what keeps
 * a late completion for an abandoned segment from overwriting a newer selection.
 *
 * <p>Position is only written for a segment whose load the player confirmed with READY: at that
 * confirmation, every few seconds while playing, and on pause, speed change, finish and shutdown.
 *
 * <p>On a playback error the session waits a short delay and skips to the next segment, at most once
 * per failing load. An error on the last segment is terminal.
 */
public class PlaybackSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaybackSession.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ControlLoop loop;
  private final MediaPlayer player;
  private final SegmentSourceResolver resolver;
  private final PositionStore positionStore;
  private final PlaybackListener listener;
  private final Duration saveInterval;
  private final Duration errorSkipDelay;

  private Book book;
  private int segmentIndex;
  private PlaybackState state = PlaybackState.IDLE;
  private float speed = 1.0f;

  // Bumped on every load; stale callbacks carry an older value
  private long generation;
  private volatile long playerGeneration;
  private boolean loadConfirmed;
  private boolean errorHandled;
  private boolean playWhenReady;
  private Long pendingSeekMs;
  private CompletableFuture<PlayableSource> pendingResolve;
  private Cancellable trackingTimer;
  private Cancellable pendingErrorSkip;
  private boolean shutDown;

  public PlaybackSession(
      ControlLoop loop,
      MediaPlayer player,
      SegmentSourceResolver resolver,
      PositionStore positionStore,
      PlaybackListener listener,
      Duration saveInterval,
      Duration errorSkipDelay) {
    this.loop = loop;
    this.player = player;
    this.resolver = resolver;
    this.positionStore = positionStore;
    this.listener = listener;
    this.saveInterval = saveInterval;
    this.errorSkipDelay = errorSkipDelay;

    player.setListener(
        new MediaPlayer.Listener() {
          @Override
          public void onStateChanged(MediaPlayer.State playerState) {
            long stamp = playerGeneration;
            loop.execute(() -> handlePlayerState(stamp, playerState));
          }

          @Override
          public void onError(String message) {
            long stamp = playerGeneration;
            loop.execute(() -> handleError(stamp, message));
          }
        });
  }

  /** Make a book current and load its first segment, paused. */
  public void selectBook(Book newBook) {
    ensureActive();
    if (newBook == null) {
      throw new IllegalArgumentException("Book is required");
    }
    LOGGER.info("Selecting book {} ({} segments)", newBook.id(), newBook.segmentCount());
    book = newBook;
    segmentIndex = 0;
    pendingSeekMs = null;
    loadSegment(false);
  }

  /**
   * Restore a saved position against the current library.
   *
   * @return false, with nothing changed, when the saved book is no longer in the library
   */
  public boolean resumeFromSaved(PlaybackPosition position, LibrarySnapshot library) {
    ensureActive();
    Optional<Book> found = library.find(position.bookId());
    if (found.isEmpty()) {
      LOGGER.info("Saved book {} is not in the library, not resuming", position.bookId());
      return false;
    }

    book = found.get();
    int lastIndex = book.segmentCount() - 1;
    if (position.segmentIndex() > lastIndex) {
      LOGGER.warn(
          "Saved segment {} is beyond book {} ({} segments), resuming at the last one",
          position.segmentIndex(),
          book.id(),
          book.segmentCount());
    }
    segmentIndex = Math.min(position.segmentIndex(), lastIndex);
    speed = PlaybackPosition.clampSpeed(position.playbackSpeed());
    pendingSeekMs = position.offsetMillis() > 0 ? position.offsetMillis() : null;

    LOGGER.info(
        "Resuming book {} at segment {}, offset {}ms", book.id(), segmentIndex, pendingSeekMs);
    loadSegment(false);
    return true;
  }

  /** Toggle play and pause, loading or replaying the current segment where needed. */
  public void playPause() {
    ensureActive();
    requireBook();

    switch (state) {
      case PLAYING -> {
        player.pause();
        stopTracking();
        transition(PlaybackState.PAUSED);
        persist();
      }
      case READY, PAUSED -> startPlaying();
      case LOADING -> {
        playWhenReady = !playWhenReady;
        LOGGER.debug("Play when ready is now {}", playWhenReady);
      }
      case IDLE, ERROR -> loadSegment(true);
      case ENDED, FINISHED -> {
        if (loadConfirmed) {
          seekQuietly(0);
          startPlaying();
        } else {
          loadSegment(true);
        }
      }
    }
  }

  /**
   * Move one segment forward or back, loading the new segment paused.
   *
   * <p>Moving past either end of the book changes nothing.
   */
  public AdvanceResult advance(Direction direction) {
    ensureActive();
    requireBook();

    int target = direction == Direction.NEXT ? segmentIndex + 1 : segmentIndex - 1;
    if (target < 0) {
      return new AdvanceResult(Outcome.AT_BOOK_START, segmentIndex);
    }
    if (target >= book.segmentCount()) {
      return new AdvanceResult(Outcome.AT_BOOK_END, segmentIndex);
    }

    segmentIndex = target;
    pendingSeekMs = null;
    loadSegment(false);
    return new AdvanceResult(Outcome.MOVED, segmentIndex);
  }

  /**
   * Seek relative to the current position. The target is never below 0; the upper end is left to
   * the player.
   *
   * @return the requested target position
   */
  public long skipBy(long deltaMillis) {
    ensureActive();
    requireBook();
    if (!loadConfirmed) {
      throw new PlaybackStateException("No segment loaded");
    }

    long target = Math.max(0, player.currentPositionMs() + deltaMillis);
    try {
      player.seekTo(target);
    } catch (SeekRejectedException e) {
      LOGGER.warn("Player rejected seek to {}ms: {}", target, e.getMessage());
    }
    return target;
  }

  /**
   * Apply a playback speed, clamped to the supported range.
   *
   * @return the speed actually applied
   * @throws IllegalArgumentException for NaN
   */
  public float setSpeed(float requested) {
    ensureActive();
    speed = PlaybackPosition.clampSpeed(requested);
    player.setSpeed(speed);
    persist();
    return speed;
  }

  /** Cancel in-flight work, save the confirmed position and stop the player. */
  public void shutdown() {
    if (shutDown) {
      return;
    }
    LOGGER.info("Shutting down playback session");
    persist();
    cancelInFlight();
    generation++;
    playerGeneration = generation;
    player.stop();
    shutDown = true;
  }

  public PlaybackState state() {
    return state;
  }

  public Optional<Book> currentBook() {
    return Optional.ofNullable(book);
  }

  public int segmentIndex() {
    return segmentIndex;
  }

  public float speed() {
    return speed;
  }

  /** The position a save right now would write, if the current segment is confirmed. */
  public Optional<PlaybackPosition> currentPosition() {
    if (book == null || !loadConfirmed) {
      return Optional.empty();
    }
    return Optional.of(
        new PlaybackPosition(
            book.id(), segmentIndex, Math.max(0, player.currentPositionMs()), speed));
  }

  private void loadSegment(boolean autoPlay) {
    if (loadConfirmed) {
      player.stop();
    }
    cancelInFlight();
    generation++;
    loadConfirmed = false;
    errorHandled = false;
    playWhenReady = autoPlay;
    transition(PlaybackState.LOADING);

    long stamp = generation;
    Segment segment = book.segments().get(segmentIndex);
    LOGGER.debug(
        "Loading segment {}/{} of {}: {}",
        segmentIndex + 1,
        book.segmentCount(),
        book.id(),
        segment.fileId());

    CompletableFuture<PlayableSource> resolving;
    try {
      resolving = resolver.resolve(segment);
    } catch (RuntimeException e) {
      handleError(stamp, "Could not resolve segment: " + e.getMessage());
      return;
    }
    pendingResolve = resolving;
    resolving.whenComplete(
        (source, error) -> loop.execute(() -> handleResolved(stamp, source, error)));
  }

  private void handleResolved(long stamp, PlayableSource source, Throwable error) {
    if (stamp != generation) {
      LOGGER.debug("Discarding stale source resolution for generation {}", stamp);
      return;
    }
    pendingResolve = null;

    if (error != null) {
      Throwable cause = error.getCause() != null ? error.getCause() : error;
      handleError(stamp, "Could not resolve segment: " + cause.getMessage());
      return;
    }

    playerGeneration = stamp;
    player.load(source);
    player.setSpeed(speed);
    player.prepare();
  }

  private void handlePlayerState(long stamp, MediaPlayer.State playerState) {
    if (stamp != generation || shutDown) {
      LOGGER.debug("Discarding stale player state {} for generation {}", playerState, stamp);
      return;
    }
    if (errorHandled) {
      LOGGER.debug("Ignoring player state {} after an error on this segment", playerState);
      return;
    }

    switch (playerState) {
      case READY -> onPlayerReady();
      case ENDED -> {
        if (state == PlaybackState.PLAYING
            || state == PlaybackState.PAUSED
            || state == PlaybackState.READY) {
          onSegmentEnded();
        }
      }
      case BUFFERING, IDLE -> LOGGER.debug("Player reports {}", playerState);
    }
  }

  private void onPlayerReady() {
    if (loadConfirmed) {
      // Ready again after a rebuffer
      return;
    }
    loadConfirmed = true;

    if (pendingSeekMs != null) {
      seekQuietly(pendingSeekMs);
      pendingSeekMs = null;
    }
    persist();

    if (playWhenReady) {
      startPlaying();
    } else {
      transition(PlaybackState.READY);
    }
  }

  private void onSegmentEnded() {
    // A segment can also run out while paused, e.g. a resume offset at its very end
    boolean wasPlaying = state == PlaybackState.PLAYING;
    stopTracking();
    transition(PlaybackState.ENDED);

    if (segmentIndex < book.segmentCount() - 1) {
      segmentIndex++;
      pendingSeekMs = null;
      loadSegment(wasPlaying);
      return;
    }

    LOGGER.info("Finished book {}", book.id());
    transition(PlaybackState.FINISHED);
    persist();
  }

  private void handleError(long stamp, String message) {
    if (stamp != generation || shutDown) {
      LOGGER.debug("Discarding stale error for generation {}: {}", stamp, message);
      return;
    }
    if (errorHandled) {
      LOGGER.debug("Ignoring repeated error for generation {}: {}", stamp, message);
      return;
    }
    if (state == PlaybackState.FINISHED) {
      LOGGER.debug("Ignoring player error after the book finished: {}", message);
      return;
    }
    errorHandled = true;

    boolean continuePlaying = playWhenReady || state == PlaybackState.PLAYING;
    stopTracking();
    transition(PlaybackState.ERROR);
    listener.onNotice(
        new PlaybackNotice(PlaybackNotice.Kind.PLAYBACK_ERROR, "Playback error: " + message));

    pendingErrorSkip =
        loop.schedule(() -> skipAfterError(stamp, message, continuePlaying), errorSkipDelay);
  }

  private void skipAfterError(long stamp, String message, boolean continuePlaying) {
    if (stamp != generation) {
      return;
    }
    pendingErrorSkip = null;

    boolean last = segmentIndex >= book.segmentCount() - 1;
    structuredLogger.logPlaybackErrorSkip(book.id(), segmentIndex, last, message);
    if (last) {
      listener.onNotice(
          new PlaybackNotice(
              PlaybackNotice.Kind.TERMINAL_ERROR,
              "Playback failed on the last segment of " + book.displayName()));
      return;
    }

    listener.onNotice(
        new PlaybackNotice(PlaybackNotice.Kind.SKIPPING_SEGMENT, "Skipping to next segment"));
    segmentIndex++;
    pendingSeekMs = null;
    loadSegment(continuePlaying);
  }

  private void startPlaying() {
    player.play();
    transition(PlaybackState.PLAYING);
    startTracking();
  }

  private void startTracking() {
    stopTracking();
    trackingTimer = loop.scheduleAtFixedRate(this::persist, saveInterval, saveInterval);
  }

  private void stopTracking() {
    if (trackingTimer != null) {
      trackingTimer.cancel();
      trackingTimer = null;
    }
  }

  private void cancelInFlight() {
    stopTracking();
    if (pendingErrorSkip != null) {
      pendingErrorSkip.cancel();
      pendingErrorSkip = null;
    }
    if (pendingResolve != null) {
      pendingResolve.cancel(false);
      pendingResolve = null;
    }
  }

  private void seekQuietly(long positionMs) {
    try {
      player.seekTo(positionMs);
    } catch (SeekRejectedException e) {
      LOGGER.warn("Player rejected seek to {}ms, starting from 0: {}", positionMs, e.getMessage());
      player.seekTo(0);
    }
  }

  private void persist() {
    Optional<PlaybackPosition> position = currentPosition();
    if (position.isEmpty()) {
      return;
    }

    PlaybackPosition toSave = position.get();
    try {
      positionStore.save(toSave);
      structuredLogger.logPositionSaved(
          toSave.bookId(), toSave.segmentIndex(), toSave.offsetMillis(), toSave.playbackSpeed());
    } catch (PositionStoreException e) {
      LOGGER.error("Failed to save playback position, continuing playback", e);
    }
  }

  private void transition(PlaybackState next) {
    if (state == next) {
      return;
    }
    PlaybackState previous = state;
    state = next;
    structuredLogger.logPlaybackTransition(
        book == null ? null : book.id(), segmentIndex, previous, next);
    listener.onStateChanged(previous, next);
  }

  private void requireBook() {
    if (book == null) {
      throw new NoBookSelectedException();
    }
  }

  private void ensureActive() {
    if (shutDown) {
      throw new PlaybackStateException("Session is shut down");
    }
  }
}
