package com.scholary.audiobook.handler.playback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiobook.handler.catalog.Book;
import com.scholary.audiobook.handler.catalog.LibrarySnapshot;
import com.scholary.audiobook.handler.catalog.Segment;
import com.scholary.audiobook.handler.playback.AdvanceResult.Direction;
import com.scholary.audiobook.handler.playback.AdvanceResult.Outcome;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlaybackSessionTest {

  private static final Duration SAVE_INTERVAL = Duration.ofSeconds(5);
  private static final Duration ERROR_SKIP_DELAY = Duration.ofSeconds(2);

  private final Book mistborn =
      new Book(
          "mistborn",
          "Mistborn",
          List.of(
              new Segment("audiobooks/mistborn/mistborn_segment_01.mp3", "Mistborn - Segment 01", 3600, 1),
              new Segment("audiobooks/mistborn/mistborn_segment_02.mp3", "Mistborn - Segment 02", 3600, 1),
              new Segment("audiobooks/mistborn/mistborn_segment_03.mp3", "Mistborn - Segment 03", 1800, 1)),
          null);

  private ManualControlLoop loop;
  private FakeMediaPlayer player;
  private FakeSegmentSourceResolver resolver;
  private InMemoryPositionStore store;
  private RecordingPlaybackListener listener;
  private PlaybackSession session;

  @BeforeEach
  void setUp() {
    loop = new ManualControlLoop();
    player = new FakeMediaPlayer();
    resolver = new FakeSegmentSourceResolver();
    store = new InMemoryPositionStore();
    listener = new RecordingPlaybackListener();
    session =
        new PlaybackSession(
            loop, player, resolver, store, listener, SAVE_INTERVAL, ERROR_SKIP_DELAY);
  }

  @Test
  void selectBook_shouldLoadFirstSegmentPausedAndSaveOnReady() {
    session.selectBook(mistborn);
    assertThat(session.state()).isEqualTo(PlaybackState.LOADING);
    assertThat(store.saved).isEmpty();

    loadCurrentSegment();

    assertThat(session.state()).isEqualTo(PlaybackState.READY);
    assertThat(player.loaded).hasSize(1);
    assertThat(player.playing).isFalse();
    assertThat(store.last()).isEqualTo(new PlaybackPosition("mistborn", 0, 0, 1.0f));
    assertThat(listener.states)
        .containsExactly(PlaybackState.LOADING, PlaybackState.READY);
  }

  @Test
  void playPause_shouldSavePeriodicallyOnlyWhilePlaying() {
    selectAndLoad();

    session.playPause();
    assertThat(session.state()).isEqualTo(PlaybackState.PLAYING);

    player.positionMs = 5_000;
    loop.advance(SAVE_INTERVAL);
    assertThat(store.last().offsetMillis()).isEqualTo(5_000);

    player.positionMs = 7_500;
    session.playPause();
    assertThat(session.state()).isEqualTo(PlaybackState.PAUSED);
    assertThat(store.last().offsetMillis()).isEqualTo(7_500);
    assertThat(loop.activeTimers()).isZero();

    int savesWhilePaused = store.saved.size();
    loop.advance(Duration.ofSeconds(30));
    assertThat(store.saved).hasSize(savesWhilePaused);
  }

  @Test
  void playPause_whileLoadingShouldStartPlaybackOnReady() {
    session.selectBook(mistborn);
    session.playPause();

    loadCurrentSegment();

    assertThat(session.state()).isEqualTo(PlaybackState.PLAYING);
    assertThat(player.playing).isTrue();
  }

  @Test
  void playPause_shouldRequireBook() {
    assertThatThrownBy(() -> session.playPause())
        .isInstanceOf(NoBookSelectedException.class)
        .hasMessage("No book selected");
  }

  @Test
  void resumeFromSaved_shouldClampSegmentIndexAndSeekAfterReady() {
    LibrarySnapshot library = new LibrarySnapshot(List.of(mistborn), Instant.now());

    boolean resumed =
        session.resumeFromSaved(new PlaybackPosition("mistborn", 7, 125_000, 1.25f), library);

    assertThat(resumed).isTrue();
    assertThat(session.segmentIndex()).isEqualTo(2);
    assertThat(player.calls).doesNotContain("seek:125000");

    loadCurrentSegment();

    assertThat(player.positionMs).isEqualTo(125_000);
    assertThat(player.speed).isEqualTo(1.25f);
    assertThat(store.last()).isEqualTo(new PlaybackPosition("mistborn", 2, 125_000, 1.25f));
    assertThat(session.state()).isEqualTo(PlaybackState.READY);
  }

  @Test
  void resumeFromSaved_shouldStartFromZeroWhenSeekIsRejected() {
    LibrarySnapshot library = new LibrarySnapshot(List.of(mistborn), Instant.now());
    player.durationMs = 60_000;

    session.resumeFromSaved(new PlaybackPosition("mistborn", 1, 90_000, 1.0f), library);
    loadCurrentSegment();

    assertThat(player.positionMs).isZero();
    assertThat(session.state()).isEqualTo(PlaybackState.READY);
  }

  @Test
  void resumeFromSaved_shouldDeclineBookMissingFromLibrary() {
    LibrarySnapshot library = new LibrarySnapshot(List.of(mistborn), Instant.now());

    boolean resumed =
        session.resumeFromSaved(new PlaybackPosition("elantris", 0, 10, 1.0f), library);

    assertThat(resumed).isFalse();
    assertThat(session.state()).isEqualTo(PlaybackState.IDLE);
    assertThat(session.currentBook()).isEmpty();
    assertThat(resolver.requested).isEmpty();
  }

  @Test
  void advance_shouldStopAtBothEndsOfBook() {
    selectAndLoad();

    AdvanceResult atStart = session.advance(Direction.PREVIOUS);
    assertThat(atStart).isEqualTo(new AdvanceResult(Outcome.AT_BOOK_START, 0));
    assertThat(resolver.requested).hasSize(1);

    assertThat(session.advance(Direction.NEXT).moved()).isTrue();
    loadCurrentSegment();
    assertThat(session.advance(Direction.NEXT).segmentIndex()).isEqualTo(2);
    loadCurrentSegment();

    AdvanceResult atEnd = session.advance(Direction.NEXT);
    assertThat(atEnd).isEqualTo(new AdvanceResult(Outcome.AT_BOOK_END, 2));
    assertThat(session.state()).isEqualTo(PlaybackState.READY);
  }

  @Test
  void advance_shouldDiscardLateResolutionOfAbandonedSegment() {
    session.selectBook(mistborn);
    session.advance(Direction.NEXT);

    assertThat(resolver.pending.get(0)).isCancelled();
    resolver.complete(1);
    loop.runPending();

    assertThat(player.loaded)
        .extracting(source -> source.url().getPath())
        .containsExactly("/audiobooks/mistborn/mistborn_segment_02.mp3");
  }

  @Test
  void advance_shouldIgnoreReadyFromPreviousLoad() {
    selectAndLoad();
    session.advance(Direction.NEXT);

    player.emit(MediaPlayer.State.READY);
    loop.runPending();

    assertThat(session.state()).isEqualTo(PlaybackState.LOADING);
    assertThat(store.last().segmentIndex()).isZero();
  }

  @Test
  void segmentEnd_shouldContinueIntoNextSegmentAndFinishAfterLast() {
    selectAndLoad();
    session.playPause();

    player.emit(MediaPlayer.State.ENDED);
    loop.runPending();
    assertThat(session.segmentIndex()).isEqualTo(1);
    loadCurrentSegment();
    assertThat(session.state()).isEqualTo(PlaybackState.PLAYING);

    session.advance(Direction.NEXT);
    loadCurrentSegment();
    session.playPause();
    player.positionMs = 1_800_000;
    player.emit(MediaPlayer.State.ENDED);
    loop.runPending();

    assertThat(session.state()).isEqualTo(PlaybackState.FINISHED);
    assertThat(store.last()).isEqualTo(new PlaybackPosition("mistborn", 2, 1_800_000, 1.0f));
    assertThat(listener.states).contains(PlaybackState.ENDED);
  }

  @Test
  void segmentEnd_whilePausedShouldPrepareNextSegmentWithoutPlaying() {
    selectAndLoad();
    assertThat(session.state()).isEqualTo(PlaybackState.READY);

    player.emit(MediaPlayer.State.ENDED);
    loop.runPending();
    assertThat(session.segmentIndex()).isEqualTo(1);
    loadCurrentSegment();

    assertThat(session.state()).isEqualTo(PlaybackState.READY);
    assertThat(player.playing).isFalse();
    assertThat(loop.activeTimers()).isZero();
  }

  @Test
  void playerError_afterFinishShouldBeIgnored() {
    selectAndLoad();
    session.advance(Direction.NEXT);
    loadCurrentSegment();
    session.advance(Direction.NEXT);
    loadCurrentSegment();
    session.playPause();
    player.emit(MediaPlayer.State.ENDED);
    loop.runPending();
    assertThat(session.state()).isEqualTo(PlaybackState.FINISHED);

    player.fail("late decoder error");
    loop.runPending();
    loop.advance(ERROR_SKIP_DELAY);

    assertThat(session.state()).isEqualTo(PlaybackState.FINISHED);
    assertThat(listener.notices).isEmpty();
  }

  @Test
  void playPause_afterFinishShouldReplayFromStart() {
    selectAndLoad();
    session.advance(Direction.NEXT);
    loadCurrentSegment();
    session.advance(Direction.NEXT);
    loadCurrentSegment();
    session.playPause();
    player.positionMs = 1_000;
    player.emit(MediaPlayer.State.ENDED);
    loop.runPending();

    session.playPause();

    assertThat(session.state()).isEqualTo(PlaybackState.PLAYING);
    assertThat(player.positionMs).isZero();
  }

  @Test
  void playerError_shouldSkipToNextSegmentAfterDelay() {
    selectAndLoad();
    session.playPause();

    player.fail("decoder exploded");
    loop.runPending();

    assertThat(session.state()).isEqualTo(PlaybackState.ERROR);
    assertThat(listener.notices.get(0).message()).isEqualTo("Playback error: decoder exploded");
    assertThat(session.segmentIndex()).isZero();

    loop.advance(ERROR_SKIP_DELAY);

    assertThat(listener.noticeKinds())
        .containsExactly(PlaybackNotice.Kind.PLAYBACK_ERROR, PlaybackNotice.Kind.SKIPPING_SEGMENT);
    assertThat(session.segmentIndex()).isEqualTo(1);
    loadCurrentSegment();
    assertThat(session.state()).isEqualTo(PlaybackState.PLAYING);
  }

  @Test
  void playerError_shouldBeHandledOncePerLoad() {
    selectAndLoad();

    player.fail("first");
    player.fail("second");
    player.emit(MediaPlayer.State.READY);
    loop.advance(ERROR_SKIP_DELAY);

    assertThat(listener.noticeKinds())
        .containsExactly(PlaybackNotice.Kind.PLAYBACK_ERROR, PlaybackNotice.Kind.SKIPPING_SEGMENT);
    assertThat(session.segmentIndex()).isEqualTo(1);
    assertThat(resolver.requested).hasSize(2);
  }

  @Test
  void playerError_onLastSegmentShouldBeTerminal() {
    selectAndLoad();
    session.advance(Direction.NEXT);
    loadCurrentSegment();
    session.advance(Direction.NEXT);
    loadCurrentSegment();

    player.fail("corrupt frame");
    loop.advance(ERROR_SKIP_DELAY);

    assertThat(listener.noticeKinds())
        .containsExactly(PlaybackNotice.Kind.PLAYBACK_ERROR, PlaybackNotice.Kind.TERMINAL_ERROR);
    assertThat(listener.notices.get(1).message())
        .isEqualTo("Playback failed on the last segment of Mistborn");
    assertThat(session.segmentIndex()).isEqualTo(2);
    assertThat(session.state()).isEqualTo(PlaybackState.ERROR);
  }

  @Test
  void resolveFailure_shouldBeTreatedAsPlaybackError() {
    session.selectBook(mistborn);
    resolver.failLatest(new IllegalStateException("presign failed"));
    loop.runPending();

    assertThat(session.state()).isEqualTo(PlaybackState.ERROR);
    assertThat(listener.notices.get(0).message())
        .isEqualTo("Playback error: Could not resolve segment: presign failed");
  }

  @Test
  void selectingAnotherBookShouldCancelPendingErrorSkip() {
    selectAndLoad();
    player.fail("boom");
    loop.runPending();

    session.selectBook(mistborn);
    loop.advance(ERROR_SKIP_DELAY);

    assertThat(listener.noticeKinds()).containsExactly(PlaybackNotice.Kind.PLAYBACK_ERROR);
    assertThat(session.segmentIndex()).isZero();
  }

  @Test
  void skipBy_shouldClampAtZeroAndTolerateRejectedSeek() {
    selectAndLoad();
    player.positionMs = 10_000;
    player.durationMs = 60_000;

    assertThat(session.skipBy(-30_000)).isZero();
    assertThat(player.positionMs).isZero();

    assertThat(session.skipBy(90_000)).isEqualTo(90_000);
    assertThat(player.positionMs).isZero();
  }

  @Test
  void skipBy_shouldRequireConfirmedLoad() {
    session.selectBook(mistborn);

    assertThatThrownBy(() -> session.skipBy(30_000)).isInstanceOf(PlaybackStateException.class);
  }

  @Test
  void setSpeed_shouldClampApplyAndSave() {
    selectAndLoad();

    assertThat(session.setSpeed(3.0f)).isEqualTo(2.0f);
    assertThat(player.speed).isEqualTo(2.0f);
    assertThat(store.last().playbackSpeed()).isEqualTo(2.0f);

    assertThat(session.setSpeed(0.1f)).isEqualTo(0.5f);
    assertThatThrownBy(() -> session.setSpeed(Float.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void saveFailure_shouldNotInterruptPlayback() {
    selectAndLoad();
    store.failWrites = true;

    session.playPause();
    loop.advance(SAVE_INTERVAL);

    assertThat(session.state()).isEqualTo(PlaybackState.PLAYING);
  }

  @Test
  void shutdown_shouldSavePositionStopPlayerAndRejectCommands() {
    selectAndLoad();
    session.playPause();
    player.positionMs = 42_000;

    session.shutdown();

    assertThat(store.last().offsetMillis()).isEqualTo(42_000);
    assertThat(player.calls).endsWith("stop");
    assertThat(loop.activeTimers()).isZero();
    assertThatThrownBy(() -> session.playPause()).isInstanceOf(PlaybackStateException.class);
  }

  private void selectAndLoad() {
    session.selectBook(mistborn);
    loadCurrentSegment();
  }

  private void loadCurrentSegment() {
    resolver.completeLatest();
    loop.runPending();
    player.emit(MediaPlayer.State.READY);
    loop.runPending();
  }
}
