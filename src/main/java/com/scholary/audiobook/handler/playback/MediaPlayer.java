package com.scholary.audiobook.handler.playback;

/**
 * The streaming player a session drives.
 *
 * <p>Decoding and rendering are the player's business. Listener callbacks may arrive on any thread;
 * the session moves them onto its control loop before acting on them.
 */
public interface MediaPlayer {

  enum State {
    IDLE,
    BUFFERING,
    READY,
    ENDED
  }

  interface Listener {

    void onStateChanged(State state);

    void onError(String message);
  }

  void setListener(Listener listener);

  /** Replace the current source. Playback stops until {@link #prepare()} and {@link #play()}. */
  void load(PlayableSource source);

  void prepare();

  void play();

  void pause();

  void stop();

  /**
   * @throws SeekRejectedException if the position is outside the loaded media
   */
  void seekTo(long positionMs);

  long currentPositionMs();

  void setSpeed(float speed);
}
