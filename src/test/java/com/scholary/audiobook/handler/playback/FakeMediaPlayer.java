package com.scholary.audiobook.handler.playback;

import java.util.ArrayList;
import java.util.List;

/** Records what the session asks of it; the test decides which callbacks fire. */
class FakeMediaPlayer implements MediaPlayer {

  final List<PlayableSource> loaded = new ArrayList<>();
  final List<String> calls = new ArrayList<>();

  long positionMs;
  long durationMs = Long.MAX_VALUE;
  float speed = 1.0f;
  boolean playing;

  private Listener listener;

  @Override
  public void setListener(Listener listener) {
    this.listener = listener;
  }

  @Override
  public void load(PlayableSource source) {
    loaded.add(source);
    positionMs = 0;
    playing = false;
    calls.add("load");
  }

  @Override
  public void prepare() {
    calls.add("prepare");
  }

  @Override
  public void play() {
    playing = true;
    calls.add("play");
  }

  @Override
  public void pause() {
    playing = false;
    calls.add("pause");
  }

  @Override
  public void stop() {
    playing = false;
    calls.add("stop");
  }

  @Override
  public void seekTo(long target) {
    if (target > durationMs) {
      throw new SeekRejectedException("Beyond end of media: " + target);
    }
    positionMs = target;
    calls.add("seek:" + target);
  }

  @Override
  public long currentPositionMs() {
    return positionMs;
  }

  @Override
  public void setSpeed(float speed) {
    this.speed = speed;
  }

  void emit(State state) {
    listener.onStateChanged(state);
  }

  void fail(String message) {
    listener.onError(message);
  }
}
