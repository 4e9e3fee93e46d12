package com.scholary.audiobook.handler.playback;

/** Receives state changes and notices from a session, on the session's control loop. */
public interface PlaybackListener {

  void onStateChanged(PlaybackState previous, PlaybackState current);

  void onNotice(PlaybackNotice notice);
}
