package com.scholary.audiobook.handler.playback;

import java.util.ArrayList;
import java.util.List;

class RecordingPlaybackListener implements PlaybackListener {

  final List<PlaybackState> states = new ArrayList<>();
  final List<PlaybackNotice> notices = new ArrayList<>();

  @Override
  public void onStateChanged(PlaybackState previous, PlaybackState current) {
    states.add(current);
  }

  @Override
  public void onNotice(PlaybackNotice notice) {
    notices.add(notice);
  }

  List<PlaybackNotice.Kind> noticeKinds() {
    return notices.stream().map(PlaybackNotice::kind).toList();
  }
}
