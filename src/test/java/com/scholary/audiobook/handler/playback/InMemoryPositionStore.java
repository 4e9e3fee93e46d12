package com.scholary.audiobook.handler.playback;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

class InMemoryPositionStore implements PositionStore {

  final List<PlaybackPosition> saved = new ArrayList<>();
  PlaybackPosition stored;
  boolean failWrites;

  @Override
  public Optional<PlaybackPosition> load() {
    return Optional.ofNullable(stored);
  }

  @Override
  public void save(PlaybackPosition position) {
    if (failWrites) {
      throw new PositionStoreException("disk full", null);
    }
    saved.add(position);
    stored = position;
  }

  PlaybackPosition last() {
    return saved.get(saved.size() - 1);
  }
}
