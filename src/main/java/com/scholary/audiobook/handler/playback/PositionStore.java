package com.scholary.audiobook.handler.playback;

import java.util.Optional;

/**
 * Persists the single resumable position.
 *
 * <p>Writes are last-write-wins. Saving the value already stored is a no-op.
 */
public interface PositionStore {

  /**
   * @throws PositionStoreException if the stored value exists but cannot be read
   */
  Optional<PlaybackPosition> load();

  /**
   * @throws PositionStoreException if the value cannot be written
   */
  void save(PlaybackPosition position);
}
