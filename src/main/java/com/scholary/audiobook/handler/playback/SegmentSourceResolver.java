package com.scholary.audiobook.handler.playback;

import com.scholary.audiobook.handler.catalog.Segment;
import java.util.concurrent.CompletableFuture;

/** Turns a catalog segment into something the player can open. Never blocks the caller. */
public interface SegmentSourceResolver {

  CompletableFuture<PlayableSource> resolve(Segment segment);
}
