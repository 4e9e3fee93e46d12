package com.scholary.audiobook.handler.playback;

import com.scholary.audiobook.handler.auth.TokenProvider;
import com.scholary.audiobook.handler.catalog.CatalogClient;
import com.scholary.audiobook.handler.config.PlaybackProperties;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Builds playback sessions wired to the library.
 *
 * <p>Each session gets its own control loop thread; the player and listener come from the caller.
 */
@Component
public class PlaybackSessionFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaybackSessionFactory.class);

  private final CatalogClient catalogClient;
  private final TokenProvider tokenProvider;
  private final PositionStore positionStore;
  private final PlaybackProperties properties;
  private final Executor resolverExecutor;

  public PlaybackSessionFactory(
      CatalogClient catalogClient,
      ObjectProvider<TokenProvider> tokenProvider,
      PositionStore positionStore,
      PlaybackProperties properties,
      @Qualifier("libraryExecutor") Executor resolverExecutor) {
    this.catalogClient = catalogClient;
    this.tokenProvider = tokenProvider.getIfAvailable();
    this.positionStore = positionStore;
    this.properties = properties;
    this.resolverExecutor = resolverExecutor;
  }

  public PlaybackController create(MediaPlayer player, PlaybackListener listener) {
    ExecutorControlLoop loop = new ExecutorControlLoop("playback-loop");
    SegmentSourceResolver resolver =
        new CatalogSegmentSourceResolver(catalogClient, tokenProvider, resolverExecutor);
    PlaybackSession session =
        new PlaybackSession(
            loop,
            player,
            resolver,
            positionStore,
            listener,
            properties.saveInterval(),
            properties.errorSkipDelay());
    LOGGER.info(
        "Created playback session: saveInterval={}, errorSkipDelay={}, auth={}",
        properties.saveInterval(),
        properties.errorSkipDelay(),
        tokenProvider != null);
    return new PlaybackController(session, loop, positionStore, properties.skipInterval());
  }
}
