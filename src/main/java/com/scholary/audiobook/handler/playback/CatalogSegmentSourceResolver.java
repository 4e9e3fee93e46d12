package com.scholary.audiobook.handler.playback;

import com.scholary.audiobook.handler.auth.AuthExpiredException;
import com.scholary.audiobook.handler.auth.TokenProvider;
import com.scholary.audiobook.handler.catalog.CatalogClient;
import com.scholary.audiobook.handler.catalog.Segment;
import java.net.URL;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves segments through the catalog and attaches a bearer token.
 *
 * <p>When the credentials are rejected the token is invalidated and resolution is attempted exactly
 * once more. A second rejection fails the future.
 */
public class CatalogSegmentSourceResolver implements SegmentSourceResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(CatalogSegmentSourceResolver.class);

  private final CatalogClient catalogClient;
  private final TokenProvider tokenProvider;
  private final Executor executor;

  /**
   * @param tokenProvider may be null, in which case no Authorization header is sent
   */
  public CatalogSegmentSourceResolver(
      CatalogClient catalogClient, TokenProvider tokenProvider, Executor executor) {
    this.catalogClient = catalogClient;
    this.tokenProvider = tokenProvider;
    this.executor = executor;
  }

  @Override
  public CompletableFuture<PlayableSource> resolve(Segment segment) {
    return CompletableFuture.supplyAsync(() -> resolveWithReauth(segment), executor);
  }

  private PlayableSource resolveWithReauth(Segment segment) {
    try {
      return resolveOnce(segment);
    } catch (AuthExpiredException e) {
      LOGGER.warn("Credentials rejected resolving {}, re-authenticating once", segment.fileId());
      if (tokenProvider != null) {
        tokenProvider.invalidate();
      }
      return resolveOnce(segment);
    }
  }

  private PlayableSource resolveOnce(Segment segment) {
    URL url = catalogClient.resolvePlayableUrl(segment.fileId());
    if (tokenProvider == null) {
      return new PlayableSource(url, Map.of());
    }
    return new PlayableSource(url, Map.of("Authorization", "Bearer " + tokenProvider.bearerToken()));
  }
}
