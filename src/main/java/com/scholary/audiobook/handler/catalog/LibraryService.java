package com.scholary.audiobook.handler.catalog;

import com.scholary.audiobook.handler.auth.AuthExpiredException;
import com.scholary.audiobook.handler.auth.TokenProvider;
import com.scholary.audiobook.handler.objectstore.ObjectStoreException;
import com.scholary.audiobook.handler.retry.BackoffPolicy;
import com.scholary.audiobook.handler.retry.RetryScheduler;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a snapshot of the library and refreshes it on demand.
 *
 * <p>Refreshes are single-flight: while one is running, further triggers get the same future back.
 * Transient store failures are retried with backoff; an auth failure invalidates the token and is
 * retried exactly once. A failed refresh leaves the previous snapshot in place.
 */
public class LibraryService {

  private static final Logger LOGGER = LoggerFactory.getLogger(LibraryService.class);

  private final CatalogClient catalogClient;
  private final TokenProvider tokenProvider;
  private final RetryScheduler retryScheduler;
  private final BackoffPolicy backoffPolicy;
  private final Clock clock;

  private final AtomicReference<CompletableFuture<LibrarySnapshot>> inFlight =
      new AtomicReference<>();
  private final AtomicReference<LibrarySnapshot> latest =
      new AtomicReference<>(LibrarySnapshot.EMPTY);

  /**
   * @param tokenProvider may be null when the library needs no bearer token
   */
  public LibraryService(
      CatalogClient catalogClient,
      TokenProvider tokenProvider,
      RetryScheduler retryScheduler,
      BackoffPolicy backoffPolicy,
      Clock clock) {
    this.catalogClient = catalogClient;
    this.tokenProvider = tokenProvider;
    this.retryScheduler = retryScheduler;
    this.backoffPolicy = backoffPolicy;
    this.clock = clock;
  }

  /** Start a refresh, or join the one already running. */
  public CompletableFuture<LibrarySnapshot> refresh() {
    while (true) {
      CompletableFuture<LibrarySnapshot> running = inFlight.get();
      if (running != null) {
        LOGGER.debug("Library refresh already in flight, joining it");
        return running;
      }

      CompletableFuture<LibrarySnapshot> created = new CompletableFuture<>();
      if (inFlight.compareAndSet(null, created)) {
        start(created);
        return created;
      }
    }
  }

  /** The last successfully loaded snapshot, empty before the first refresh completes. */
  public LibrarySnapshot current() {
    return latest.get();
  }

  public boolean isRefreshing() {
    return inFlight.get() != null;
  }

  private void start(CompletableFuture<LibrarySnapshot> created) {
    LOGGER.info("Refreshing library");
    retryScheduler
        .submit("Library refresh", this::loadWithReauth, LibraryService::isTransient, backoffPolicy)
        .whenComplete(
            (snapshot, error) -> {
              inFlight.compareAndSet(created, null);
              if (error != null) {
                LOGGER.error("Library refresh failed, keeping previous snapshot", error);
                created.completeExceptionally(error);
                return;
              }
              latest.set(snapshot);
              LOGGER.info("Library refreshed: {} books", snapshot.books().size());
              created.complete(snapshot);
            });
  }

  private LibrarySnapshot loadWithReauth() {
    try {
      return load();
    } catch (AuthExpiredException e) {
      LOGGER.warn("Library listing rejected credentials, re-authenticating once", e);
      if (tokenProvider != null) {
        tokenProvider.invalidate();
      }
      return load();
    }
  }

  private LibrarySnapshot load() {
    List<Book> books = catalogClient.listBooks();
    return new LibrarySnapshot(books, clock.instant());
  }

  private static boolean isTransient(Throwable error) {
    return error instanceof ObjectStoreException e && e.isTransient();
  }
}
