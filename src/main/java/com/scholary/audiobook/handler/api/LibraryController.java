package com.scholary.audiobook.handler.api;

import com.scholary.audiobook.handler.auth.AuthException;
import com.scholary.audiobook.handler.catalog.Book;
import com.scholary.audiobook.handler.catalog.CatalogClient;
import com.scholary.audiobook.handler.catalog.LibraryService;
import com.scholary.audiobook.handler.catalog.LibrarySnapshot;
import com.scholary.audiobook.handler.catalog.Segment;
import com.scholary.audiobook.handler.objectstore.ObjectStoreException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for browsing the library.
 *
 * <p>The listing is served from the last refreshed snapshot; {@code refresh=true} (or an empty
 * snapshot) triggers a refresh first, joining one that is already running.
 */
@RestController
@Tag(name = "Library", description = "Books, segments and playable URLs")
public class LibraryController {

  private static final Logger LOGGER = LoggerFactory.getLogger(LibraryController.class);

  private final LibraryService libraryService;
  private final CatalogClient catalogClient;

  public LibraryController(LibraryService libraryService, CatalogClient catalogClient) {
    this.libraryService = libraryService;
    this.catalogClient = catalogClient;
  }

  @GetMapping("/api/books")
  @Operation(summary = "List books", description = "List the books in the library")
  public CompletableFuture<ResponseEntity<List<BookSummary>>> listBooks(
      @RequestParam(defaultValue = "false") boolean refresh) {
    LibrarySnapshot current = libraryService.current();
    if (!refresh && current.isLoaded()) {
      return CompletableFuture.completedFuture(ResponseEntity.ok(toSummaries(current)));
    }

    return libraryService
        .refresh()
        .handle(
            (snapshot, error) -> {
              if (error != null) {
                LOGGER.error("Library refresh failed", error);
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .<List<BookSummary>>build();
              }
              return ResponseEntity.ok(toSummaries(snapshot));
            });
  }

  @GetMapping("/api/books/{bookId}")
  @Operation(summary = "Get book", description = "Get one book with its segments")
  public ResponseEntity<Book> getBook(@PathVariable String bookId) {
    try {
      return catalogClient
          .findBook(bookId)
          .map(ResponseEntity::ok)
          .orElse(ResponseEntity.notFound().build());
    } catch (AuthException | ObjectStoreException e) {
      LOGGER.error("Failed to read book {}", bookId, e);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }

  @GetMapping("/api/books/{bookId}/segments/{index}/url")
  @Operation(
      summary = "Get playable URL",
      description = "Presign a URL for the segment at the given 0-based index")
  public ResponseEntity<SegmentUrlResponse> getSegmentUrl(
      @PathVariable String bookId, @PathVariable int index) {
    try {
      Optional<Book> book = catalogClient.findBook(bookId);
      if (book.isEmpty() || index < 0 || index >= book.get().segmentCount()) {
        return ResponseEntity.notFound().build();
      }

      Segment segment = book.get().segments().get(index);
      String url = catalogClient.resolvePlayableUrl(segment.fileId()).toString();
      return ResponseEntity.ok(new SegmentUrlResponse(segment.fileId(), segment.displayName(), url));

    } catch (AuthException | ObjectStoreException e) {
      LOGGER.error("Failed to resolve segment {} of {}", index, bookId, e);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }

  private static List<BookSummary> toSummaries(LibrarySnapshot snapshot) {
    return snapshot.books().stream().map(BookSummary::of).toList();
  }
}
