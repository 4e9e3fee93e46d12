package com.scholary.audiobook.handler.catalog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** The library as of one successful refresh. */
public record LibrarySnapshot(List<Book> books, Instant refreshedAt) {

  public static final LibrarySnapshot EMPTY = new LibrarySnapshot(List.of(), Instant.EPOCH);

  public LibrarySnapshot {
    books = List.copyOf(books);
  }

  /** False for the placeholder held before the first refresh completes. */
  public boolean isLoaded() {
    return !Instant.EPOCH.equals(refreshedAt);
  }

  public Optional<Book> find(String bookId) {
    return books.stream().filter(book -> book.id().equals(bookId)).findFirst();
  }
}
