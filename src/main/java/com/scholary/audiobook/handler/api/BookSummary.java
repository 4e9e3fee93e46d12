package com.scholary.audiobook.handler.api;

import com.scholary.audiobook.handler.catalog.Book;

/** One line of the library listing. */
public record BookSummary(
    String id, String displayName, int segmentCount, double totalDurationSeconds) {

  static BookSummary of(Book book) {
    return new BookSummary(
        book.id(), book.displayName(), book.segmentCount(), book.totalDurationSeconds());
  }
}
