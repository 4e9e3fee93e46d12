package com.scholary.audiobook.handler.ingest;

import com.scholary.audiobook.handler.planning.BookNames;
import java.nio.file.Path;

/**
 * What to ingest.
 *
 * @param sourceDir directory holding the downloaded, sequentially numbered audio files
 * @param force rebuild and upload even when the library already holds a matching book
 */
public record IngestionRequest(String bookTitle, Path sourceDir, boolean force) {

  public IngestionRequest {
    if (bookTitle == null || bookTitle.isBlank()) {
      throw new IllegalArgumentException("Book title is required");
    }
    // Fails for titles that leave nothing to build a storage id from
    BookNames.slug(bookTitle);
    if (sourceDir == null) {
      throw new IllegalArgumentException("Source directory is required");
    }
  }

  public String bookId() {
    return BookNames.slug(bookTitle);
  }
}
