package com.scholary.audiobook.handler.catalog;

import java.net.URL;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the books stored in the library.
 *
 * <p>All methods may block on the network. Credential failures surface as {@link
 * com.scholary.audiobook.handler.auth.AuthExpiredException}, connectivity failures as a transient
 * {@link com.scholary.audiobook.handler.objectstore.ObjectStoreException}.
 */
public interface CatalogClient {

  /** Every book in the library, ordered by id. */
  List<Book> listBooks();

  Optional<Book> findBook(String bookId);

  /** A URL a player can stream the segment from. */
  URL resolvePlayableUrl(String fileId);
}
