package com.scholary.audiobook.handler.catalog;

/**
 * Key layout of the library bucket: {@code <prefix>/<bookId>/<file>}.
 *
 * <p>Object stores have no folders, so a book is every key under its book prefix.
 */
public record LibraryLayout(String libraryPrefix) {

  public LibraryLayout {
    if (libraryPrefix == null) {
      throw new IllegalArgumentException("Library prefix is required");
    }
    libraryPrefix = libraryPrefix.replaceAll("^/+|/+$", "");
    if (libraryPrefix.isEmpty()) {
      throw new IllegalArgumentException("Library prefix cannot be empty");
    }
  }

  public String root() {
    return libraryPrefix + "/";
  }

  public String bookPrefix(String bookId) {
    return root() + bookId + "/";
  }

  public String objectKey(String bookId, String fileName) {
    return bookPrefix(bookId) + fileName;
  }

  /** The book id of a key directly inside a book folder, or null for anything else. */
  public String bookIdOf(String key) {
    if (!key.startsWith(root())) {
      return null;
    }
    String rest = key.substring(root().length());
    int slash = rest.indexOf('/');
    if (slash <= 0 || rest.indexOf('/', slash + 1) >= 0 || slash == rest.length() - 1) {
      return null;
    }
    return rest.substring(0, slash);
  }

  public static String fileNameOf(String key) {
    return key.substring(key.lastIndexOf('/') + 1);
  }
}
