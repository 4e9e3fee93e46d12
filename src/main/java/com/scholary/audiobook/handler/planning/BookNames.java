package com.scholary.audiobook.handler.planning;

import java.util.Locale;
import java.util.Map;

/** Naming rules shared by the planner output, the uploader and the catalog reader. */
public final class BookNames {

  public static final String TOC_SUFFIX = "_toc.json";

  /** Extension used when a source name carries no recognised one. */
  public static final String DEFAULT_AUDIO_EXTENSION = "mp3";

  private static final Map<String, String> AUDIO_CONTENT_TYPES =
      Map.of(
          "mp3", "audio/mpeg",
          "m4a", "audio/mp4",
          "m4b", "audio/mp4",
          "ogg", "audio/ogg",
          "opus", "audio/ogg",
          "flac", "audio/flac",
          "wav", "audio/wav");

  private BookNames() {}

  /**
   * Storage id for a book title: lower case, punctuation dropped, runs of spaces and hyphens
   * collapsed to one underscore. "The Well of Ascension" becomes "the_well_of_ascension".
   */
  public static String slug(String bookTitle) {
    String cleaned = bookTitle.toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s-]", "").trim();
    String slug = cleaned.replaceAll("[-\\s]+", "_");
    if (slug.isEmpty()) {
      throw new IllegalArgumentException("Book title has no usable characters: " + bookTitle);
    }
    return slug;
  }

  /** Turns a slug back into something readable when no title is stored. */
  public static String titleFromSlug(String slug) {
    StringBuilder title = new StringBuilder();
    for (String word : slug.split("_")) {
      if (word.isEmpty()) {
        continue;
      }
      if (title.length() > 0) {
        title.append(' ');
      }
      title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
    }
    return title.toString();
  }

  /** Zero-padded 1-based sequence number, at least two digits wide. */
  public static String sequenceNumber(int sequence, int totalSegments) {
    int width = Math.max(2, String.valueOf(totalSegments).length());
    return String.format("%0" + width + "d", sequence);
  }

  public static String segmentFileName(
      String bookId, int sequence, int totalSegments, String audioExtension) {
    return bookId + "_segment_" + sequenceNumber(sequence, totalSegments) + "." + audioExtension;
  }

  public static String segmentDisplayName(String bookTitle, int sequence, int totalSegments) {
    return bookTitle + " - Segment " + sequenceNumber(sequence, totalSegments);
  }

  public static String tocFileName(String bookId) {
    return bookId + TOC_SUFFIX;
  }

  /** True for file names or object keys with a known audio extension, in any case. */
  public static boolean isAudioFileName(String name) {
    return AUDIO_CONTENT_TYPES.containsKey(extensionOf(name));
  }

  /** Lower-case audio extension of a file name, or {@link #DEFAULT_AUDIO_EXTENSION}. */
  public static String audioExtension(String name) {
    String extension = extensionOf(name);
    return AUDIO_CONTENT_TYPES.containsKey(extension) ? extension : DEFAULT_AUDIO_EXTENSION;
  }

  /** MIME type to store an audio file under, chosen by its extension. */
  public static String audioContentType(String name) {
    return AUDIO_CONTENT_TYPES.get(audioExtension(name));
  }

  private static String extensionOf(String name) {
    int dot = name.lastIndexOf('.');
    int slash = name.lastIndexOf('/');
    if (dot <= slash + 1) {
      return "";
    }
    return name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
