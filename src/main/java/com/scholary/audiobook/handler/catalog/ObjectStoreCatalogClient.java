package com.scholary.audiobook.handler.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.handler.auth.AuthExpiredException;
import com.scholary.audiobook.handler.config.IngestionProperties;
import com.scholary.audiobook.handler.objectstore.ObjectStoreAuthException;
import com.scholary.audiobook.handler.objectstore.ObjectStoreClient;
import com.scholary.audiobook.handler.objectstore.ObjectStoreClient.ObjectSummary;
import com.scholary.audiobook.handler.objectstore.ObjectStoreException;
import com.scholary.audiobook.handler.objectstore.ObjectStoreProperties;
import com.scholary.audiobook.handler.planning.BookNames;
import com.scholary.audiobook.handler.planning.TableOfContents;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads the library straight out of the bucket.
 *
 * <p>Every folder under the library prefix is a book. Its audio objects, sorted by key, are the
 * segments. When the folder holds a table of contents, titles and durations come from there;
 * otherwise the title is derived from the folder name and durations are estimated from sizes.
 */
@Component
public class ObjectStoreCatalogClient implements CatalogClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreCatalogClient.class);

  private final ObjectStoreClient objectStoreClient;
  private final ObjectMapper objectMapper;
  private final String bucket;
  private final LibraryLayout layout;
  private final Duration presignTtl;
  private final long bytesPerSecond;

  @Autowired
  public ObjectStoreCatalogClient(
      ObjectStoreClient objectStoreClient,
      ObjectMapper objectMapper,
      ObjectStoreProperties objectStoreProperties,
      IngestionProperties ingestionProperties) {
    this(
        objectStoreClient,
        objectMapper,
        objectStoreProperties.bucket(),
        new LibraryLayout(objectStoreProperties.libraryPrefix()),
        objectStoreProperties.presignTtl(),
        ingestionProperties.estimatedBytesPerSecond());
  }

  public ObjectStoreCatalogClient(
      ObjectStoreClient objectStoreClient,
      ObjectMapper objectMapper,
      String bucket,
      LibraryLayout layout,
      Duration presignTtl,
      long bytesPerSecond) {
    this.objectStoreClient = objectStoreClient;
    this.objectMapper = objectMapper;
    this.bucket = bucket;
    this.layout = layout;
    this.presignTtl = presignTtl;
    this.bytesPerSecond = bytesPerSecond;
  }

  @Override
  public List<Book> listBooks() {
    List<ObjectSummary> objects = list(layout.root());

    Map<String, List<ObjectSummary>> byBook = new TreeMap<>();
    for (ObjectSummary object : objects) {
      String bookId = layout.bookIdOf(object.key());
      if (bookId != null) {
        byBook.computeIfAbsent(bookId, id -> new ArrayList<>()).add(object);
      }
    }

    List<Book> books = new ArrayList<>();
    byBook.forEach((bookId, bookObjects) -> toBook(bookId, bookObjects).ifPresent(books::add));
    LOGGER.info("Catalog lists {} books under {}", books.size(), layout.root());
    return books;
  }

  @Override
  public Optional<Book> findBook(String bookId) {
    List<ObjectSummary> objects =
        list(layout.bookPrefix(bookId)).stream()
            .filter(object -> bookId.equals(layout.bookIdOf(object.key())))
            .toList();
    return toBook(bookId, objects);
  }

  @Override
  public URL resolvePlayableUrl(String fileId) {
    try {
      return objectStoreClient.presignGet(bucket, fileId, presignTtl);
    } catch (ObjectStoreAuthException e) {
      throw new AuthExpiredException("Object store rejected credentials for " + fileId, e);
    }
  }

  private Optional<Book> toBook(String bookId, List<ObjectSummary> objects) {
    List<ObjectSummary> audio =
        objects.stream()
            .filter(object -> BookNames.isAudioFileName(LibraryLayout.fileNameOf(object.key())))
            .toList();
    if (audio.isEmpty()) {
      LOGGER.debug("Skipping folder {} without audio objects", bookId);
      return Optional.empty();
    }

    String tocKey = layout.objectKey(bookId, BookNames.tocFileName(bookId));
    boolean hasToc = objects.stream().anyMatch(object -> object.key().equals(tocKey));
    TableOfContents toc = hasToc ? readToc(tocKey) : null;

    Map<String, TableOfContents.Entry> entries =
        toc == null
            ? Map.of()
            : toc.segments().stream()
                .collect(
                    Collectors.toMap(
                        TableOfContents.Entry::fileName, Function.identity(), (a, b) -> a));

    String title =
        toc != null && toc.bookTitle() != null ? toc.bookTitle() : BookNames.titleFromSlug(bookId);

    List<Segment> segments = new ArrayList<>(audio.size());
    for (int i = 0; i < audio.size(); i++) {
      ObjectSummary object = audio.get(i);
      TableOfContents.Entry entry = entries.get(LibraryLayout.fileNameOf(object.key()));
      String displayName =
          entry != null
              ? entry.displayName()
              : BookNames.segmentDisplayName(title, i + 1, audio.size());
      double duration =
          entry != null ? entry.durationSeconds() : (double) object.size() / bytesPerSecond;
      segments.add(new Segment(object.key(), displayName, duration, object.size()));
    }

    return Optional.of(new Book(bookId, title, segments, hasToc ? tocKey : null));
  }

  private TableOfContents readToc(String key) {
    try (InputStream stream = objectStoreClient.getObjectStream(bucket, key)) {
      return objectMapper.readValue(stream, TableOfContents.class);
    } catch (ObjectStoreAuthException e) {
      throw new AuthExpiredException("Object store rejected credentials for " + key, e);
    } catch (ObjectStoreException e) {
      if (e.isTransient()) {
        throw e;
      }
      LOGGER.warn("Could not read table of contents {}, falling back to estimates", key, e);
      return null;
    } catch (IOException e) {
      LOGGER.warn("Could not read table of contents {}, falling back to estimates", key, e);
      return null;
    }
  }

  private List<ObjectSummary> list(String prefix) {
    try {
      return objectStoreClient.listObjects(bucket, prefix);
    } catch (ObjectStoreAuthException e) {
      throw new AuthExpiredException("Object store rejected credentials listing " + prefix, e);
    }
  }
}
