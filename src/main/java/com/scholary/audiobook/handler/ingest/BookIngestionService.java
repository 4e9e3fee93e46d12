package com.scholary.audiobook.handler.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audiobook.handler.catalog.Book;
import com.scholary.audiobook.handler.catalog.CatalogClient;
import com.scholary.audiobook.handler.catalog.LibraryLayout;
import com.scholary.audiobook.handler.catalog.Segment;
import com.scholary.audiobook.handler.config.IngestionProperties;
import com.scholary.audiobook.handler.ingest.IngestionProgressListener.Phase;
import com.scholary.audiobook.handler.logging.StructuredLogger;
import com.scholary.audiobook.handler.objectstore.ObjectStoreClient;
import com.scholary.audiobook.handler.objectstore.ObjectStoreClient.ObjectSummary;
import com.scholary.audiobook.handler.objectstore.ObjectStoreProperties;
import com.scholary.audiobook.handler.planning.BookNames;
import com.scholary.audiobook.handler.planning.SegmentPlan;
import com.scholary.audiobook.handler.planning.SegmentPlanner;
import com.scholary.audiobook.handler.planning.SourceFile;
import com.scholary.audiobook.handler.planning.TableOfContents;
import com.scholary.audiobook.handler.planning.TableOfContentsBuilder;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns a directory of downloaded files into a book in the library.
 *
 * <p>The run goes scan, plan, compare, assemble, upload. Planning failures abort before anything is
 * written. The table of contents is uploaded after every segment, so a book whose TOC is present is
 * complete. Audio objects left over from an earlier plan of the same book are deleted last.
 */
@Service
public class BookIngestionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(BookIngestionService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final String TOC_CONTENT_TYPE = "application/json";

  private final SourceFileScanner scanner;
  private final SegmentPlanner planner;
  private final TableOfContentsBuilder tocBuilder;
  private final PlanCatalogMatcher matcher;
  private final SegmentAssembler assembler;
  private final CatalogClient catalogClient;
  private final ObjectStoreClient objectStoreClient;
  private final ObjectMapper objectMapper;
  private final String bucket;
  private final LibraryLayout layout;
  private final Path workDir;

  @Autowired
  public BookIngestionService(
      SourceFileScanner scanner,
      SegmentPlanner planner,
      TableOfContentsBuilder tocBuilder,
      PlanCatalogMatcher matcher,
      SegmentAssembler assembler,
      CatalogClient catalogClient,
      ObjectStoreClient objectStoreClient,
      ObjectMapper objectMapper,
      ObjectStoreProperties objectStoreProperties,
      IngestionProperties ingestionProperties) {
    this(
        scanner,
        planner,
        tocBuilder,
        matcher,
        assembler,
        catalogClient,
        objectStoreClient,
        objectMapper,
        objectStoreProperties.bucket(),
        new LibraryLayout(objectStoreProperties.libraryPrefix()),
        Paths.get(ingestionProperties.workDir()));
  }

  public BookIngestionService(
      SourceFileScanner scanner,
      SegmentPlanner planner,
      TableOfContentsBuilder tocBuilder,
      PlanCatalogMatcher matcher,
      SegmentAssembler assembler,
      CatalogClient catalogClient,
      ObjectStoreClient objectStoreClient,
      ObjectMapper objectMapper,
      String bucket,
      LibraryLayout layout,
      Path workDir) {
    this.scanner = scanner;
    this.planner = planner;
    this.tocBuilder = tocBuilder;
    this.matcher = matcher;
    this.assembler = assembler;
    this.catalogClient = catalogClient;
    this.objectStoreClient = objectStoreClient;
    this.objectMapper = objectMapper;
    this.bucket = bucket;
    this.layout = layout;
    this.workDir = workDir;
  }

  public IngestionResult ingest(IngestionRequest request) throws IOException {
    return ingest(request, IngestionProgressListener.NONE);
  }

  /**
   * Ingest one book.
   *
   * @throws com.scholary.audiobook.handler.planning.PlanningException if the source files cannot be
   *     planned; nothing has been written in that case
   * @throws IOException if assembling segments fails
   */
  public IngestionResult ingest(IngestionRequest request, IngestionProgressListener progress)
      throws IOException {
    String bookId = request.bookId();
    LOGGER.info(
        "Starting ingestion: book={}, sourceDir={}, force={}",
        bookId,
        request.sourceDir(),
        request.force());

    List<SourceFile> sourceFiles = scanner.scan(request.sourceDir());
    List<SegmentPlan> plans = planner.plan(sourceFiles);
    TableOfContents toc = tocBuilder.build(request.bookTitle(), plans);
    for (TableOfContents.Entry entry : toc.segments()) {
      structuredLogger.logSegmentPlanned(
          bookId,
          entry.sequence(),
          entry.sourceIndices().size(),
          entry.durationSeconds(),
          entry.sizeBytes());
    }
    progress.onProgress(Phase.PLANNING, 1, 1);

    String tocKey = layout.objectKey(bookId, BookNames.tocFileName(bookId));
    if (!request.force()) {
      Optional<Book> existing = catalogClient.findBook(bookId);
      if (existing.isPresent() && matcher.matches(plans, existing.get())) {
        LOGGER.info("Book {} already matches the plan, nothing to do", bookId);
        return new IngestionResult(
            bookId,
            request.bookTitle(),
            IngestionResult.Outcome.UNCHANGED,
            plans.size(),
            existing.get().tocFileId(),
            existing.get().segments().stream().map(Segment::fileId).toList(),
            0);
      }
    }

    Path bookWorkDir = workDir.resolve(bookId + "-" + UUID.randomUUID());
    try {
      List<Path> segmentFiles = assembler.assemble(request.sourceDir(), plans, toc, bookWorkDir);
      progress.onProgress(Phase.ASSEMBLING, segmentFiles.size(), segmentFiles.size());

      List<String> segmentKeys = upload(bookId, toc, segmentFiles, progress);
      uploadToc(toc, tocKey);

      progress.onProgress(Phase.CLEANING_UP, 0, 1);
      int deleted = deleteStaleSegments(bookId, new HashSet<>(segmentKeys));
      progress.onProgress(Phase.CLEANING_UP, 1, 1);

      LOGGER.info(
          "Ingestion complete: book={}, segments={}, staleDeleted={}",
          bookId,
          segmentKeys.size(),
          deleted);
      return new IngestionResult(
          bookId,
          request.bookTitle(),
          IngestionResult.Outcome.UPLOADED,
          segmentKeys.size(),
          tocKey,
          segmentKeys,
          deleted);

    } finally {
      deleteRecursively(bookWorkDir);
    }
  }

  private List<String> upload(
      String bookId,
      TableOfContents toc,
      List<Path> segmentFiles,
      IngestionProgressListener progress) {
    int total = segmentFiles.size();
    List<String> keys = new ArrayList<>(total);

    for (int i = 0; i < total; i++) {
      TableOfContents.Entry entry = toc.segments().get(i);
      String key = layout.objectKey(bookId, entry.fileName());
      long startTime = System.currentTimeMillis();
      objectStoreClient.putFile(
          bucket, key, segmentFiles.get(i), BookNames.audioContentType(entry.fileName()));
      structuredLogger.logSegmentUploaded(
          bookId, entry.sequence(), total, entry.sizeBytes(), System.currentTimeMillis() - startTime);
      keys.add(key);
      progress.onProgress(Phase.UPLOADING, i + 1, total);
    }
    return keys;
  }

  private void uploadToc(TableOfContents toc, String tocKey) throws IOException {
    byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toc);
    objectStoreClient.putObject(
        bucket, tocKey, new ByteArrayInputStream(json), json.length, TOC_CONTENT_TYPE);
    LOGGER.info("Uploaded table of contents: {}", tocKey);
  }

  private int deleteStaleSegments(String bookId, Set<String> keep) {
    int deleted = 0;
    for (ObjectSummary object : objectStoreClient.listObjects(bucket, layout.bookPrefix(bookId))) {
      String key = object.key();
      if (!bookId.equals(layout.bookIdOf(key))
          || keep.contains(key)
          || !BookNames.isAudioFileName(LibraryLayout.fileNameOf(key))) {
        continue;
      }
      LOGGER.info("Deleting stale segment {}", key);
      objectStoreClient.deleteObject(bucket, key);
      deleted++;
    }
    return deleted;
  }

  private void deleteRecursively(Path dir) {
    if (!Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up work directory {}", dir, e);
    }
  }
}
