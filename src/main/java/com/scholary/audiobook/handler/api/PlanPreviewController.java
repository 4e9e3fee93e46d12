package com.scholary.audiobook.handler.api;

import com.scholary.audiobook.handler.config.IngestionProperties;
import com.scholary.audiobook.handler.planning.InvalidSourceSetException;
import com.scholary.audiobook.handler.planning.OversizeSourceFileException;
import com.scholary.audiobook.handler.planning.SegmentPlan;
import com.scholary.audiobook.handler.planning.SegmentPlanner;
import com.scholary.audiobook.handler.planning.SourceFile;
import com.scholary.audiobook.handler.planning.TableOfContents;
import com.scholary.audiobook.handler.planning.TableOfContentsBuilder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for previewing segment plans.
 *
 * <p>Runs the planner and the TOC builder on file descriptors only; nothing is read or written.
 */
@RestController
@Tag(name = "Planning", description = "Segment plan preview")
public class PlanPreviewController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlanPreviewController.class);

  private final SegmentPlanner planner;
  private final TableOfContentsBuilder tocBuilder;
  private final long bytesPerSecond;

  public PlanPreviewController(
      SegmentPlanner planner, TableOfContentsBuilder tocBuilder, IngestionProperties properties) {
    this.planner = planner;
    this.tocBuilder = tocBuilder;
    this.bytesPerSecond = properties.estimatedBytesPerSecond();
  }

  @PostMapping("/api/plans/preview")
  @Operation(
      summary = "Preview segment plan",
      description =
          "Plan segments for the given source files and return the resulting table of contents. "
              + "Returns 400 for empty or invalid input and 422 when a single file exceeds the "
              + "segment size ceiling.")
  public ResponseEntity<PlanPreviewResponse> preview(@Valid @RequestBody PlanPreviewRequest request) {
    LOGGER.info("Plan preview request: book={}, files={}", request.bookTitle(), request.files().size());

    try {
      List<SourceFile> files = request.files().stream().map(this::toSourceFile).toList();
      List<SegmentPlan> plans = planner.plan(files);
      TableOfContents toc = tocBuilder.build(request.bookTitle(), plans);
      boolean passThrough = plans.stream().allMatch(SegmentPlan.PassThrough.class::isInstance);
      return ResponseEntity.ok(new PlanPreviewResponse(toc.bookId(), passThrough, files.size(), toc));

    } catch (OversizeSourceFileException e) {
      LOGGER.warn("Plan preview rejected: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).build();
    } catch (InvalidSourceSetException | IllegalArgumentException e) {
      LOGGER.warn("Plan preview rejected: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    }
  }

  private SourceFile toSourceFile(PlanPreviewRequest.FileDescriptor descriptor) {
    String name =
        descriptor.name() == null || descriptor.name().isBlank()
            ? "file_" + descriptor.index()
            : descriptor.name();
    double duration =
        descriptor.durationSeconds() != null
            ? descriptor.durationSeconds()
            : (double) descriptor.sizeBytes() / bytesPerSecond;
    return new SourceFile(descriptor.index(), name, descriptor.sizeBytes(), duration);
  }
}
