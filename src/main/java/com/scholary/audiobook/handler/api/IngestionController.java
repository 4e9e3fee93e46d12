package com.scholary.audiobook.handler.api;

import com.scholary.audiobook.handler.ingest.IngestionRequest;
import com.scholary.audiobook.handler.job.IngestionJob;
import com.scholary.audiobook.handler.job.IngestionJobRunner;
import com.scholary.audiobook.handler.job.JobRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Paths;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for book ingestion.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous ingestion (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 */
@RestController
@Tag(name = "Ingestion", description = "Plan, assemble and upload downloaded books")
public class IngestionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionController.class);

  private final IngestionJobRunner jobRunner;
  private final JobRepository jobRepository;

  public IngestionController(IngestionJobRunner jobRunner, JobRepository jobRepository) {
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  /** Start asynchronous ingestion job. */
  @PostMapping("/api/ingestions")
  @Operation(
      summary = "Start ingestion",
      description = "Start an asynchronous ingestion job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> ingest(@Valid @RequestBody IngestionJobRequest request) {
    String jobId = UUID.randomUUID().toString();
    try {
      LOGGER.info(
          "Ingestion request: book={}, sourceDir={}, force={}",
          request.bookTitle(),
          request.sourceDir(),
          request.force());

      IngestionJob job =
          new IngestionJob(
              jobId,
              new IngestionRequest(request.bookTitle(), Paths.get(request.sourceDir()), request.force()));
      jobRepository.save(job);
      LOGGER.info("Created async ingestion job: {}", jobId);

      jobRunner.run(job);

      return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
    } catch (TaskRejectedException e) {
      LOGGER.warn("Ingestion queue is full, rejecting job {}", jobId);
      jobRepository.delete(jobId);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Rejected ingestion request: {}", e.getMessage());
      return ResponseEntity.badRequest().build();
    } catch (Exception e) {
      LOGGER.error("Failed to start ingestion", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an ingestion job. If the job is completed, includes the result.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an ingestion job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getPhase(),
                        job.getResult(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}
