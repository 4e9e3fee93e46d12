package com.scholary.audiobook.handler.job;

import com.scholary.audiobook.handler.api.JobStatusResponse.Status;
import com.scholary.audiobook.handler.ingest.BookIngestionService;
import com.scholary.audiobook.handler.ingest.IngestionProgressListener.Phase;
import com.scholary.audiobook.handler.ingest.IngestionResult;
import com.scholary.audiobook.handler.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs ingestion jobs on the task executor.
 *
 * <p>Lives in its own bean so that {@code @Async} goes through the Spring proxy; a self-invoked
 * async method would run on the request thread.
 */
@Component
public class IngestionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionJobRunner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final BookIngestionService ingestionService;
  private final JobRepository jobRepository;

  public IngestionJobRunner(BookIngestionService ingestionService, JobRepository jobRepository) {
    this.ingestionService = ingestionService;
    this.jobRepository = jobRepository;
  }

  @Async
  public void run(IngestionJob job) {
    String jobId = job.getJobId();
    try {
      StructuredLogger.setJobContext(jobId, job.getRequest().bookId());
      LOGGER.info("Starting async processing for job: {}", jobId);

      job.setStatus(Status.PROCESSING);
      job.setProgress(5);
      jobRepository.save(job);

      IngestionResult result =
          ingestionService.ingest(
              job.getRequest(), (phase, done, total) -> onProgress(job, phase, done, total));

      job.setStatus(Status.COMPLETED);
      job.setProgress(100);
      job.setResult(result);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for job: {} ({})", jobId, result.outcome());

    } catch (Exception e) {
      LOGGER.error("Async processing failed for job: {}", jobId, e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void onProgress(IngestionJob job, Phase phase, int done, int total) {
    int percent = percentFor(phase, done, total);
    job.setPhase(phase.name());
    job.setProgress(percent);
    jobRepository.save(job);
    structuredLogger.logIngestProgress(job.getJobId(), phase.name(), done, total, percent);
  }

  // Planning 0-10, assembling 10-40, uploading 40-95, cleanup 95-99
  static int percentFor(Phase phase, int done, int total) {
    double fraction = total == 0 ? 1.0 : (double) done / total;
    return switch (phase) {
      case PLANNING -> (int) (10 * fraction);
      case ASSEMBLING -> 10 + (int) (30 * fraction);
      case UPLOADING -> 40 + (int) (55 * fraction);
      case CLEANING_UP -> 95 + (int) (4 * fraction);
    };
  }
}
