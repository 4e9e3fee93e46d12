package com.scholary.audiobook.handler.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.audiobook.handler.api.JobStatusResponse.Status;
import com.scholary.audiobook.handler.ingest.BookIngestionService;
import com.scholary.audiobook.handler.ingest.IngestionProgressListener;
import com.scholary.audiobook.handler.ingest.IngestionProgressListener.Phase;
import com.scholary.audiobook.handler.ingest.IngestionRequest;
import com.scholary.audiobook.handler.ingest.IngestionResult;
import com.scholary.audiobook.handler.planning.InvalidSourceSetException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IngestionJobRunnerTest {

  @Mock private BookIngestionService ingestionService;

  private JobRepository jobRepository;
  private IngestionJobRunner runner;
  private IngestionRequest request;

  @BeforeEach
  void setUp() {
    jobRepository = new JobRepository(10, 60);
    runner = new IngestionJobRunner(ingestionService, jobRepository);
    request = new IngestionRequest("Dune", Path.of("/downloads/dune"), false);
  }

  @Test
  void run_shouldTrackProgressAndStoreResult() throws Exception {
    IngestionResult result =
        new IngestionResult(
            "dune",
            "Dune",
            IngestionResult.Outcome.UPLOADED,
            2,
            "audiobooks/dune/dune_toc.json",
            List.of("a", "b"),
            0);
    IngestionJob job = new IngestionJob("job-1", request);
    List<Integer> seenProgress = new ArrayList<>();
    when(ingestionService.ingest(eq(request), any(IngestionProgressListener.class)))
        .thenAnswer(
            invocation -> {
              IngestionProgressListener listener = invocation.getArgument(1);
              listener.onProgress(Phase.UPLOADING, 1, 2);
              seenProgress.add(job.getProgress());
              assertThat(job.getStatus()).isEqualTo(Status.PROCESSING);
              assertThat(job.getPhase()).isEqualTo("UPLOADING");
              return result;
            });

    runner.run(job);

    assertThat(seenProgress).containsExactly(67);
    IngestionJob stored = jobRepository.findById("job-1").orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(stored.getProgress()).isEqualTo(100);
    assertThat(stored.getResult()).isEqualTo(result);
  }

  @Test
  void run_shouldRecordFailure() throws Exception {
    IngestionJob job = new IngestionJob("job-2", request);
    when(ingestionService.ingest(eq(request), any(IngestionProgressListener.class)))
        .thenThrow(new InvalidSourceSetException("File name has no sequence number: intro.mp3"));

    runner.run(job);

    IngestionJob stored = jobRepository.findById("job-2").orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(Status.FAILED);
    assertThat(stored.getError()).contains("intro.mp3");
  }

  @Test
  void run_shouldRecordFailureRaisedBeforeIngestionStarts() {
    jobRepository.save(new IngestionJob("job-3", null));

    runner.run(jobRepository.findById("job-3").orElseThrow());

    IngestionJob stored = jobRepository.findById("job-3").orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(Status.FAILED);
    verifyNoInteractions(ingestionService);
  }

  @Test
  void percentFor_shouldMapPhasesOntoDisjointRanges() {
    assertThat(IngestionJobRunner.percentFor(Phase.PLANNING, 1, 1)).isEqualTo(10);
    assertThat(IngestionJobRunner.percentFor(Phase.ASSEMBLING, 0, 4)).isEqualTo(10);
    assertThat(IngestionJobRunner.percentFor(Phase.ASSEMBLING, 4, 4)).isEqualTo(40);
    assertThat(IngestionJobRunner.percentFor(Phase.UPLOADING, 4, 4)).isEqualTo(95);
    assertThat(IngestionJobRunner.percentFor(Phase.CLEANING_UP, 1, 1)).isEqualTo(99);
    assertThat(IngestionJobRunner.percentFor(Phase.UPLOADING, 0, 0)).isEqualTo(95);
  }
}
