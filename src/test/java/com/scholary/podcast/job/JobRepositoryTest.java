package com.scholary.podcast.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.podcast.error.ErrorKind;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository repository = new JobRepository(10, 60);

  @Test
  void save_shouldMakeJobFindableUntilDeleted() {
    PipelineJob job = job("job-9", WorkflowKind.UPLOAD);

    repository.save(job);

    assertThat(repository.findById("job-9")).containsSame(job);
    repository.delete("job-9");
    assertThat(repository.findById("job-9")).isEmpty();
  }

  @Test
  void findById_shouldReturnEmptyForUnknownJob() {
    assertThat(repository.findById("nope")).isEmpty();
  }

  @Test
  void runningJob_shouldSurviveMoreFinishedJobsThanTheCacheHolds() {
    JobRepository small = new JobRepository(1, 60);
    PipelineJob recording = job("live", WorkflowKind.LIVE_MEETING);
    recording.transitionTo(JobState.RECORDING);
    small.save(recording);

    for (int i = 0; i < 5; i++) {
      PipelineJob upload = job("upload-" + i, WorkflowKind.UPLOAD);
      small.save(upload);
      upload.fail(ErrorKind.INTERNAL, "done with it");
    }

    assertThat(small.findById("live")).containsSame(recording);
    assertThat(small.activeCount()).isEqualTo(1);
  }

  @Test
  void endedJob_shouldMoveToArchiveAndStayFindable() {
    PipelineJob job = job("job-3", WorkflowKind.UPLOAD);
    repository.save(job);
    assertThat(repository.activeCount()).isEqualTo(1);

    job.cancel();

    assertThat(repository.activeCount()).isZero();
    assertThat(repository.findById("job-3")).containsSame(job);
  }

  @Test
  void deletedJob_shouldNotReappearWhenItEndsLater() {
    PipelineJob job = job("job-4", WorkflowKind.UPLOAD);
    repository.save(job);
    repository.delete("job-4");

    job.fail(ErrorKind.INTERNAL, "late failure");

    assertThat(repository.findById("job-4")).isEmpty();
  }

  private static PipelineJob job(String id, WorkflowKind workflow) {
    return new PipelineJob(
        id,
        workflow,
        null,
        PodcastConfig.defaults(),
        "b",
        workflow == WorkflowKind.UPLOAD ? "k.wav" : null,
        null);
  }
}
