package com.scholary.podcast.api;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.job.ErrorLogEntry;
import com.scholary.podcast.job.JobSnapshot;
import com.scholary.podcast.job.JobState;
import com.scholary.podcast.job.StateChange;
import com.scholary.podcast.job.WorkflowKind;
import com.scholary.podcast.storage.StoredPodcast;
import java.time.Instant;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a job, its history and problems, and the podcast once it is done.
 */
public record JobStatusResponse(
    String jobId,
    WorkflowKind workflow,
    String title,
    JobState state,
    int progress,
    Instant createdAt,
    String voice,
    String style,
    int segmentCount,
    boolean addMusic,
    List<StateChange> stateHistory,
    List<ErrorLogEntry> errorLog,
    Failure failure,
    List<String> degradedSegmentIds,
    Result result) {

  /** Stage and kind of the error that ended a FAILED job. */
  public record Failure(JobState stage, ErrorKind kind, String message) {}

  /** Where the finished podcast can be fetched. */
  public record Result(
      String audioUrl,
      String bucket,
      String audioKey,
      String mp3Key,
      String manifestKey,
      String captionsKey,
      double durationSeconds) {}

  static JobStatusResponse from(JobSnapshot job) {
    Failure failure =
        job.failure() == null
            ? null
            : new Failure(job.failure().stage(), job.failure().kind(), job.failure().message());
    StoredPodcast stored = job.result();
    Result result =
        stored == null
            ? null
            : new Result(
                stored.audioUrl(),
                stored.bucket(),
                stored.audioKey(),
                stored.mp3Key(),
                stored.manifestKey(),
                stored.captionsKey(),
                job.durationSeconds() == null ? 0.0 : job.durationSeconds());
    return new JobStatusResponse(
        job.id(),
        job.workflow(),
        job.title(),
        job.state(),
        job.progress(),
        job.createdAt(),
        job.config().voice().tag(),
        job.config().style().tag(),
        job.config().segmentCount(),
        job.config().addMusic(),
        job.history(),
        job.errorLog(),
        failure,
        job.degradedSegmentIds(),
        result);
  }
}
