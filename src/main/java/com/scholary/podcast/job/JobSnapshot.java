package com.scholary.podcast.job;

import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.storage.StoredPodcast;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a job.
 *
 * @param progress percent complete within the current state
 * @param failure set when the job is FAILED
 * @param degradedSegmentIds segments that fell back to original audio
 * @param result set when the job is DONE
 * @param durationSeconds length of the podcast, set when the job is DONE
 */
public record JobSnapshot(
    String id,
    WorkflowKind workflow,
    String title,
    PodcastConfig config,
    Instant createdAt,
    JobState state,
    int progress,
    List<StateChange> history,
    List<ErrorLogEntry> errorLog,
    JobFailure failure,
    List<KeySegment> keySegments,
    List<String> degradedSegmentIds,
    StoredPodcast result,
    Double durationSeconds) {

  /** States visited so far, in order. */
  public List<JobState> visitedStates() {
    return history.stream().map(StateChange::state).toList();
  }
}
