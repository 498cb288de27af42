package com.scholary.podcast.job;

import com.scholary.podcast.capture.RecordingSource;
import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.storage.StoredPodcast;
import com.scholary.podcast.transcript.TranscriptBuffer;
import com.scholary.podcast.transcript.TranscriptChunk;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One meeting-to-podcast run.
 *
 * <p>The job owns its transcript buffer, key segments and output. Mutable state is guarded by a
 * per-job lock that is only held for bookkeeping, never across a collaborator call, so status
 * queries stay responsive while the pipeline is busy. Transitions are validated against
 * {@link JobState#canTransitionTo}; once a job is terminal every further transition is refused.
 */
public class PipelineJob {

  private final String id;
  private final WorkflowKind workflow;
  private final String title;
  private final PodcastConfig config;
  private final Instant createdAt;
  private final String audioBucket;
  private final String audioKey;
  private final List<TranscriptChunk> providedTranscript;

  private final TranscriptBuffer buffer = new TranscriptBuffer();
  private final ReentrantLock lock = new ReentrantLock();
  private final CountDownLatch stopSignal = new CountDownLatch(1);

  // Guarded by lock
  private JobState state = JobState.CREATED;
  private final List<StateChange> history = new ArrayList<>();
  private int progress;
  private final List<ErrorLogEntry> errorLog = new ArrayList<>();
  private JobFailure failure;
  private List<KeySegment> keySegments = List.of();
  private final Set<String> degradedSegmentIds = new LinkedHashSet<>();
  private StoredPodcast result;
  private Double durationSeconds;
  private final List<Future<?>> tasks = new ArrayList<>();
  private RecordingSource recordingSource;
  private Consumer<PipelineJob> terminalListener;

  public PipelineJob(
      String id,
      WorkflowKind workflow,
      String title,
      PodcastConfig config,
      String audioBucket,
      String audioKey,
      List<TranscriptChunk> providedTranscript) {
    this.id = id;
    this.workflow = workflow;
    this.title = title;
    this.config = config;
    this.audioBucket = audioBucket;
    this.audioKey = audioKey;
    this.providedTranscript = providedTranscript == null ? null : List.copyOf(providedTranscript);
    this.createdAt = Instant.now();
    this.history.add(new StateChange(JobState.CREATED, createdAt));
  }

  public String id() {
    return id;
  }

  public WorkflowKind workflow() {
    return workflow;
  }

  public String title() {
    return title;
  }

  public PodcastConfig config() {
    return config;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public String audioBucket() {
    return audioBucket;
  }

  public String audioKey() {
    return audioKey;
  }

  /** Transcript supplied with an upload, or null when the audio must be transcribed. */
  public List<TranscriptChunk> providedTranscript() {
    return providedTranscript;
  }

  /** The job's transcript buffer. Closed once transcription ends or the job is cancelled. */
  public TranscriptBuffer buffer() {
    return buffer;
  }

  public JobState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Move to {@code next}.
   *
   * @return false if the job is already terminal (for example cancelled meanwhile)
   * @throws IllegalStateException if the transition is not part of the lifecycle
   */
  public boolean transitionTo(JobState next) {
    lock.lock();
    try {
      if (state.isTerminal()) {
        return false;
      }
      if (!state.canTransitionTo(next, workflow)) {
        throw new IllegalStateException(
            String.format("Illegal transition %s -> %s for %s job %s", state, next, workflow, id));
      }
      apply(next);
    } finally {
      lock.unlock();
    }
    if (next.isTerminal()) {
      notifyTerminal();
    }
    return true;
  }

  /**
   * Fail the job in its current stage.
   *
   * @return the stage that failed, or null if the job was already terminal
   */
  public JobState fail(ErrorKind kind, String message) {
    JobState stage;
    lock.lock();
    try {
      if (state.isTerminal()) {
        return null;
      }
      stage = state;
      failure = new JobFailure(stage, kind, message);
      errorLog.add(
          new ErrorLogEntry(
              Instant.now(), stage, ErrorLogEntry.Severity.ERROR, kind, message, null));
      apply(JobState.FAILED);
    } finally {
      lock.unlock();
    }
    notifyTerminal();
    return stage;
  }

  /**
   * Cancel the job and release what it owns: the transcript buffer is closed, key segments are
   * dropped, registered tasks are interrupted and the recording source, if any, is stopped.
   *
   * @return the state the job was in, or CANCELLED if it already was
   * @throws JobStateConflictException if the job is DONE or FAILED
   */
  public JobState cancel() {
    List<Future<?>> toCancel;
    RecordingSource source;
    JobState previous;
    lock.lock();
    try {
      if (state == JobState.CANCELLED) {
        return JobState.CANCELLED;
      }
      if (state.isTerminal()) {
        throw new JobStateConflictException(
            state, "Job " + id + " is already " + state + " and cannot be cancelled");
      }
      previous = state;
      apply(JobState.CANCELLED);
      toCancel = new ArrayList<>(tasks);
      tasks.clear();
      source = recordingSource;
      recordingSource = null;
      keySegments = List.of();
    } finally {
      lock.unlock();
    }
    buffer.close();
    stopSignal.countDown();
    if (source != null) {
      source.stopCapture();
    }
    toCancel.forEach(task -> task.cancel(true));
    notifyTerminal();
    return previous;
  }

  /**
   * Finish the job with its stored output.
   *
   * @return false if the job was cancelled meanwhile; the caller must then discard the output
   */
  public boolean complete(StoredPodcast stored, double duration) {
    lock.lock();
    try {
      if (state != JobState.ASSEMBLING) {
        return false;
      }
      result = stored;
      durationSeconds = duration;
      progress = 100;
      apply(JobState.DONE);
    } finally {
      lock.unlock();
    }
    notifyTerminal();
    return true;
  }

  /**
   * Register the callback run once the job reaches DONE, FAILED or CANCELLED. It runs on the
   * thread that ended the job, outside the job lock, or right away if the job already ended.
   */
  public void onTerminal(Consumer<PipelineJob> listener) {
    lock.lock();
    try {
      if (!state.isTerminal()) {
        terminalListener = listener;
        return;
      }
    } finally {
      lock.unlock();
    }
    listener.accept(this);
  }

  /** Track a task so that cancellation interrupts it. A task added after cancel is cancelled. */
  public void registerTask(Future<?> task) {
    lock.lock();
    try {
      if (state != JobState.CANCELLED) {
        tasks.add(task);
        return;
      }
    } finally {
      lock.unlock();
    }
    task.cancel(true);
  }

  /** Attach the live recording source so that cancellation can stop it. */
  public void attachRecordingSource(RecordingSource source) {
    lock.lock();
    try {
      if (state != JobState.CANCELLED) {
        recordingSource = source;
        return;
      }
    } finally {
      lock.unlock();
    }
    source.stopCapture();
  }

  public void detachRecordingSource() {
    lock.lock();
    try {
      recordingSource = null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Signal the end of the recording and stop the attached recording source, if any.
   *
   * @return true for the first call, false for every repeat
   */
  public boolean requestStop() {
    RecordingSource source;
    lock.lock();
    try {
      if (stopSignal.getCount() == 0) {
        return false;
      }
      stopSignal.countDown();
      source = recordingSource;
    } finally {
      lock.unlock();
    }
    if (source != null) {
      source.stopCapture();
    }
    return true;
  }

  /** True once the recording was stopped or the job cancelled. */
  public boolean isStopRequested() {
    return stopSignal.getCount() == 0;
  }

  public void setProgress(int percent) {
    lock.lock();
    try {
      progress = Math.max(0, Math.min(100, percent));
    } finally {
      lock.unlock();
    }
  }

  public void setKeySegments(List<KeySegment> segments) {
    lock.lock();
    try {
      if (state != JobState.CANCELLED) {
        keySegments = List.copyOf(segments);
      }
    } finally {
      lock.unlock();
    }
  }

  public List<KeySegment> keySegments() {
    lock.lock();
    try {
      return keySegments;
    } finally {
      lock.unlock();
    }
  }

  /** Record a non-fatal problem. Segment failures also mark the segment as degraded. */
  public void logWarning(ErrorKind kind, String message, String keySegmentId) {
    lock.lock();
    try {
      errorLog.add(
          new ErrorLogEntry(
              Instant.now(), state, ErrorLogEntry.Severity.WARNING, kind, message, keySegmentId));
      if (keySegmentId != null) {
        degradedSegmentIds.add(keySegmentId);
      }
    } finally {
      lock.unlock();
    }
  }

  public Set<String> degradedSegmentIds() {
    lock.lock();
    try {
      return Set.copyOf(degradedSegmentIds);
    } finally {
      lock.unlock();
    }
  }

  /** Consistent, immutable view of the job for status queries. */
  public JobSnapshot snapshot() {
    lock.lock();
    try {
      return new JobSnapshot(
          id,
          workflow,
          title,
          config,
          createdAt,
          state,
          progress,
          List.copyOf(history),
          List.copyOf(errorLog),
          failure,
          keySegments,
          List.copyOf(degradedSegmentIds),
          result,
          durationSeconds);
    } finally {
      lock.unlock();
    }
  }

  private void notifyTerminal() {
    Consumer<PipelineJob> listener;
    lock.lock();
    try {
      listener = terminalListener;
      terminalListener = null;
    } finally {
      lock.unlock();
    }
    if (listener != null) {
      listener.accept(this);
    }
  }

  private void apply(JobState next) {
    state = next;
    progress = next == JobState.DONE ? 100 : 0;
    history.add(new StateChange(next, Instant.now()));
  }
}
