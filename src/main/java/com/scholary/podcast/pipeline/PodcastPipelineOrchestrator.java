package com.scholary.podcast.pipeline;

import com.scholary.podcast.assembly.AssetResolver;
import com.scholary.podcast.assembly.AssetUnreadableException;
import com.scholary.podcast.assembly.AudioAssembler;
import com.scholary.podcast.assembly.MusicLibrary;
import com.scholary.podcast.assembly.RenderedPodcast;
import com.scholary.podcast.assembly.Timeline;
import com.scholary.podcast.audio.AudioConverter;
import com.scholary.podcast.capture.RecordingDisconnectedException;
import com.scholary.podcast.capture.RecordingSourceFactory;
import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;
import com.scholary.podcast.job.InvalidConfigException;
import com.scholary.podcast.job.JobNotFoundException;
import com.scholary.podcast.job.JobRepository;
import com.scholary.podcast.job.JobSnapshot;
import com.scholary.podcast.job.JobState;
import com.scholary.podcast.job.JobStateConflictException;
import com.scholary.podcast.job.PipelineJob;
import com.scholary.podcast.job.PodcastConfig;
import com.scholary.podcast.job.WorkflowKind;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.narration.NarrationClip;
import com.scholary.podcast.narration.NarrationOutcome;
import com.scholary.podcast.narration.NarrationSynthesizer;
import com.scholary.podcast.objectstore.ObjectStoreClient;
import com.scholary.podcast.objectstore.ObjectStoreException;
import com.scholary.podcast.objectstore.ObjectStoreProperties;
import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.selection.SegmentSelector;
import com.scholary.podcast.storage.ManifestWriter;
import com.scholary.podcast.storage.PodcastManifest;
import com.scholary.podcast.storage.PodcastStorage;
import com.scholary.podcast.storage.StoredPodcast;
import com.scholary.podcast.transcript.TranscriptBuffer;
import com.scholary.podcast.transcript.TranscriptChunk;
import com.scholary.podcast.whisper.TranscriptionService;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Runs meeting-to-podcast jobs.
 *
 * <p>Each job gets a supervising task on the pipeline executor that walks it through the state
 * machine:
 *
 * <ul>
 *   <li>UPLOAD: fetch the audio, convert it, transcribe it (or take the supplied transcript)
 *   <li>LIVE_MEETING: start recording and return. No pipeline thread is held while a meeting
 *       records; once capture ends the remaining stages are submitted as a new task that flushes
 *       the live transcript first
 *   <li>select key segments, narrate them, assemble the podcast and store it
 * </ul>
 *
 * <p>Only a narration failure degrades a job (the segment falls back to its original audio);
 * every other failure ends it in FAILED with the stage and error kind recorded. Cancellation is
 * checked at every stage boundary and interrupts whatever the job is waiting on.
 */
@Service
public class PodcastPipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PodcastPipelineOrchestrator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final String RECORDING_FILE = "recording.wav";
  private static final DateTimeFormatter DEFAULT_TITLE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final JobRepository jobRepository;
  private final TranscriptionService transcriptionService;
  private final SegmentSelector segmentSelector;
  private final NarrationSynthesizer narrationSynthesizer;
  private final AudioAssembler audioAssembler;
  private final MusicLibrary musicLibrary;
  private final ManifestWriter manifestWriter;
  private final PodcastStorage podcastStorage;
  private final ObjectStoreClient objectStoreClient;
  private final AudioConverter audioConverter;
  private final RecordingSourceFactory recordingSourceFactory;
  private final AsyncTaskExecutor pipelineExecutor;
  private final AsyncTaskExecutor captureExecutor;
  private final PipelineProperties properties;
  private final String defaultBucket;
  private final Path tempDir;
  private final Clock clock;

  @Autowired
  public PodcastPipelineOrchestrator(
      JobRepository jobRepository,
      TranscriptionService transcriptionService,
      SegmentSelector segmentSelector,
      NarrationSynthesizer narrationSynthesizer,
      AudioAssembler audioAssembler,
      MusicLibrary musicLibrary,
      ManifestWriter manifestWriter,
      PodcastStorage podcastStorage,
      ObjectStoreClient objectStoreClient,
      AudioConverter audioConverter,
      RecordingSourceFactory recordingSourceFactory,
      @Qualifier("pipelineExecutor") AsyncTaskExecutor pipelineExecutor,
      @Qualifier("captureExecutor") AsyncTaskExecutor captureExecutor,
      PipelineProperties properties,
      ObjectStoreProperties objectStoreProperties) {
    this(
        jobRepository,
        transcriptionService,
        segmentSelector,
        narrationSynthesizer,
        audioAssembler,
        musicLibrary,
        manifestWriter,
        podcastStorage,
        objectStoreClient,
        audioConverter,
        recordingSourceFactory,
        pipelineExecutor,
        captureExecutor,
        properties,
        objectStoreProperties,
        Clock.systemDefaultZone());
  }

  PodcastPipelineOrchestrator(
      JobRepository jobRepository,
      TranscriptionService transcriptionService,
      SegmentSelector segmentSelector,
      NarrationSynthesizer narrationSynthesizer,
      AudioAssembler audioAssembler,
      MusicLibrary musicLibrary,
      ManifestWriter manifestWriter,
      PodcastStorage podcastStorage,
      ObjectStoreClient objectStoreClient,
      AudioConverter audioConverter,
      RecordingSourceFactory recordingSourceFactory,
      AsyncTaskExecutor pipelineExecutor,
      AsyncTaskExecutor captureExecutor,
      PipelineProperties properties,
      ObjectStoreProperties objectStoreProperties,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.transcriptionService = transcriptionService;
    this.segmentSelector = segmentSelector;
    this.narrationSynthesizer = narrationSynthesizer;
    this.audioAssembler = audioAssembler;
    this.musicLibrary = musicLibrary;
    this.manifestWriter = manifestWriter;
    this.podcastStorage = podcastStorage;
    this.objectStoreClient = objectStoreClient;
    this.audioConverter = audioConverter;
    this.recordingSourceFactory = recordingSourceFactory;
    this.pipelineExecutor = pipelineExecutor;
    this.captureExecutor = captureExecutor;
    this.properties = properties;
    this.defaultBucket = objectStoreProperties.bucket();
    this.tempDir = Paths.get(properties.tempDir());
    this.clock = clock;

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create temp directory: " + tempDir, e);
    }
  }

  /**
   * Register a job and start processing it in the background. A job without a title is named
   * after the local time it was created, as in {@code Meeting 2024-05-01 10:00}.
   *
   * @return the job as created
   * @throws InvalidConfigException if an upload has no audio key
   * @throws PodcastException if a supplied transcript is out of order or overlapping
   */
  public JobSnapshot createJob(CreatePodcastCommand command) {
    WorkflowKind workflow = command.workflow();
    if (workflow == null) {
      throw new InvalidConfigException("workflow is required");
    }
    if (workflow == WorkflowKind.UPLOAD
        && (command.audioKey() == null || command.audioKey().isBlank())) {
      throw new InvalidConfigException("audioKey is required for uploads");
    }
    if (workflow == WorkflowKind.LIVE_MEETING && command.transcript() != null) {
      throw new InvalidConfigException("A transcript can only be supplied with an upload");
    }
    PodcastConfig config = command.config() != null ? command.config() : PodcastConfig.defaults();
    String bucket =
        command.audioBucket() == null || command.audioBucket().isBlank()
            ? defaultBucket
            : command.audioBucket();

    String title =
        command.title() == null || command.title().isBlank()
            ? "Meeting " + LocalDateTime.now(clock).format(DEFAULT_TITLE_FORMAT)
            : command.title();

    PipelineJob job =
        new PipelineJob(
            UUID.randomUUID().toString(),
            workflow,
            title,
            config,
            bucket,
            command.audioKey(),
            command.transcript());

    // Reject a malformed transcript now rather than mid-pipeline
    if (command.transcript() != null) {
      for (TranscriptChunk chunk : command.transcript()) {
        job.buffer().append(chunk);
      }
    }

    jobRepository.save(job);
    try {
      StructuredLogger.setJobContext(job.id(), workflow.name());
      LOGGER.info(
          "Created job: workflow={}, title={}, voice={}, style={}, segments={}, music={},"
              + " active={}",
          workflow,
          title,
          config.voice().tag(),
          config.style().tag(),
          config.segmentCount(),
          config.addMusic(),
          jobRepository.activeCount());

      Future<?> supervisor = pipelineExecutor.submit(() -> run(job));
      job.registerTask(supervisor);

    } catch (TaskRejectedException e) {
      LOGGER.error("Pipeline at capacity, rejecting job {}", job.id(), e);
      job.fail(ErrorKind.INTERNAL, "Pipeline is at capacity, try again later");
    } finally {
      StructuredLogger.clearJobContext();
    }
    return job.snapshot();
  }

  /** Current status of a job. */
  public JobSnapshot status(String jobId) {
    return requireJob(jobId).snapshot();
  }

  /**
   * End the recording of a live meeting. Repeated calls, and calls for jobs that are not
   * recording, change nothing.
   */
  public JobSnapshot stopRecording(String jobId) {
    PipelineJob job = requireJob(jobId);
    JobState state = job.state();
    boolean recording =
        job.workflow() == WorkflowKind.LIVE_MEETING
            && (state == JobState.CREATED || state == JobState.RECORDING);
    if (recording && job.requestStop()) {
      LOGGER.info("Stop requested for job {}", jobId);
    } else {
      LOGGER.debug("Ignoring stop for job {} in state {}", jobId, state);
    }
    return job.snapshot();
  }

  /**
   * Cancel a job. Cancelling an already cancelled job changes nothing.
   *
   * @throws JobStateConflictException if the job already finished or failed
   */
  public JobSnapshot cancel(String jobId) {
    PipelineJob job = requireJob(jobId);
    JobState previous = job.cancel();
    if (previous != JobState.CANCELLED) {
      STRUCTURED_LOGGER.logStateTransition(jobId, previous.name(), JobState.CANCELLED.name());
    }
    return job.snapshot();
  }

  /**
   * Confirm receipt of a finished job's outcome and forget the job.
   *
   * @throws JobStateConflictException if the job is still running
   */
  public void acknowledge(String jobId) {
    PipelineJob job = requireJob(jobId);
    JobState state = job.state();
    if (!state.isTerminal()) {
      throw new JobStateConflictException(
          state, "Job " + jobId + " is still " + state + " and cannot be acknowledged");
    }
    jobRepository.delete(jobId);
    LOGGER.info("Job {} acknowledged in state {}", jobId, state);
  }

  /**
   * Preview the key segments of the transcript received so far, scored by the local heuristic.
   *
   * @throws JobStateConflictException if the job was cancelled
   */
  public List<KeySegment> previewSegments(String jobId) {
    PipelineJob job = requireJob(jobId);
    if (job.state() == JobState.CANCELLED) {
      throw new JobStateConflictException(JobState.CANCELLED, "Job " + jobId + " was cancelled");
    }
    PodcastConfig config = job.config();
    return segmentSelector.selectHeuristic(
        job.buffer().snapshot(), config.segmentCount(), config.style());
  }

  private PipelineJob requireJob(String jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  void run(PipelineJob job) {
    StructuredLogger.setJobContext(job.id(), job.workflow().name());
    try {
      if (job.workflow() == WorkflowKind.LIVE_MEETING) {
        startRecording(job);
      } else {
        processUpload(job);
      }
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void processUpload(PipelineJob job) {
    Path workDir = null;
    try {
      workDir = Files.createTempDirectory(tempDir, "job-");
      if (!advance(job, JobState.TRANSCRIBING)) {
        return;
      }
      Path recording = workDir.resolve(RECORDING_FILE);
      transcribeUpload(job, workDir, recording);
      produce(job, recording);
    } catch (InterruptedException | IOException | RuntimeException e) {
      handleFailure(job, e);
    } finally {
      deleteQuietly(workDir);
    }
  }

  /**
   * Move a live job to RECORDING and start its capture tasks. Returns right away; the work
   * directory and session are released by the stages that run once capture ends.
   */
  private void startRecording(PipelineJob job) {
    Path workDir = null;
    LiveRecordingSession session = null;
    boolean started = false;
    try {
      workDir = Files.createTempDirectory(tempDir, "job-");
      if (!advance(job, JobState.RECORDING)) {
        return;
      }
      session =
          new LiveRecordingSession(
              job,
              recordingSourceFactory.create(job.id()),
              transcriptionService,
              workDir,
              properties);
      LiveRecordingSession live = session;
      Path dir = workDir;
      session.start(captureExecutor, () -> recordingEnded(job, live, dir));
      started = true;
      LOGGER.info("Recording started for job {}", job.id());

    } catch (TaskRejectedException e) {
      LOGGER.error("Capture at capacity, rejecting live job {}", job.id(), e);
      fail(job, ErrorKind.INTERNAL, "Live capture is at capacity, try again later", e);
    } catch (IOException | RuntimeException e) {
      handleFailure(job, e);
    } finally {
      if (!started) {
        if (session != null) {
          session.close();
        }
        deleteQuietly(workDir);
      }
    }
  }

  /**
   * Submit the post-recording stages. Runs on the capture thread. Whoever gets there first, the
   * stages or a cancellation that stops them before they start, releases the session.
   */
  private void recordingEnded(PipelineJob job, LiveRecordingSession session, Path workDir) {
    AtomicBoolean released = new AtomicBoolean();
    Runnable release =
        () -> {
          if (released.compareAndSet(false, true)) {
            session.close();
            deleteQuietly(workDir);
          }
        };
    AtomicBoolean running = new AtomicBoolean();
    Runnable stages =
        StructuredLogger.withCurrentContext(
            () -> {
              running.set(true);
              try {
                finishRecording(job, session, workDir);
              } finally {
                release.run();
              }
            });
    FutureTask<Void> task =
        new FutureTask<>(stages, null) {
          @Override
          protected void done() {
            if (isCancelled() && !running.get()) {
              release.run();
            }
          }
        };

    try {
      pipelineExecutor.execute(task);
      job.registerTask(task);
    } catch (TaskRejectedException e) {
      LOGGER.error("Pipeline at capacity, failing recorded job {}", job.id(), e);
      release.run();
      fail(job, ErrorKind.INTERNAL, "Pipeline is at capacity, try again later", e);
    }
  }

  private void finishRecording(PipelineJob job, LiveRecordingSession session, Path workDir) {
    try {
      checkDisconnect(job, session);
      if (!advance(job, JobState.TRANSCRIBING)) {
        return;
      }
      Path recording = workDir.resolve(RECORDING_FILE);
      session.finish(recording);
      produce(job, recording);
    } catch (InterruptedException | IOException | RuntimeException e) {
      handleFailure(job, e);
    }
  }

  /** Select, narrate, assemble and store. Expects the job in TRANSCRIBING with a closed buffer. */
  private void produce(PipelineJob job, Path recording)
      throws InterruptedException, IOException {
    if (!advance(job, JobState.SELECTING)) {
      return;
    }
    PodcastConfig config = job.config();
    List<KeySegment> segments =
        segmentSelector.select(job.buffer().snapshot(), config.segmentCount(), config.style());
    job.setKeySegments(segments);
    LOGGER.info(
        "Selected {} of {} requested key segments", segments.size(), config.segmentCount());

    if (!advance(job, JobState.SYNTHESIZING)) {
      return;
    }
    Map<String, NarrationClip> clips = narrate(job, segments);

    if (!advance(job, JobState.ASSEMBLING)) {
      return;
    }
    String musicRef = config.addMusic() ? musicLibrary.trackRef() : null;
    Timeline timeline = audioAssembler.buildTimeline(segments, clips, musicRef);
    RenderedPodcast rendered = audioAssembler.render(timeline, assets(recording, clips));
    PodcastManifest manifest =
        manifestWriter.buildManifest(
            job.id(),
            job.title(),
            job.createdAt(),
            config.voice(),
            config.style(),
            segments,
            job.degradedSegmentIds(),
            timeline,
            rendered.durationSeconds());

    if (job.state() != JobState.ASSEMBLING) {
      LOGGER.info("Job {} cancelled before hand-off, dropping rendered output", job.id());
      return;
    }
    StoredPodcast stored = podcastStorage.store(job.id(), rendered, manifest);
    if (job.complete(stored, rendered.durationSeconds())) {
      STRUCTURED_LOGGER.logStateTransition(
          job.id(), JobState.ASSEMBLING.name(), JobState.DONE.name());
      LOGGER.info(
          "Job {} done: duration={}s, degraded segments={}",
          job.id(),
          rendered.durationSeconds(),
          manifest.failedSegmentIds().size());
    } else {
      LOGGER.info("Job {} cancelled during hand-off, discarding stored output", job.id());
      podcastStorage.discard(stored);
    }
  }

  private void handleFailure(PipelineJob job, Exception e) {
    if (e instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      fail(job, ErrorKind.INTERNAL, "Pipeline interrupted", e);
    } else if (e instanceof PodcastException podcastException) {
      fail(job, podcastException.kind(), e.getMessage(), e);
    } else if (e instanceof IOException) {
      fail(job, ErrorKind.INTERNAL, "I/O failure: " + e.getMessage(), e);
    } else {
      fail(job, ErrorKind.INTERNAL, String.valueOf(e.getMessage()), e);
    }
  }

  private void checkDisconnect(PipelineJob job, LiveRecordingSession session) {
    Throwable cause = session.disconnectCause();
    if (cause == null) {
      return;
    }
    if (session.capturedBytes() == 0) {
      throw new RecordingDisconnectedException(
          "Recording disconnected before any audio was captured: " + cause.getMessage(), cause);
    }
    String message =
        String.format(
            "Recording disconnected after %d bytes, continuing with captured audio: %s",
            session.capturedBytes(), cause.getMessage());
    LOGGER.warn(message);
    job.logWarning(ErrorKind.RECORDING_DISCONNECTED, message, null);
  }

  private void transcribeUpload(PipelineJob job, Path workDir, Path recording) throws IOException {
    Path source = workDir.resolve("source" + extensionOf(job.audioKey()));
    try (InputStream in = objectStoreClient.getObjectStream(job.audioBucket(), job.audioKey())) {
      Files.copy(in, source, StandardCopyOption.REPLACE_EXISTING);
    } catch (ObjectStoreException e) {
      throw new AssetUnreadableException(
          job.audioKey(), "Cannot fetch uploaded audio: " + e.getMessage(), e);
    }
    job.setProgress(20);

    try {
      audioConverter.toCanonicalWav(source, recording);
    } catch (IOException e) {
      throw new AssetUnreadableException(
          job.audioKey(), "Cannot convert uploaded audio: " + e.getMessage(), e);
    }
    job.setProgress(40);

    TranscriptBuffer buffer = job.buffer();
    if (job.providedTranscript() == null) {
      List<TranscriptChunk> chunks = transcriptionService.transcribe(recording);
      job.setProgress(80);
      for (TranscriptChunk chunk : chunks) {
        buffer.append(chunk);
      }
    } else {
      LOGGER.info("Using supplied transcript: {} chunks", buffer.size());
    }
    buffer.close();
    job.setProgress(100);
  }

  private Map<String, NarrationClip> narrate(PipelineJob job, List<KeySegment> segments)
      throws InterruptedException {
    int total = segments.size();
    AtomicInteger finished = new AtomicInteger();
    List<NarrationOutcome> outcomes =
        narrationSynthesizer.synthesizeAll(
            segments,
            job.config().voice(),
            outcome -> {
              int done = finished.incrementAndGet();
              int percent = done * 100 / total;
              job.setProgress(percent);
              STRUCTURED_LOGGER.logJobProgress(job.id(), done, total, percent, "synthesizing");
            });

    Map<String, NarrationClip> clips = new HashMap<>();
    for (NarrationOutcome outcome : outcomes) {
      if (outcome.isNarrated()) {
        clips.put(outcome.keySegmentId(), outcome.clip());
      } else {
        job.logWarning(
            outcome.errorKind(),
            "Narration unavailable, using original audio: " + outcome.message(),
            outcome.keySegmentId());
      }
    }
    return clips;
  }

  private AssetResolver assets(Path recording, Map<String, NarrationClip> clips) {
    return sourceRef -> {
      if (AudioAssembler.RECORDING_REF.equals(sourceRef)) {
        return Files.readAllBytes(recording);
      }
      String segmentId = AudioAssembler.narrationSegmentId(sourceRef);
      if (segmentId != null) {
        NarrationClip clip = clips.get(segmentId);
        if (clip == null) {
          throw new IOException("No narration clip for segment " + segmentId);
        }
        return clip.audio();
      }
      if (musicLibrary.owns(sourceRef)) {
        return musicLibrary.load(sourceRef);
      }
      throw new IOException("Unknown asset reference: " + sourceRef);
    };
  }

  private boolean advance(PipelineJob job, JobState next) {
    JobState from = job.state();
    if (!job.transitionTo(next)) {
      LOGGER.info("Job {} is {}, not moving to {}", job.id(), job.state(), next);
      return false;
    }
    STRUCTURED_LOGGER.logStateTransition(job.id(), from.name(), next.name());
    return true;
  }

  private void fail(PipelineJob job, ErrorKind kind, String message, Throwable cause) {
    if (job.state() == JobState.CANCELLED) {
      LOGGER.info("Job {} cancelled, ignoring {}: {}", job.id(), kind, message);
      return;
    }
    JobState stage = job.fail(kind, message);
    if (stage != null) {
      LOGGER.error("Job {} failed in {}: {} - {}", job.id(), stage, kind, message, cause);
      STRUCTURED_LOGGER.logStateTransition(job.id(), stage.name(), JobState.FAILED.name());
    }
  }

  private static String extensionOf(String key) {
    int slash = key.lastIndexOf('/');
    int dot = key.lastIndexOf('.');
    return dot > slash ? key.substring(dot) : "";
  }

  private static void deleteQuietly(Path dir) {
    if (dir == null || !Files.exists(dir)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(PodcastPipelineOrchestrator::deleteFile);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up work directory {}: {}", dir, e.getMessage());
    }
  }

  private static void deleteFile(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
