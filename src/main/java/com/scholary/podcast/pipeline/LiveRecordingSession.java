package com.scholary.podcast.pipeline;

import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import com.scholary.podcast.capture.RecordingDisconnectedException;
import com.scholary.podcast.capture.RecordingSource;
import com.scholary.podcast.error.PodcastException;
import com.scholary.podcast.job.PipelineJob;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.transcript.TranscriptBuffer;
import com.scholary.podcast.transcript.TranscriptChunk;
import com.scholary.podcast.whisper.LiveTranscription;
import com.scholary.podcast.whisper.TranscriptionService;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * The RECORDING phase of a live meeting job.
 *
 * <p>Two tasks run side by side on the capture executor. The capture task reads PCM from the
 * recording source, appends it to the job's raw recording file and feeds the live transcription
 * session. The ingestion task is the only writer of the job's transcript buffer: it drains the
 * bounded queue the transcription listener fills. Neither task waits on the other.
 *
 * <p>Nothing waits for the recording to end. When capture stops (stop request, cancellation or
 * disconnect) the capture task runs the end-of-recording callback, which hands the job on.
 */
class LiveRecordingSession implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(LiveRecordingSession.class);

  private static final Object END_OF_TRANSCRIPT = new Object();

  private final PipelineJob job;
  private final RecordingSource source;
  private final TranscriptBuffer buffer;
  private final Path pcmFile;
  private final int readBufferBytes;
  private final BlockingQueue<Object> queue;
  private final LiveTranscription transcription;

  private final AtomicLong capturedBytes = new AtomicLong();
  private final AtomicReference<Throwable> disconnect = new AtomicReference<>();
  private final AtomicReference<PodcastException> ingestionFailure = new AtomicReference<>();

  private Future<?> captureTask;
  private Future<?> ingestionTask;

  LiveRecordingSession(
      PipelineJob job,
      RecordingSource source,
      TranscriptionService transcriptionService,
      Path workDir,
      PipelineProperties properties) {
    this.job = job;
    this.source = source;
    this.buffer = job.buffer();
    this.pcmFile = workDir.resolve("recording.pcm");
    this.readBufferBytes = properties.captureBufferBytes();
    this.queue = new ArrayBlockingQueue<>(properties.liveQueueCapacity());
    this.transcription = transcriptionService.startLive(this::enqueue);
  }

  /**
   * Start the ingestion and capture tasks. The capture task is not registered with the job:
   * cancellation ends it by stopping the source, so {@code onRecordingEnded} always runs.
   *
   * @param onRecordingEnded run on the capture thread once capture has stopped
   * @throws org.springframework.core.task.TaskRejectedException if the executor has no free
   *     thread; nothing keeps running in that case once {@link #close()} is called
   */
  void start(AsyncTaskExecutor executor, Runnable onRecordingEnded) {
    job.attachRecordingSource(source);
    ingestionTask = executor.submit(StructuredLogger.withCurrentContext(this::ingest));
    job.registerTask(ingestionTask);
    captureTask =
        executor.submit(
            StructuredLogger.withCurrentContext(
                () -> {
                  try {
                    capture();
                  } finally {
                    onRecordingEnded.run();
                  }
                }));
  }

  long capturedBytes() {
    return capturedBytes.get();
  }

  /** Why capture ended early, or null if it did not. */
  Throwable disconnectCause() {
    return disconnect.get();
  }

  /**
   * Stop capturing, flush the live transcription, drain ingestion and close the transcript buffer.
   *
   * @param recordingWav where to write the captured audio as canonical WAV
   */
  void finish(Path recordingWav) throws InterruptedException, IOException {
    source.stopCapture();
    await(captureTask);
    job.detachRecordingSource();

    transcription.finish();
    queue.put(END_OF_TRANSCRIPT);
    await(ingestionTask);

    PodcastException failure = ingestionFailure.get();
    if (failure != null) {
      throw failure;
    }
    buffer.close();

    byte[] pcm = Files.exists(pcmFile) ? Files.readAllBytes(pcmFile) : new byte[0];
    int usable = pcm.length - pcm.length % AudioFormat.BLOCK_ALIGN;
    WavCodec.writePcm(usable == pcm.length ? pcm : Arrays.copyOf(pcm, usable), recordingWav);
    LOGGER.info(
        "Live recording finished: {} bytes ({}s), {} transcript chunks",
        usable,
        AudioFormat.secondsFor(usable / AudioFormat.BLOCK_ALIGN),
        buffer.size());
  }

  @Override
  public void close() {
    source.stopCapture();
    job.detachRecordingSource();
    transcription.close();
    if (captureTask != null) {
      captureTask.cancel(true);
    }
    if (ingestionTask != null) {
      ingestionTask.cancel(true);
    }
  }

  private void capture() {
    try (InputStream in = source.startCapture();
        OutputStream out = Files.newOutputStream(pcmFile)) {
      byte[] chunk = new byte[readBufferBytes];
      int read;
      while (!job.isStopRequested() && (read = in.read(chunk)) != -1) {
        if (read == 0) {
          continue;
        }
        out.write(chunk, 0, read);
        capturedBytes.addAndGet(read);
        transcription.feed(chunk, read);
      }
      if (!job.isStopRequested()) {
        disconnect.set(new RecordingDisconnectedException("Recording stream ended before stop"));
      }
    } catch (IOException | RecordingDisconnectedException e) {
      if (!job.isStopRequested()) {
        disconnect.set(e);
      }
    }
    LOGGER.debug("Capture ended after {} bytes", capturedBytes.get());
  }

  private void ingest() {
    try {
      while (true) {
        Object item = queue.take();
        if (item == END_OF_TRANSCRIPT) {
          return;
        }
        try {
          buffer.append((TranscriptChunk) item);
        } catch (PodcastException e) {
          ingestionFailure.compareAndSet(null, e);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void enqueue(TranscriptChunk chunk) {
    try {
      queue.put(chunk);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void await(Future<?> task) throws InterruptedException {
    try {
      task.get();
    } catch (CancellationException e) {
      throw new InterruptedException("Recording task cancelled");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Recording task failed", cause);
    }
  }
}
