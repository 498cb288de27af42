package com.scholary.podcast.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import com.scholary.podcast.transcript.TranscriptChunk;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for calling the faster-whisper transcription API.
 *
 * <p>This handles the low-level HTTP communication: building multipart requests, sending audio,
 * parsing responses, and retrying on transient failures.
 *
 * <p>Live meetings are transcribed in windows: captured PCM is buffered until a window is full,
 * then sent as one WAV request on a single worker thread. Segment times are shifted by the
 * window's offset and clamped so delivered chunks never overlap or go backwards.
 */
public class WhisperClient implements TranscriptionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    // Build HTTP client with configured timeouts
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public List<TranscriptChunk> transcribe(Path wavFile) {
    byte[] wav;
    try {
      wav = Files.readAllBytes(wavFile);
    } catch (IOException e) {
      throw new WhisperException("Cannot read audio file " + wavFile.getFileName(), e);
    }
    int pcmBytes = Math.max(0, wav.length - AudioFormat.WAV_HEADER_SIZE);
    double duration = AudioFormat.secondsFor(pcmBytes / AudioFormat.BLOCK_ALIGN);
    WhisperResponse response =
        transcribeWithRetry(wav, wavFile.getFileName().toString(), duration, 0);
    List<TranscriptChunk> chunks = toChunks(response, 0.0, 0.0);
    LOGGER.info(
        "Transcribed {}: {} chunks, language={}",
        wavFile.getFileName(),
        chunks.size(),
        response.language());
    return chunks;
  }

  @Override
  public LiveTranscription startLive(Consumer<TranscriptChunk> listener) {
    return new WindowedLiveTranscription(listener);
  }

  /**
   * Convert service segments into buffer-safe chunks.
   *
   * <p>Segments are shifted by {@code offset}, sorted, stripped of blank text and clamped so each
   * starts no earlier than the previous one ended (and no earlier than {@code floor}).
   */
  static List<TranscriptChunk> toChunks(WhisperResponse response, double offset, double floor) {
    if (response == null || response.segments() == null) {
      return List.of();
    }
    List<TranscriptSegment> segments = new ArrayList<>(response.segments());
    segments.sort(Comparator.comparingDouble(TranscriptSegment::start));

    List<TranscriptChunk> chunks = new ArrayList<>(segments.size());
    double cursor = floor;
    for (TranscriptSegment segment : segments) {
      if (segment.text() == null || segment.text().isBlank()) {
        continue;
      }
      double start = Math.max(segment.start() + offset, cursor);
      double end = Math.max(segment.end() + offset, start);
      chunks.add(new TranscriptChunk(start, end, segment.speaker(), segment.text().trim()));
      cursor = end;
    }
    return chunks;
  }

  /**
   * Transcribe one audio payload, retrying transient failures.
   *
   * @throws WhisperException if transcription fails after retries
   */
  private WhisperResponse transcribeWithRetry(
      byte[] wav, String filename, double durationSeconds, int chunkIndex) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(wav, filename, durationSeconds, chunkIndex);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long base = properties.retryBackoffMs();
          long backoffMs = (long) (Math.pow(2, attempt) * base + Math.random() * base);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new WhisperException("Transcription interrupted", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new WhisperException("Transcription interrupted", e);
      }
    }

    throw new WhisperException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private WhisperResponse attemptTranscribe(
      byte[] wav, String filename, double durationSeconds, int chunkIndex)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher =
        buildMultipartBody(wav, filename, durationSeconds, chunkIndex, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    return objectMapper.readValue(response.body(), WhisperResponse.class);
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no multipart support, so the parts are assembled by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="recording.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="chunkDurationSeconds"
   *
   * 15.0
   * --boundary
   * Content-Disposition: form-data; name="chunkIndex"
   *
   * 0
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(
      byte[] wav, String filename, double durationSeconds, int chunkIndex, String boundary) {

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");
    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"chunkDurationSeconds\"\r\n\r\n");
    sb.append(durationSeconds).append("\r\n");
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"chunkIndex\"\r\n\r\n");
    sb.append(chunkIndex).append("\r\n");
    sb.append("--").append(boundary).append("--\r\n");
    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + wav.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(wav, 0, body, prefix.length, wav.length);
    System.arraycopy(suffix, 0, body, prefix.length + wav.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  /** Live session sending fixed-length windows of captured audio. */
  class WindowedLiveTranscription implements LiveTranscription {

    private final Consumer<TranscriptChunk> listener;
    private final ExecutorService worker;
    private final List<Future<?>> pending = new ArrayList<>();
    private final AtomicReference<WhisperException> firstFailure = new AtomicReference<>();
    private final ByteArrayOutputStream window = new ByteArrayOutputStream();
    private final int windowBytes;

    private double windowStart;
    private int windowIndex;
    private boolean finished;

    // Only touched by the worker thread
    private double deliveredUntil;

    WindowedLiveTranscription(Consumer<TranscriptChunk> listener) {
      this.listener = listener;
      int bytes = (int) (properties.liveWindowSeconds() * AudioFormat.BYTE_RATE);
      this.windowBytes = Math.max(AudioFormat.BLOCK_ALIGN, bytes - bytes % AudioFormat.BLOCK_ALIGN);
      this.worker =
          Executors.newSingleThreadExecutor(
              runnable -> {
                Thread thread = new Thread(runnable, "live-transcription");
                thread.setDaemon(true);
                return thread;
              });
    }

    @Override
    public synchronized void feed(byte[] pcm, int length) {
      if (finished) {
        throw new IllegalStateException("Live transcription already finished");
      }
      int offset = 0;
      while (offset < length) {
        int take = Math.min(length - offset, windowBytes - window.size());
        window.write(pcm, offset, take);
        offset += take;
        if (window.size() >= windowBytes) {
          submitWindow();
        }
      }
    }

    @Override
    public void finish() throws InterruptedException {
      List<Future<?>> toAwait;
      synchronized (this) {
        if (!finished) {
          finished = true;
          if (window.size() >= AudioFormat.BLOCK_ALIGN) {
            submitWindow();
          }
        }
        toAwait = new ArrayList<>(pending);
      }
      try {
        for (Future<?> future : toAwait) {
          future.get();
        }
      } catch (ExecutionException e) {
        recordFailure(e.getCause());
      } finally {
        worker.shutdown();
      }
      WhisperException failure = firstFailure.get();
      if (failure != null) {
        throw failure;
      }
    }

    @Override
    public void close() {
      worker.shutdownNow();
    }

    private void submitWindow() {
      byte[] pcm = window.toByteArray();
      window.reset();
      int usable = pcm.length - pcm.length % AudioFormat.BLOCK_ALIGN;
      double offset = windowStart;
      double duration = (double) usable / AudioFormat.BYTE_RATE;
      int index = windowIndex++;
      windowStart += duration;

      byte[] wav = WavCodec.encodePcm(Arrays.copyOf(pcm, usable));
      pending.removeIf(Future::isDone);
      pending.add(
          worker.submit(
              () -> {
                try {
                  WhisperResponse response =
                      transcribeWithRetry(wav, "live-" + index + ".wav", duration, index);
                  List<TranscriptChunk> chunks = toChunks(response, offset, deliveredUntil);
                  for (TranscriptChunk chunk : chunks) {
                    listener.accept(chunk);
                    deliveredUntil = chunk.end();
                  }
                  LOGGER.debug(
                      "Live window {} transcribed: offset={}s, chunks={}",
                      index,
                      offset,
                      chunks.size());
                } catch (RuntimeException e) {
                  LOGGER.error("Live window {} failed at offset {}s", index, offset, e);
                  recordFailure(e);
                }
              }));
    }

    // Later windows keep going; only the first failure is reported from finish()
    private void recordFailure(Throwable cause) {
      WhisperException failure =
          cause instanceof WhisperException whisperException
              ? whisperException
              : new WhisperException("Live transcription failed: " + cause, cause);
      firstFailure.compareAndSet(null, failure);
    }

    /** Windows still tracked, finished ones included until the next submit prunes them. */
    synchronized int trackedWindows() {
      return pending.size();
    }
  }
}
