package com.scholary.podcast.narration;

import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import com.scholary.podcast.audio.WavFormatException;
import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.selection.KeySegment;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Turns key segment summaries into narration clips, isolating the pipeline from vendor failures.
 *
 * <p>Transient failures (timeouts, rate limits, 5xx) are retried with exponential backoff.
 * Permanent failures, undecodable audio and unknown voices are not. Every attempt is logged with
 * its number and outcome.
 *
 * <p>{@link #synthesizeAll} narrates a whole selection in parallel on the shared narration
 * executor, at most {@code concurrency} segments of one job at a time, and reports one explicit
 * {@link NarrationOutcome} per segment, so a single segment's failure never surfaces as an
 * exception.
 */
@Component
public class NarrationSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(NarrationSynthesizer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final SpeechSynthesizer synthesizer;
  private final RetryPolicy retryPolicy;
  private final int concurrency;
  private final AsyncTaskExecutor executor;

  @Autowired
  public NarrationSynthesizer(
      SpeechSynthesizer synthesizer,
      NarrationProperties properties,
      @Qualifier("narrationExecutor") AsyncTaskExecutor executor) {
    this(synthesizer, properties.retryPolicy(), properties.concurrency(), executor);
  }

  public NarrationSynthesizer(
      SpeechSynthesizer synthesizer,
      RetryPolicy retryPolicy,
      int concurrency,
      AsyncTaskExecutor executor) {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }
    this.synthesizer = synthesizer;
    this.retryPolicy = retryPolicy;
    this.concurrency = concurrency;
    this.executor = executor;
  }

  /**
   * Synthesize narration for one segment.
   *
   * @param keySegmentId the segment being narrated
   * @param text the narration text
   * @param voice the requested voice
   * @return the clip
   * @throws InvalidVoiceException if the voice is rejected
   * @throws SynthesisUnavailableException if the retry budget is exhausted or the failure is
   *     permanent
   */
  public NarrationClip synthesize(String keySegmentId, String text, VoiceId voice) {
    Attempt attempt = attempt(keySegmentId, text, voice);
    NarrationOutcome outcome = attempt.outcome();
    if (outcome.isNarrated()) {
      return outcome.clip();
    }
    if (outcome.errorKind() == ErrorKind.INVALID_VOICE) {
      throw new InvalidVoiceException(outcome.message(), attempt.cause());
    }
    throw new SynthesisUnavailableException(outcome.message(), outcome.attempts(), attempt.cause());
  }

  /**
   * Narrate every segment, up to the configured number in parallel.
   *
   * @param segments segments in rank order
   * @param voice the requested voice
   * @param listener called from worker threads as each outcome becomes known
   * @return one outcome per segment, in the same order as {@code segments}
   * @throws InterruptedException if the calling thread is interrupted; in-flight calls are
   *     abandoned
   */
  public List<NarrationOutcome> synthesizeAll(
      List<KeySegment> segments, VoiceId voice, Consumer<NarrationOutcome> listener)
      throws InterruptedException {
    if (segments.isEmpty()) {
      return List.of();
    }
    Semaphore permits = new Semaphore(concurrency);
    Map<String, String> context = MDC.getCopyOfContextMap();
    List<Future<NarrationOutcome>> futures = new ArrayList<>(segments.size());
    try {
      for (KeySegment segment : segments) {
        permits.acquire();
        try {
          futures.add(
              executor.submit(
                  () -> {
                    if (context != null) {
                      MDC.setContextMap(context);
                    }
                    try {
                      NarrationOutcome outcome =
                          attempt(segment.id(), NarrationScript.forSegment(segment), voice)
                              .outcome();
                      listener.accept(outcome);
                      return outcome;
                    } finally {
                      MDC.clear();
                      permits.release();
                    }
                  }));
        } catch (TaskRejectedException e) {
          permits.release();
          LOGGER.warn("Narration executor full, segment {} keeps its original audio", segment.id());
          NarrationOutcome outcome =
              NarrationOutcome.failed(
                  segment.id(), ErrorKind.SYNTHESIS_UNAVAILABLE, "Narration executor is full", 0);
          listener.accept(outcome);
          futures.add(CompletableFuture.completedFuture(outcome));
        }
      }

      List<NarrationOutcome> outcomes = new ArrayList<>(segments.size());
      for (int i = 0; i < futures.size(); i++) {
        try {
          outcomes.add(futures.get(i).get());
        } catch (ExecutionException e) {
          String id = segments.get(i).id();
          LOGGER.error("Narration task crashed for segment {}", id, e.getCause());
          outcomes.add(
              NarrationOutcome.failed(id, ErrorKind.INTERNAL, String.valueOf(e.getCause()), 0));
        }
      }
      return outcomes;

    } catch (InterruptedException e) {
      LOGGER.info("Narration interrupted; abandoning {} submitted calls", futures.size());
      futures.forEach(f -> f.cancel(true));
      throw e;
    }
  }

  private Attempt attempt(String keySegmentId, String text, VoiceId voice) {
    int maxAttempts = retryPolicy.maxAttempts();
    RuntimeException lastFailure = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (Thread.currentThread().isInterrupted()) {
        return failure(keySegmentId, attempt - 1, "Synthesis interrupted", null);
      }
      try {
        byte[] audio = synthesizer.synthesize(text, voice);
        double duration = decodeDuration(audio);
        STRUCTURED_LOGGER.logSynthesisAttempt(keySegmentId, attempt, maxAttempts, "success");
        NarrationClip clip = new NarrationClip(keySegmentId, audio, duration, voice);
        return new Attempt(NarrationOutcome.narrated(clip, attempt), null);

      } catch (SpeechSynthesisException e) {
        STRUCTURED_LOGGER.logSynthesisAttempt(
            keySegmentId, attempt, maxAttempts, e.reason().name().toLowerCase(Locale.ROOT));
        if (e.reason() == SpeechSynthesisException.Reason.INVALID_VOICE) {
          String message = "Voice '" + voice.tag() + "' rejected: " + e.getMessage();
          STRUCTURED_LOGGER.logSynthesisFailed(keySegmentId, attempt, "invalid_voice", message);
          return new Attempt(
              NarrationOutcome.failed(keySegmentId, ErrorKind.INVALID_VOICE, message, attempt), e);
        }
        if (!e.isTransient()) {
          return failure(
              keySegmentId, attempt, "Permanent synthesis failure: " + e.getMessage(), e);
        }
        lastFailure = e;

      } catch (WavFormatException e) {
        STRUCTURED_LOGGER.logSynthesisAttempt(keySegmentId, attempt, maxAttempts, "undecodable");
        return failure(
            keySegmentId,
            attempt,
            "Synthesizer returned undecodable audio: " + e.getMessage(),
            e);

      } catch (RuntimeException e) {
        STRUCTURED_LOGGER.logSynthesisAttempt(keySegmentId, attempt, maxAttempts, "error");
        lastFailure = e;
      }

      if (attempt < maxAttempts) {
        Duration backoff = retryPolicy.backoffAfter(attempt);
        STRUCTURED_LOGGER.logSynthesisRetry(
            keySegmentId,
            attempt,
            maxAttempts,
            backoff.toMillis(),
            lastFailure.getClass().getSimpleName(),
            lastFailure.getMessage());
        try {
          Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return failure(keySegmentId, attempt, "Synthesis interrupted", ie);
        }
      }
    }

    return failure(
        keySegmentId,
        maxAttempts,
        String.format(
            "Synthesis failed after %d attempts: %s",
            maxAttempts, lastFailure == null ? "unknown" : lastFailure.getMessage()),
        lastFailure);
  }

  private static Attempt failure(
      String keySegmentId, int attempts, String message, Throwable cause) {
    STRUCTURED_LOGGER.logSynthesisFailed(keySegmentId, attempts, "synthesis_unavailable", message);
    return new Attempt(
        NarrationOutcome.failed(keySegmentId, ErrorKind.SYNTHESIS_UNAVAILABLE, message, attempts),
        cause);
  }

  private static double decodeDuration(byte[] audio) {
    if (audio == null) {
      throw new WavFormatException("Synthesizer returned no audio");
    }
    short[] samples = WavCodec.decode(audio);
    if (samples.length == 0) {
      throw new WavFormatException("Synthesizer returned empty audio");
    }
    return AudioFormat.secondsFor(samples.length);
  }

  private record Attempt(NarrationOutcome outcome, Throwable cause) {}
}
