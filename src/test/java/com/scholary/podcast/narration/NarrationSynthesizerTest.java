package com.scholary.podcast.narration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.selection.SegmentStyle;
import com.scholary.podcast.transcript.TimeRange;
import com.scholary.podcast.config.AsyncConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class NarrationSynthesizerTest {

  private static final RetryPolicy NO_WAIT = new RetryPolicy(3, Duration.ZERO, 2.0, Duration.ZERO);

  private final SimulatedSpeechSynthesizer simulated = new SimulatedSpeechSynthesizer();

  private ThreadPoolTaskExecutor executor;

  @BeforeEach
  void setUp() {
    executor =
        new AsyncConfig()
            .narrationExecutor(new NarrationProperties(3, 0, 2.0, 0, 3, 6, 20));
  }

  @AfterEach
  void tearDown() {
    executor.shutdown();
  }

  @Test
  void synthesize_shouldSucceedOnThirdAttemptAfterTwoTransientFailures() {
    AtomicInteger calls = new AtomicInteger();
    SpeechSynthesizer flaky =
        (text, voice) -> {
          if (calls.incrementAndGet() < 3) {
            throw new SpeechSynthesisException(
                SpeechSynthesisException.Reason.TRANSIENT, "429 Too Many Requests");
          }
          return simulated.synthesize(text, voice);
        };

    NarrationClip clip =
        new NarrationSynthesizer(flaky, NO_WAIT, 1, executor)
            .synthesize("seg-01", "We shipped the release on time", VoiceId.BRITISH);

    assertThat(calls.get()).isEqualTo(3);
    assertThat(clip.keySegmentId()).isEqualTo("seg-01");
    assertThat(clip.voice()).isEqualTo(VoiceId.BRITISH);
    assertThat(clip.durationSeconds()).isCloseTo(6 * 0.3, within(1e-9));
  }

  @Test
  void synthesize_shouldGiveUpAfterRetryBudget() {
    AtomicInteger calls = new AtomicInteger();
    SpeechSynthesizer down =
        (text, voice) -> {
          calls.incrementAndGet();
          throw new SpeechSynthesisException(
              SpeechSynthesisException.Reason.TRANSIENT, "503 Service Unavailable");
        };

    assertThatThrownBy(
            () ->
                new NarrationSynthesizer(down, NO_WAIT, 1, executor)
                    .synthesize("seg-02", "Hi", VoiceId.MALE))
        .isInstanceOfSatisfying(
            SynthesisUnavailableException.class,
            e -> {
              assertThat(e.kind()).isEqualTo(ErrorKind.SYNTHESIS_UNAVAILABLE);
              assertThat(e.attempts()).isEqualTo(3);
            });
    assertThat(calls.get()).isEqualTo(3);
  }

  @Test
  void synthesize_shouldNotRetryRejectedVoice() {
    AtomicInteger calls = new AtomicInteger();
    SpeechSynthesizer strict =
        (text, voice) -> {
          calls.incrementAndGet();
          throw new SpeechSynthesisException(
              SpeechSynthesisException.Reason.INVALID_VOICE, "voice not found");
        };

    assertThatThrownBy(
            () ->
                new NarrationSynthesizer(strict, NO_WAIT, 1, executor)
                    .synthesize("seg-01", "Hi", VoiceId.AMERICAN))
        .isInstanceOf(InvalidVoiceException.class);
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  void synthesize_shouldNotRetryPermanentFailureOrUndecodableAudio() {
    AtomicInteger permanentCalls = new AtomicInteger();
    SpeechSynthesizer unauthorized =
        (text, voice) -> {
          permanentCalls.incrementAndGet();
          throw new SpeechSynthesisException(
              SpeechSynthesisException.Reason.PERMANENT, "401 Unauthorized");
        };
    AtomicInteger garbageCalls = new AtomicInteger();
    SpeechSynthesizer garbage =
        (text, voice) -> {
          garbageCalls.incrementAndGet();
          return "<html>oops</html>".getBytes();
        };

    assertThatThrownBy(
            () ->
                new NarrationSynthesizer(unauthorized, NO_WAIT, 1, executor)
                    .synthesize("seg-01", "Hi", VoiceId.DEFAULT))
        .isInstanceOf(SynthesisUnavailableException.class);
    assertThatThrownBy(
            () ->
                new NarrationSynthesizer(garbage, NO_WAIT, 1, executor)
                    .synthesize("seg-01", "Hi", VoiceId.DEFAULT))
        .isInstanceOf(SynthesisUnavailableException.class);
    assertThat(permanentCalls.get()).isEqualTo(1);
    assertThat(garbageCalls.get()).isEqualTo(1);
  }

  @Test
  void synthesizeAll_shouldReportDegradedSegmentWithoutFailingOthers() throws Exception {
    SpeechSynthesizer partlyDown =
        (text, voice) -> {
          if (text.contains("budget")) {
            throw new SpeechSynthesisException(
                SpeechSynthesisException.Reason.TRANSIENT, "timeout");
          }
          return simulated.synthesize(text, voice);
        };
    List<KeySegment> segments =
        List.of(
            segment(1, "We agreed on the roadmap."),
            segment(2, "The budget is frozen until May."),
            segment(3, "Hiring starts next week."));
    List<NarrationOutcome> reported = new CopyOnWriteArrayList<>();

    List<NarrationOutcome> outcomes =
        new NarrationSynthesizer(partlyDown, NO_WAIT, 3, executor)
            .synthesizeAll(segments, VoiceId.FEMALE, reported::add);

    assertThat(outcomes)
        .extracting(NarrationOutcome::keySegmentId)
        .containsExactly("seg-01", "seg-02", "seg-03");
    assertThat(outcomes)
        .extracting(NarrationOutcome::isNarrated)
        .containsExactly(true, false, true);
    assertThat(outcomes.get(1).errorKind()).isEqualTo(ErrorKind.SYNTHESIS_UNAVAILABLE);
    assertThat(outcomes.get(1).attempts()).isEqualTo(3);
    assertThat(outcomes.get(1).clipIfNarrated()).isEmpty();
    assertThat(reported).hasSize(3);
  }

  @Test
  void synthesizeAll_shouldNotExceedPerJobConcurrencyOnSharedExecutor() throws Exception {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    SpeechSynthesizer slow =
        (text, voice) -> {
          peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
          try {
            Thread.sleep(50);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          } finally {
            inFlight.decrementAndGet();
          }
          return simulated.synthesize(text, voice);
        };
    List<KeySegment> segments = new ArrayList<>();
    for (int rank = 1; rank <= 6; rank++) {
      segments.add(segment(rank, "Decision number " + rank + " was made."));
    }

    List<NarrationOutcome> outcomes =
        new NarrationSynthesizer(slow, NO_WAIT, 2, executor)
            .synthesizeAll(segments, VoiceId.DEFAULT, outcome -> {});

    assertThat(outcomes).hasSize(6).allMatch(NarrationOutcome::isNarrated);
    assertThat(peak.get()).isBetween(1, 2);
  }

  @Test
  void synthesizeAll_shouldReturnEmptyListForNoSegments() throws Exception {
    assertThat(
            new NarrationSynthesizer(simulated, NO_WAIT, 2, executor)
                .synthesizeAll(List.of(), VoiceId.DEFAULT, outcome -> {}))
        .isEmpty();
  }

  @Test
  void retryPolicy_shouldGrowExponentiallyUpToCap() {
    RetryPolicy policy = RetryPolicy.defaults();

    assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofSeconds(2));
    assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofSeconds(4));
    assertThat(policy.backoffAfter(6)).isEqualTo(Duration.ofSeconds(8));
  }

  private static KeySegment segment(int rank, String summary) {
    return new KeySegment(
        KeySegment.idForRank(rank),
        new TimeRange(rank * 30.0, rank * 30.0 + 20),
        rank,
        0.5,
        summary,
        SegmentStyle.PROFESSIONAL,
        summary);
  }
}
