package com.scholary.podcast.logging;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts an {@code event_type} plus event fields into the MDC, logs one line and
 * removes the fields again, so pipeline events can be queried by field in a log aggregator. The
 * job context ({@code jobId}, {@code workflow}) stays in the MDC for the lifetime of a job's
 * threads.
 */
public class StructuredLogger {

  private static final String[] EVENT_FIELDS = {
    "event_type",
    "fromState",
    "toState",
    "segmentId",
    "rank",
    "score",
    "start",
    "end",
    "scorer",
    "attempt",
    "maxAttempts",
    "backoffMs",
    "errorType",
    "completed",
    "total",
    "percentComplete",
    "phase",
    "entries",
    "durationSeconds",
    "renderMs"
  };

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job state transition. */
  public void logStateTransition(String jobId, String fromState, String toState) {
    try {
      MDC.put("event_type", "state_transition");
      MDC.put("fromState", fromState);
      MDC.put("toState", toState);

      logger.info("Job state: jobId={}, {} -> {}", jobId, fromState, toState);
    } finally {
      clearEventFields();
    }
  }

  /** Log a key segment accepted by the selector. */
  public void logSegmentSelected(
      String segmentId, int rank, double score, double start, double end, String scorer) {
    try {
      MDC.put("event_type", "segment_selected");
      MDC.put("segmentId", segmentId);
      MDC.put("rank", String.valueOf(rank));
      MDC.put("score", String.valueOf(score));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("scorer", scorer);

      logger.debug(
          "Segment selected: id={}, rank={}, score={}, span=[{}-{}], scorer={}",
          segmentId,
          rank,
          score,
          start,
          end,
          scorer);
    } finally {
      clearEventFields();
    }
  }

  /** Log a fallback from the external scorer to the local heuristic. */
  public void logScorerFallback(String errorType, String message) {
    try {
      MDC.put("event_type", "scorer_fallback");
      MDC.put("errorType", errorType);

      logger.warn(
          "Content scorer unusable, falling back to heuristic: {} - {}", errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a speech synthesis attempt and its outcome. */
  public void logSynthesisAttempt(
      String segmentId, int attempt, int maxAttempts, String outcome) {
    try {
      MDC.put("event_type", "synthesis_attempt");
      MDC.put("segmentId", segmentId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", outcome);

      logger.info(
          "Synthesis attempt: segment={}, attempt={}/{}, outcome={}",
          segmentId,
          attempt,
          maxAttempts,
          outcome);
    } finally {
      clearEventFields();
    }
  }

  /** Log a synthesis retry. */
  public void logSynthesisRetry(
      String segmentId,
      int attempt,
      int maxAttempts,
      long backoffMs,
      String errorType,
      String message) {
    try {
      MDC.put("event_type", "synthesis_retry");
      MDC.put("segmentId", segmentId);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("backoffMs", String.valueOf(backoffMs));
      MDC.put("errorType", errorType);

      logger.warn(
          "Synthesis retry: segment={}, attempt={}/{}, backoff={}ms, error={}, message={}",
          segmentId,
          attempt,
          maxAttempts,
          backoffMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a segment whose narration could not be produced. */
  public void logSynthesisFailed(String segmentId, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "synthesis_failed");
      MDC.put("segmentId", segmentId);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Synthesis failed: segment={}, attempts={}, error={}, message={}",
          segmentId,
          attempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int completed, int total, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("completed", String.valueOf(completed));
      MDC.put("total", String.valueOf(total));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, items={}/{}, progress={}%",
          jobId,
          phase,
          completed,
          total,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log a finished render. */
  public void logRenderFinished(int entries, double durationSeconds, long renderMs) {
    try {
      MDC.put("event_type", "render_finished");
      MDC.put("entries", String.valueOf(entries));
      MDC.put("durationSeconds", String.valueOf(durationSeconds));
      MDC.put("renderMs", String.valueOf(renderMs));

      logger.info(
          "Render finished: entries={}, duration={}s, took={}ms",
          entries,
          durationSeconds,
          renderMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String workflow) {
    MDC.put("jobId", jobId);
    MDC.put("workflow", workflow);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("workflow");
  }

  /**
   * Wrap a task so it runs with the caller's MDC context on a pool thread.
   *
   * @param task the task to wrap
   * @return a runnable that installs and then removes the captured context
   */
  public static Runnable withCurrentContext(Runnable task) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    return () -> {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      if (context != null) {
        MDC.setContextMap(context);
      }
      try {
        task.run();
      } finally {
        if (previous != null) {
          MDC.setContextMap(previous);
        } else {
          MDC.clear();
        }
      }
    };
  }

  private void clearEventFields() {
    for (String field : EVENT_FIELDS) {
      MDC.remove(field);
    }
  }
}
