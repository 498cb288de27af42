package com.scholary.podcast.selection;

import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.transcript.TranscriptChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks a bounded set of non-overlapping key segments from a transcript.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Group chunks into candidate spans ({@link CandidateSpanPlanner})
 *   <li>Score every span with the external scorer. If any call fails or returns a malformed
 *       result, every span is re-scored with the heuristic so one selection never mixes scales
 *   <li>Walk candidates by descending score (ties: earlier start first), skipping any that
 *       overlaps or comes closer than the minimum gap to an accepted segment
 *   <li>Stop at the target count and number the accepted segments by rank
 * </ol>
 *
 * <p>Selection never fails for lack of content: an empty transcript yields an empty list.
 */
@Component
public class SegmentSelector {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentSelector.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final Comparator<Scored> BY_SCORE_THEN_START =
      Comparator.comparingDouble((Scored s) -> s.score().relevance())
          .reversed()
          .thenComparingDouble(s -> s.span().range().start())
          .thenComparingInt(s -> s.span().index());

  private final ContentScorer contentScorer;
  private final HeuristicContentScorer heuristicScorer;
  private final CandidateSpanPlanner planner;
  private final SelectionProperties properties;

  public SegmentSelector(
      ContentScorer contentScorer,
      HeuristicContentScorer heuristicScorer,
      CandidateSpanPlanner planner,
      SelectionProperties properties) {
    this.contentScorer = contentScorer;
    this.heuristicScorer = heuristicScorer;
    this.planner = planner;
    this.properties = properties;
  }

  /**
   * Select key segments, preferring the external scorer.
   *
   * @param chunks ordered transcript chunks
   * @param targetCount maximum number of segments to return
   * @param style requested podcast style
   * @return segments ordered by rank, at most {@code targetCount} of them
   */
  public List<KeySegment> select(
      List<TranscriptChunk> chunks, int targetCount, SegmentStyle style) {
    return select(chunks, targetCount, style, contentScorer);
  }

  /** Select key segments with the local heuristic only; makes no remote calls. */
  public List<KeySegment> selectHeuristic(
      List<TranscriptChunk> chunks, int targetCount, SegmentStyle style) {
    return select(chunks, targetCount, style, heuristicScorer);
  }

  private List<KeySegment> select(
      List<TranscriptChunk> chunks, int targetCount, SegmentStyle style, ContentScorer scorer) {
    if (chunks.isEmpty() || targetCount <= 0) {
      return List.of();
    }
    List<CandidateSpan> spans = planner.plan(chunks);
    if (spans.isEmpty()) {
      return List.of();
    }

    ContentScorer used = scorer;
    List<Scored> scored;
    try {
      scored = scoreAll(spans, style, scorer);
    } catch (RuntimeException e) {
      if (scorer == heuristicScorer) {
        throw e;
      }
      STRUCTURED_LOGGER.logScorerFallback(e.getClass().getSimpleName(), e.getMessage());
      used = heuristicScorer;
      scored = scoreAll(spans, style, heuristicScorer);
    }

    List<Scored> ordered = new ArrayList<>(scored);
    ordered.sort(BY_SCORE_THEN_START);

    List<Scored> accepted = new ArrayList<>();
    for (Scored candidate : ordered) {
      if (accepted.size() == targetCount) {
        break;
      }
      if (conflictsWithAccepted(candidate, accepted)) {
        continue;
      }
      accepted.add(candidate);
    }

    List<KeySegment> segments = new ArrayList<>(accepted.size());
    for (int i = 0; i < accepted.size(); i++) {
      Scored s = accepted.get(i);
      int rank = i + 1;
      KeySegment segment =
          new KeySegment(
              KeySegment.idForRank(rank),
              s.span().range(),
              rank,
              s.score().relevance(),
              s.score().summary(),
              style,
              s.span().text());
      segments.add(segment);
      STRUCTURED_LOGGER.logSegmentSelected(
          segment.id(),
          rank,
          segment.score(),
          segment.sourceSpan().start(),
          segment.sourceSpan().end(),
          used.name());
    }

    LOGGER.info(
        "Selected {} of {} candidate spans (target={}, style={}, scorer={})",
        segments.size(),
        spans.size(),
        targetCount,
        style,
        used.name());
    return List.copyOf(segments);
  }

  private boolean conflictsWithAccepted(Scored candidate, List<Scored> accepted) {
    for (Scored other : accepted) {
      if (candidate.span().range().overlaps(other.span().range())) {
        return true;
      }
      if (candidate.span().range().gapTo(other.span().range()) < properties.minGapSeconds()) {
        return true;
      }
    }
    return false;
  }

  private static List<Scored> scoreAll(
      List<CandidateSpan> spans, SegmentStyle style, ContentScorer scorer) {
    List<Scored> scored = new ArrayList<>(spans.size());
    for (int i = 0; i < spans.size(); i++) {
      CandidateSpan span = spans.get(i);
      String previous = i > 0 ? spans.get(i - 1).text() : "";
      String next = i + 1 < spans.size() ? spans.get(i + 1).text() : "";
      ContentScore score = scorer.score(span.text(), new ScoringContext(style, previous, next));
      if (score == null || !score.isWellFormed()) {
        throw new ContentScorerException(
            String.format("Malformed score for span %d from %s: %s", i, scorer.name(), score));
      }
      scored.add(new Scored(span, score));
    }
    return scored;
  }

  private record Scored(CandidateSpan span, ContentScore score) {}
}
