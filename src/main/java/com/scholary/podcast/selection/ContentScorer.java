package com.scholary.podcast.selection;

/**
 * Rates how important a transcript span is and summarizes it.
 *
 * <p>Implementations backed by a remote service may be unavailable at any time; callers must be
 * prepared to fall back to {@link HeuristicContentScorer}.
 */
public interface ContentScorer {

  /**
   * Score a span of transcript text.
   *
   * @param text the span text
   * @param context style and neighbouring text
   * @return the relevance and summary
   * @throws ContentScorerException if the scorer cannot produce a result
   */
  ContentScore score(String text, ScoringContext context);

  /** Short name used in logs. */
  String name();
}
