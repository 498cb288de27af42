package com.scholary.podcast.selection;

/**
 * Result of scoring one candidate span.
 *
 * @param relevance importance in [0, 1]
 * @param summary short summary of the span
 */
public record ContentScore(double relevance, String summary) {

  /** A score is usable only if its relevance is a number in [0, 1] and it has a summary. */
  public boolean isWellFormed() {
    return !Double.isNaN(relevance)
        && relevance >= 0.0
        && relevance <= 1.0
        && summary != null
        && !summary.isBlank();
  }
}
