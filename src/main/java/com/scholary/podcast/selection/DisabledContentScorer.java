package com.scholary.podcast.selection;

/** Scorer used in simulation mode; always unavailable so selection uses the heuristic. */
public class DisabledContentScorer implements ContentScorer {

  @Override
  public ContentScore score(String text, ScoringContext context) {
    throw new ContentScorerException("Content scorer disabled");
  }

  @Override
  public String name() {
    return "disabled";
  }
}
