package com.scholary.podcast.assembly;

/** Order in which key segments appear in the podcast. */
public enum TimelineOrdering {
  /** Most important segment first. */
  RANK,
  /** Segments in the order they were spoken. */
  CHRONOLOGICAL
}
