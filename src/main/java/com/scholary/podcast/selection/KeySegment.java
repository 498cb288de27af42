package com.scholary.podcast.selection;

import com.scholary.podcast.transcript.TimeRange;

/**
 * A salient span of the original meeting chosen for the podcast.
 *
 * @param id deterministic id derived from the rank ({@code seg-01}, {@code seg-02}, ...)
 * @param sourceSpan half-open span over the original audio
 * @param rank 1 for the most important segment
 * @param score relevance in [0, 1]
 * @param summaryText short summary used as narration text
 * @param style style tag the segment was selected for
 * @param transcriptText the transcript text covered by the span
 */
public record KeySegment(
    String id,
    TimeRange sourceSpan,
    int rank,
    double score,
    String summaryText,
    SegmentStyle style,
    String transcriptText) {

  public static String idForRank(int rank) {
    return String.format("seg-%02d", rank);
  }
}
