package com.scholary.podcast.api;

import com.scholary.podcast.selection.KeySegment;
import java.util.List;

/** Candidate key segments of the transcript received so far. */
public record SegmentPreviewResponse(String jobId, List<Segment> segments) {

  public record Segment(
      String id, int rank, double score, double start, double end, String summary, String text) {

    static Segment from(KeySegment segment) {
      return new Segment(
          segment.id(),
          segment.rank(),
          segment.score(),
          segment.sourceSpan().start(),
          segment.sourceSpan().end(),
          segment.summaryText(),
          segment.transcriptText());
    }
  }

  static SegmentPreviewResponse from(String jobId, List<KeySegment> segments) {
    return new SegmentPreviewResponse(jobId, segments.stream().map(Segment::from).toList());
  }
}
