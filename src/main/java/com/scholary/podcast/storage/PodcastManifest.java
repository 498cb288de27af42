package com.scholary.podcast.storage;

import java.util.List;

/**
 * Machine-readable description of a finished podcast, stored next to the audio.
 *
 * @param jobId the job that produced it
 * @param title caller-supplied title, or {@code Meeting <yyyy-MM-dd HH:mm>} when none was given
 * @param createdAt ISO-8601 creation time of the job
 * @param voice narration voice
 * @param style narration style
 * @param durationSeconds length of the rendered audio
 * @param musicTrack music bed reference, or null without music
 * @param segments one entry per key segment, in playback order
 * @param failedSegmentIds segments whose narration failed and fell back to original audio
 */
public record PodcastManifest(
    String jobId,
    String title,
    String createdAt,
    String voice,
    String style,
    double durationSeconds,
    String musicTrack,
    List<SegmentEntry> segments,
    List<String> failedSegmentIds) {

  public PodcastManifest {
    segments = List.copyOf(segments);
    failedSegmentIds = List.copyOf(failedSegmentIds);
  }

  /**
   * A key segment as it appears in the output.
   *
   * @param outputOffset where the segment's first entry starts in the podcast
   * @param outputDuration from the first entry's start to the last entry's end
   * @param keyPoints up to three notable sentences from the segment's transcript
   * @param caption text shown for the segment: the narration, or the transcript when degraded
   */
  public record SegmentEntry(
      String id,
      int rank,
      double score,
      double sourceStart,
      double sourceEnd,
      double outputOffset,
      double outputDuration,
      String summary,
      List<String> keyPoints,
      String caption,
      boolean narrated) {

    public SegmentEntry {
      keyPoints = List.copyOf(keyPoints);
    }
  }
}
