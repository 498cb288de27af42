package com.scholary.podcast.assembly;

/**
 * One item of the render plan.
 *
 * @param kind what the entry plays
 * @param sourceRef asset reference resolved at render time
 * @param sourceOffset seconds into the referenced asset where playback starts
 * @param startOffset seconds into the output where the entry starts
 * @param duration seconds of audio the entry contributes
 * @param keySegmentId segment the entry belongs to, null for the music bed
 */
public record TimelineEntry(
    EntryKind kind,
    String sourceRef,
    double sourceOffset,
    double startOffset,
    double duration,
    String keySegmentId) {

  public TimelineEntry {
    if (sourceOffset < 0 || startOffset < 0 || duration < 0) {
      throw new IllegalArgumentException("Timeline offsets and durations cannot be negative");
    }
  }

  public double endOffset() {
    return startOffset + duration;
  }
}
