package com.scholary.podcast.transcript;

import java.util.Objects;

/**
 * A time-stamped piece of transcript text, immutable once appended to a {@link TranscriptBuffer}.
 *
 * @param start start time in seconds
 * @param end end time in seconds, never before {@code start}
 * @param speakerLabel speaker label reported by the transcription service, or null when unknown
 * @param text the spoken text
 */
public record TranscriptChunk(double start, double end, String speakerLabel, String text) {

  public TranscriptChunk {
    Objects.requireNonNull(text, "text must not be null");
    if (Double.isNaN(start) || Double.isNaN(end) || start < 0) {
      throw new IllegalArgumentException("Chunk start must be a non-negative number");
    }
    if (end < start) {
      throw new IllegalArgumentException(
          String.format("Chunk end (%.3f) must be >= start (%.3f)", end, start));
    }
  }

  public TranscriptChunk(double start, double end, String text) {
    this(start, end, null, text);
  }

  public TimeRange range() {
    return new TimeRange(start, end);
  }

  public boolean hasSpeaker() {
    return speakerLabel != null && !speakerLabel.isBlank();
  }
}
