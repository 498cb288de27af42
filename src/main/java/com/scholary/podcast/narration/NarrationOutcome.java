package com.scholary.podcast.narration;

import com.scholary.podcast.error.ErrorKind;
import java.util.Optional;

/**
 * What happened when narrating one key segment. Exactly one of {@code clip} or {@code errorKind}
 * is set.
 */
public record NarrationOutcome(
    String keySegmentId,
    Status status,
    NarrationClip clip,
    ErrorKind errorKind,
    String message,
    int attempts) {

  public enum Status {
    NARRATED,
    FAILED
  }

  public static NarrationOutcome narrated(NarrationClip clip, int attempts) {
    return new NarrationOutcome(clip.keySegmentId(), Status.NARRATED, clip, null, null, attempts);
  }

  public static NarrationOutcome failed(
      String keySegmentId, ErrorKind kind, String message, int attempts) {
    return new NarrationOutcome(keySegmentId, Status.FAILED, null, kind, message, attempts);
  }

  public boolean isNarrated() {
    return status == Status.NARRATED;
  }

  public Optional<NarrationClip> clipIfNarrated() {
    return Optional.ofNullable(clip);
  }
}
