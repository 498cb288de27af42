package com.scholary.podcast.narration;

import java.util.Locale;
import java.util.Optional;

/** Narrator voices a job can ask for. */
public enum VoiceId {
  DEFAULT,
  MALE,
  FEMALE,
  BRITISH,
  AMERICAN;

  /**
   * Look up a voice by its case-insensitive name.
   *
   * @param name the voice name, e.g. {@code "british"}
   * @return the voice, or empty when the name is unknown
   */
  public static Optional<VoiceId> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
