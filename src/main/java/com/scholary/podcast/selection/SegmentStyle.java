package com.scholary.podcast.selection;

import java.util.Locale;
import java.util.Optional;

/** Tone requested for the podcast; biases scoring and narration lead-ins. */
public enum SegmentStyle {
  PROFESSIONAL,
  CASUAL,
  ENERGETIC,
  CALM;

  /**
   * Look up a style by its case-insensitive name.
   *
   * @param name the style name, e.g. {@code "energetic"}
   * @return the style, or empty when the name is unknown
   */
  public static Optional<SegmentStyle> fromName(String name) {
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
