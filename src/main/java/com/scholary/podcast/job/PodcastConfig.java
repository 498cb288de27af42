package com.scholary.podcast.job;

import com.scholary.podcast.narration.VoiceId;
import com.scholary.podcast.selection.SegmentStyle;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Validated per-job settings.
 *
 * @param voice narration voice
 * @param style narration and scoring style
 * @param segmentCount number of key segments to select, 3 to 10
 * @param addMusic whether a music bed is mixed under the podcast
 */
public record PodcastConfig(
    VoiceId voice, SegmentStyle style, int segmentCount, boolean addMusic) {

  public static final int MIN_SEGMENTS = 3;
  public static final int MAX_SEGMENTS = 10;
  public static final int DEFAULT_SEGMENTS = 5;

  public PodcastConfig {
    if (voice == null) {
      throw new InvalidConfigException("voice is required");
    }
    if (style == null) {
      throw new InvalidConfigException("style is required");
    }
    if (segmentCount < MIN_SEGMENTS || segmentCount > MAX_SEGMENTS) {
      throw new InvalidConfigException(
          String.format(
              "segmentCount must be between %d and %d, got %d",
              MIN_SEGMENTS, MAX_SEGMENTS, segmentCount));
    }
  }

  public static PodcastConfig defaults() {
    return new PodcastConfig(
        VoiceId.DEFAULT, SegmentStyle.PROFESSIONAL, DEFAULT_SEGMENTS, false);
  }

  /**
   * Build a config from raw request values. Null values take their defaults.
   *
   * @throws InvalidConfigException if a value is not recognized or out of range
   */
  public static PodcastConfig parse(
      String voice, String style, Integer segmentCount, Boolean addMusic) {
    VoiceId voiceId =
        voice == null
            ? VoiceId.DEFAULT
            : VoiceId.fromName(voice)
                .orElseThrow(
                    () ->
                        new InvalidConfigException(
                            "Unknown voice '"
                                + voice
                                + "', expected one of "
                                + names(VoiceId.values())));
    SegmentStyle segmentStyle =
        style == null
            ? SegmentStyle.PROFESSIONAL
            : SegmentStyle.fromName(style)
                .orElseThrow(
                    () ->
                        new InvalidConfigException(
                            "Unknown style '"
                                + style
                                + "', expected one of "
                                + names(SegmentStyle.values())));
    return new PodcastConfig(
        voiceId,
        segmentStyle,
        segmentCount == null ? DEFAULT_SEGMENTS : segmentCount,
        addMusic != null && addMusic);
  }

  private static String names(Enum<?>[] values) {
    return Arrays.stream(values)
        .map(v -> v.name().toLowerCase(Locale.ROOT))
        .collect(Collectors.joining(", ", "[", "]"));
  }
}
