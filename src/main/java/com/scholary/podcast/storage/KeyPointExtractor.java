package com.scholary.podcast.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks a few sentences of a segment's transcript as its key points.
 *
 * <p>Sentences of five words or fewer are skipped. When more remain than wanted, they are sampled
 * at an even stride from the first one, so the points spread over the whole segment.
 */
public final class KeyPointExtractor {

  public static final int DEFAULT_MAX_POINTS = 3;

  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int MIN_WORDS = 6;

  private KeyPointExtractor() {}

  public static List<String> extract(String text, int maxPoints) {
    if (text == null || text.isBlank() || maxPoints < 1) {
      return List.of();
    }
    List<String> sentences =
        Arrays.stream(SENTENCE_END.split(text.trim()))
            .map(String::trim)
            .filter(sentence -> WHITESPACE.split(sentence).length >= MIN_WORDS)
            .toList();
    if (sentences.size() <= maxPoints) {
      return sentences;
    }
    int stride = sentences.size() / maxPoints;
    List<String> points = new ArrayList<>(maxPoints);
    for (int i = 0; i < sentences.size() && points.size() < maxPoints; i += stride) {
      points.add(sentences.get(i));
    }
    return List.copyOf(points);
  }
}
