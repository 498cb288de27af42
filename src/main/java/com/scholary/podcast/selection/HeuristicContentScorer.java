package com.scholary.podcast.selection;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Local, deterministic scorer used when the external scorer cannot be used.
 *
 * <p>Relevance is an information-density estimate: how much is said (word count, saturating at
 * {@value #SATURATION_WORDS} words), how varied it is (distinct-word ratio) and whether the span
 * contains decision or action vocabulary. The requested style adds a small bonus for matching
 * delivery cues. The summary is the span's leading sentences, capped at
 * {@value #SUMMARY_MAX_WORDS} words.
 */
@Component
public class HeuristicContentScorer implements ContentScorer {

  private static final int SATURATION_WORDS = 60;
  private static final int SUMMARY_TARGET_WORDS = 25;
  private static final int SUMMARY_MAX_WORDS = 40;

  private static final Pattern WORD_SPLIT = Pattern.compile("\\s+");
  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern NON_LETTER = Pattern.compile("[^\\p{L}\\p{N}']");

  private static final Set<String> SIGNAL_WORDS =
      Set.of(
          "decide", "decided", "decision", "agree", "agreed", "action", "important", "key",
          "plan", "next", "deadline", "launch", "because", "should", "must", "priority",
          "problem", "solution", "risk", "goal");

  private static final Map<SegmentStyle, List<String>> STYLE_CUES =
      Map.of(
          SegmentStyle.PROFESSIONAL, List.of("decision", "plan", "deadline", "budget", "strategy"),
          SegmentStyle.CASUAL, List.of("like", "really", "guess", "fun", "honestly"),
          SegmentStyle.ENERGETIC, List.of("!", "amazing", "great", "excited", "huge"),
          SegmentStyle.CALM, List.of("think", "consider", "maybe", "reflect", "slowly"));

  @Override
  public ContentScore score(String text, ScoringContext context) {
    String trimmed = text == null ? "" : text.trim();
    if (trimmed.isEmpty()) {
      return new ContentScore(0.0, "(no speech)");
    }

    String[] words = WORD_SPLIT.split(trimmed);
    Set<String> distinct = new HashSet<>();
    Set<String> signals = new HashSet<>();
    for (String word : words) {
      String normalized = NON_LETTER.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("");
      if (normalized.isEmpty()) {
        continue;
      }
      distinct.add(normalized);
      if (SIGNAL_WORDS.contains(normalized)) {
        signals.add(normalized);
      }
    }

    double length = Math.min(1.0, words.length / (double) SATURATION_WORDS);
    double diversity = distinct.isEmpty() ? 0.0 : distinct.size() / (double) words.length;
    double signal = Math.min(0.1, signals.size() * 0.025);
    double relevance = 0.55 * length + 0.35 * diversity + signal + styleBonus(trimmed, context);

    return new ContentScore(clamp(relevance), summarize(trimmed));
  }

  @Override
  public String name() {
    return "heuristic";
  }

  private static double styleBonus(String text, ScoringContext context) {
    if (context == null || context.style() == null) {
      return 0.0;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    long hits = STYLE_CUES.get(context.style()).stream().filter(lower::contains).count();
    return Math.min(0.05, hits * 0.02);
  }

  /** Leading sentences up to about {@value #SUMMARY_TARGET_WORDS} words. */
  static String summarize(String text) {
    StringBuilder summary = new StringBuilder();
    int wordCount = 0;
    for (String sentence : SENTENCE_END.split(text)) {
      if (wordCount >= SUMMARY_TARGET_WORDS) {
        break;
      }
      String[] words = WORD_SPLIT.split(sentence.trim());
      for (String word : words) {
        if (wordCount == SUMMARY_MAX_WORDS) {
          return summary.append("...").toString();
        }
        if (summary.length() > 0) {
          summary.append(' ');
        }
        summary.append(word);
        wordCount++;
      }
    }
    return summary.toString();
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
