package com.scholary.podcast.narration;

import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.selection.SegmentStyle;
import java.util.Map;

/**
 * Builds the text spoken for a key segment: a style lead-in, the summary, then a closing line
 * that hands back to the next segment.
 */
public final class NarrationScript {

  public static final String OUTRO = "That was an interesting point from the meeting.";

  private static final Map<SegmentStyle, String> LEAD_INS =
      Map.of(
          SegmentStyle.PROFESSIONAL, "Here's a key moment from the meeting.",
          SegmentStyle.CASUAL, "Here's a quick snippet from the session.",
          SegmentStyle.ENERGETIC, "Here's a big one!",
          SegmentStyle.CALM, "Let's take a moment with this part of the conversation.");

  private NarrationScript() {}

  public static String forSegment(KeySegment segment) {
    SegmentStyle style = segment.style() != null ? segment.style() : SegmentStyle.PROFESSIONAL;
    String summary = segment.summaryText() == null ? "" : segment.summaryText().trim();
    StringBuilder script = new StringBuilder(LEAD_INS.get(style));
    if (!summary.isEmpty()) {
      script.append(' ').append(summary);
    }
    return script.append(' ').append(OUTRO).toString();
  }
}
