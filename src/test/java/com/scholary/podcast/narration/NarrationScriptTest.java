package com.scholary.podcast.narration;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.selection.SegmentStyle;
import com.scholary.podcast.transcript.TimeRange;
import org.junit.jupiter.api.Test;

class NarrationScriptTest {

  @Test
  void forSegment_shouldWrapSummaryInLeadInAndOutro() {
    String script = NarrationScript.forSegment(segment("  We move the launch to June. ", null));

    assertThat(script)
        .isEqualTo(
            "Here's a key moment from the meeting. We move the launch to June."
                + " That was an interesting point from the meeting.");
  }

  @Test
  void forSegment_shouldUseStyleLeadInAndKeepOutroWithoutSummary() {
    String script = NarrationScript.forSegment(segment("", SegmentStyle.ENERGETIC));

    assertThat(script).isEqualTo("Here's a big one! " + NarrationScript.OUTRO);
  }

  private static KeySegment segment(String summary, SegmentStyle style) {
    return new KeySegment(
        "seg-01", new TimeRange(0, 20), 1, 0.8, summary, style, "launch moves to June");
  }
}
