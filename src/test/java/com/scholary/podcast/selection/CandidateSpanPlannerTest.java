package com.scholary.podcast.selection;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.podcast.transcript.TranscriptChunk;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CandidateSpanPlannerTest {

  private final CandidateSpanPlanner planner =
      new CandidateSpanPlanner(new SelectionProperties(30, 60, 2));

  @Test
  void plan_shouldGroupUnlabelledChunksIntoWindows() {
    List<TranscriptChunk> chunks = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      chunks.add(new TranscriptChunk(i * 10, i * 10 + 10, "sentence " + i));
    }

    List<CandidateSpan> spans = planner.plan(chunks);

    assertThat(spans).hasSize(4);
    assertThat(spans.get(0).range().start()).isEqualTo(0.0);
    assertThat(spans.get(0).range().end()).isEqualTo(30.0);
    assertThat(spans.get(0).text()).isEqualTo("sentence 0 sentence 1 sentence 2");
    assertThat(spans.get(3).range().end()).isEqualTo(120.0);
  }

  @Test
  void plan_shouldSplitOnSpeakerChange() {
    List<TranscriptChunk> chunks =
        List.of(
            new TranscriptChunk(0, 5, "alice", "Hi."),
            new TranscriptChunk(5, 10, "alice", "Agenda first."),
            new TranscriptChunk(10, 12, null, "Right."),
            new TranscriptChunk(12, 20, "bob", "I have numbers."));

    List<CandidateSpan> spans = planner.plan(chunks);

    assertThat(spans).hasSize(2);
    assertThat(spans.get(0).speakerLabel()).isEqualTo("alice");
    assertThat(spans.get(0).text()).isEqualTo("Hi. Agenda first. Right.");
    assertThat(spans.get(1).speakerLabel()).isEqualTo("bob");
  }

  @Test
  void plan_shouldCapLongTurns() {
    List<TranscriptChunk> chunks = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      chunks.add(new TranscriptChunk(i * 20, i * 20 + 20, "alice", "monologue " + i));
    }

    List<CandidateSpan> spans = planner.plan(chunks);

    assertThat(spans)
        .allSatisfy(span -> assertThat(span.range().duration()).isLessThanOrEqualTo(60.0));
    for (int i = 1; i < spans.size(); i++) {
      assertThat(spans.get(i).range().start())
          .isGreaterThanOrEqualTo(spans.get(i - 1).range().end());
    }
  }

  @Test
  void plan_shouldIgnoreBlankChunks() {
    assertThat(planner.plan(List.of(new TranscriptChunk(0, 3, "  ")))).isEmpty();
    assertThat(planner.plan(List.of())).isEmpty();
  }
}
