package com.scholary.podcast.selection;

import com.scholary.podcast.transcript.TimeRange;
import com.scholary.podcast.transcript.TranscriptChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Groups transcript chunks into candidate spans.
 *
 * <p>With speaker labels, consecutive chunks of the same speaker form one turn (a chunk without a
 * label continues the current turn). Without any labels, chunks are grouped into fixed windows.
 * Either way a span never grows past the configured maximum length, and every span starts and
 * ends on chunk boundaries. Because the input chunks are ordered and non-overlapping, so are the
 * resulting spans.
 */
@Component
public class CandidateSpanPlanner {

  private final SelectionProperties properties;

  public CandidateSpanPlanner(SelectionProperties properties) {
    this.properties = properties;
  }

  public List<CandidateSpan> plan(List<TranscriptChunk> chunks) {
    List<TranscriptChunk> spoken =
        chunks.stream().filter(c -> !c.text().isBlank()).toList();
    if (spoken.isEmpty()) {
      return List.of();
    }
    boolean labelled = spoken.stream().anyMatch(TranscriptChunk::hasSpeaker);
    double limit =
        labelled
            ? properties.maxSpanSeconds()
            : Math.min(properties.windowSeconds(), properties.maxSpanSeconds());

    List<CandidateSpan> spans = new ArrayList<>();
    List<TranscriptChunk> current = new ArrayList<>();
    String currentSpeaker = null;

    for (TranscriptChunk chunk : spoken) {
      if (!current.isEmpty()) {
        boolean speakerChanged =
            labelled && chunk.hasSpeaker() && !Objects.equals(chunk.speakerLabel(), currentSpeaker);
        boolean tooLong = chunk.end() - current.get(0).start() > limit;
        if (speakerChanged || tooLong) {
          spans.add(toSpan(spans.size(), current, currentSpeaker));
          current = new ArrayList<>();
        }
      }
      if (current.isEmpty() || chunk.hasSpeaker()) {
        currentSpeaker = chunk.hasSpeaker() ? chunk.speakerLabel() : currentSpeaker;
      }
      current.add(chunk);
    }
    spans.add(toSpan(spans.size(), current, currentSpeaker));
    return List.copyOf(spans);
  }

  private static CandidateSpan toSpan(int index, List<TranscriptChunk> chunks, String speaker) {
    TimeRange range =
        new TimeRange(chunks.get(0).start(), chunks.get(chunks.size() - 1).end());
    StringBuilder text = new StringBuilder();
    for (TranscriptChunk chunk : chunks) {
      if (text.length() > 0) {
        text.append(' ');
      }
      text.append(chunk.text().trim());
    }
    return new CandidateSpan(index, range, speaker, text.toString());
  }
}
