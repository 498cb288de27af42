package com.scholary.podcast.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.assembly.EntryKind;
import com.scholary.podcast.assembly.Timeline;
import com.scholary.podcast.assembly.TimelineEntry;
import com.scholary.podcast.narration.VoiceId;
import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.selection.SegmentStyle;
import com.scholary.podcast.transcript.TimeRange;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ManifestWriterTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ManifestWriter writer = new ManifestWriter(objectMapper);

  private final List<KeySegment> segments =
      List.of(
          new KeySegment(
              "seg-01",
              new TimeRange(120, 140),
              1,
              0.92,
              "We agreed to ship on Friday.",
              SegmentStyle.PROFESSIONAL,
              "So we ship Friday, agreed."),
          new KeySegment(
              "seg-02",
              new TimeRange(30, 45),
              2,
              0.71,
              "Budget stays flat.",
              SegmentStyle.PROFESSIONAL,
              "The budget stays where it is this quarter."));

  private final Timeline timeline =
      new Timeline(
          List.of(
              new TimelineEntry(EntryKind.MUSIC_BED, "music:built-in", 0, 0, 19.7, null),
              new TimelineEntry(EntryKind.NARRATION, "narration:seg-01", 0, 0, 5.0, "seg-01"),
              new TimelineEntry(EntryKind.ORIGINAL_EXCERPT, "recording", 30, 4.7, 15.0, "seg-02")),
          19.7);

  @Test
  void buildManifest_shouldPlaceSegmentsAndListFailures() {
    PodcastManifest manifest = build();

    assertThat(manifest.voice()).isEqualTo("british");
    assertThat(manifest.style()).isEqualTo("professional");
    assertThat(manifest.musicTrack()).isEqualTo("music:built-in");
    assertThat(manifest.failedSegmentIds()).containsExactly("seg-02");
    assertThat(manifest.segments()).hasSize(2);

    PodcastManifest.SegmentEntry narrated = manifest.segments().get(0);
    assertThat(narrated.narrated()).isTrue();
    assertThat(narrated.caption())
        .isEqualTo(
            "Here's a key moment from the meeting. We agreed to ship on Friday."
                + " That was an interesting point from the meeting.");
    assertThat(narrated.sourceStart()).isEqualTo(120.0);
    assertThat(narrated.keyPoints()).isEmpty();

    PodcastManifest.SegmentEntry degraded = manifest.segments().get(1);
    assertThat(degraded.narrated()).isFalse();
    assertThat(degraded.caption()).isEqualTo("The budget stays where it is this quarter.");
    assertThat(degraded.keyPoints()).containsExactly("The budget stays where it is this quarter.");
    assertThat(degraded.outputOffset()).isCloseTo(4.7, within(1e-9));
    assertThat(degraded.outputDuration()).isCloseTo(15.0, within(1e-9));
  }

  @Test
  void writeJson_shouldContainAllSegments() throws Exception {
    JsonNode json = objectMapper.readTree(writer.writeJson(build()));

    assertThat(json.get("jobId").asText()).isEqualTo("job-1");
    assertThat(json.get("segments")).hasSize(2);
    assertThat(json.get("segments").get(1).get("keyPoints").get(0).asText())
        .isEqualTo("The budget stays where it is this quarter.");
    assertThat(json.get("failedSegmentIds").get(0).asText()).isEqualTo("seg-02");
    assertThat(json.get("durationSeconds").asDouble()).isEqualTo(19.7);
  }

  @Test
  void writeSrt_shouldWriteOneCuePerSegment() {
    String srt = new String(writer.writeSrt(build()), StandardCharsets.UTF_8);

    assertThat(srt)
        .isEqualTo(
            "1\n00:00:00,000 --> 00:00:05,000\n"
                + "Here's a key moment from the meeting. We agreed to ship on Friday."
                + " That was an interesting point from the meeting.\n\n"
                + "2\n00:00:04,700 --> 00:00:19,700\n"
                + "The budget stays where it is this quarter.\n\n");
  }

  @Test
  void formatSrtTime_shouldRoundToMilliseconds() {
    assertThat(ManifestWriter.formatSrtTime(0)).isEqualTo("00:00:00,000");
    assertThat(ManifestWriter.formatSrtTime(3725.4567)).isEqualTo("01:02:05,457");
  }

  private PodcastManifest build() {
    return writer.buildManifest(
        "job-1",
        "Weekly sync",
        Instant.parse("2026-03-02T10:15:30Z"),
        VoiceId.BRITISH,
        SegmentStyle.PROFESSIONAL,
        segments,
        Set.of("seg-02"),
        timeline,
        19.7);
  }
}
