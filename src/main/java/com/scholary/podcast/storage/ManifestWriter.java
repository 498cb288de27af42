package com.scholary.podcast.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.assembly.Timeline;
import com.scholary.podcast.assembly.TimelineEntry;
import com.scholary.podcast.narration.NarrationScript;
import com.scholary.podcast.narration.VoiceId;
import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.selection.SegmentStyle;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds podcast manifests and writes them in various formats.
 *
 * <p>Supports JSON (machine-readable) and SRT (SubRip captions, one cue per key segment).
 */
@Component
public class ManifestWriter {

  private final ObjectMapper objectMapper;

  public ManifestWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Describe a rendered podcast.
   *
   * @param segments the selected key segments
   * @param failedSegmentIds segments rendered from original audio because narration failed
   * @param timeline the plan the audio was rendered from; gives each segment's output position
   * @param durationSeconds length of the rendered audio
   */
  public PodcastManifest buildManifest(
      String jobId,
      String title,
      Instant createdAt,
      VoiceId voice,
      SegmentStyle style,
      List<KeySegment> segments,
      Set<String> failedSegmentIds,
      Timeline timeline,
      double durationSeconds) {

    Map<String, KeySegment> byId =
        segments.stream().collect(Collectors.toMap(KeySegment::id, Function.identity()));

    // First and last foreground entry per segment, in playback order
    Map<String, double[]> placement = new LinkedHashMap<>();
    for (TimelineEntry entry : timeline.foreground()) {
      double[] span = placement.get(entry.keySegmentId());
      if (span == null) {
        placement.put(entry.keySegmentId(), new double[] {entry.startOffset(), entry.endOffset()});
      } else {
        span[1] = Math.max(span[1], entry.endOffset());
      }
    }

    List<PodcastManifest.SegmentEntry> entries = new ArrayList<>(placement.size());
    for (Map.Entry<String, double[]> placed : placement.entrySet()) {
      KeySegment segment = byId.get(placed.getKey());
      if (segment == null) {
        continue;
      }
      boolean narrated = !failedSegmentIds.contains(segment.id());
      double[] span = placed.getValue();
      entries.add(
          new PodcastManifest.SegmentEntry(
              segment.id(),
              segment.rank(),
              segment.score(),
              segment.sourceSpan().start(),
              segment.sourceSpan().end(),
              span[0],
              span[1] - span[0],
              segment.summaryText(),
              KeyPointExtractor.extract(
                  segment.transcriptText(), KeyPointExtractor.DEFAULT_MAX_POINTS),
              narrated ? NarrationScript.forSegment(segment) : segment.transcriptText(),
              narrated));
    }

    List<String> failed =
        segments.stream().map(KeySegment::id).filter(failedSegmentIds::contains).toList();

    return new PodcastManifest(
        jobId,
        title,
        createdAt.toString(),
        voice.tag(),
        style.tag(),
        durationSeconds,
        timeline.musicBed().map(TimelineEntry::sourceRef).orElse(null),
        entries,
        failed);
  }

  /** Write the manifest as pretty-printed JSON. */
  public byte[] writeJson(PodcastManifest manifest) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest);
  }

  /**
   * Write captions as SRT (SubRip subtitle format).
   *
   * <pre>
   * 1
   * 00:00:00,000 --> 00:00:12,400
   * Here's a key moment from the meeting. We agreed to ship on Friday.
   *
   * 2
   * 00:00:12,100 --> 00:00:20,000
   * ...
   * </pre>
   */
  public byte[] writeSrt(PodcastManifest manifest) {
    StringBuilder srt = new StringBuilder();
    int cue = 1;
    for (PodcastManifest.SegmentEntry entry : manifest.segments()) {
      String caption = entry.caption() == null ? "" : entry.caption().trim();
      if (caption.isEmpty()) {
        continue;
      }
      srt.append(cue++).append("\n");
      srt.append(formatSrtTime(entry.outputOffset()))
          .append(" --> ")
          .append(formatSrtTime(entry.outputOffset() + entry.outputDuration()))
          .append("\n");
      srt.append(caption).append("\n\n");
    }
    return srt.toString().getBytes(StandardCharsets.UTF_8);
  }

  /** Format seconds as an SRT timecode, HH:MM:SS,mmm. */
  static String formatSrtTime(double seconds) {
    long totalMillis = Math.round(seconds * 1000);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;
    return String.format(Locale.ROOT, "%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }
}
