package com.scholary.podcast.assembly;

import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import com.scholary.podcast.audio.WavFormatException;
import com.scholary.podcast.logging.StructuredLogger;
import com.scholary.podcast.narration.NarrationClip;
import com.scholary.podcast.selection.KeySegment;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Composes excerpts, narration and music into one track.
 *
 * <p>Assembly happens in two steps. {@link #buildTimeline} turns key segments and narration clips
 * into a render plan; {@link #render} mixes that plan into audio. Rendering is pure arithmetic
 * over the decoded assets (no dither, no randomness), so the same timeline and assets always
 * produce the same bytes.
 */
@Component
public class AudioAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioAssembler.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  /** Source reference of the meeting recording. */
  public static final String RECORDING_REF = "recording";

  private static final String NARRATION_PREFIX = "narration:";

  // Excerpts may run a few milliseconds past the end of a recording due to transcript rounding
  private static final int EXCERPT_TOLERANCE_SAMPLES = AudioFormat.SAMPLE_RATE / 50;

  private final AssemblyProperties properties;

  public AudioAssembler(AssemblyProperties properties) {
    this.properties = properties;
  }

  public static String narrationRef(String keySegmentId) {
    return NARRATION_PREFIX + keySegmentId;
  }

  /** Segment id of a narration reference, or null if the reference is not a narration. */
  public static String narrationSegmentId(String sourceRef) {
    return sourceRef.startsWith(NARRATION_PREFIX)
        ? sourceRef.substring(NARRATION_PREFIX.length())
        : null;
  }

  /**
   * Build the render plan.
   *
   * <p>Per segment: an optional short "colour" excerpt of the original, then the narration clip,
   * or the full original excerpt when the segment has no narration. Consecutive entries overlap
   * by the crossfade, shrunk to half of the shorter entry so neither disappears. With a music
   * reference, one music bed spans the whole output.
   *
   * @param segments the selected key segments
   * @param clips narration clips by key segment id; missing ids fall back to the original excerpt
   * @param musicRef music asset reference, or null for no music
   * @return the timeline
   * @throws EmptyTimelineException if there are no segments
   */
  public Timeline buildTimeline(
      List<KeySegment> segments, Map<String, NarrationClip> clips, String musicRef) {
    if (segments.isEmpty()) {
      throw new EmptyTimelineException("No key segments to assemble");
    }

    List<KeySegment> ordered = new ArrayList<>(segments);
    if (properties.ordering() == TimelineOrdering.CHRONOLOGICAL) {
      ordered.sort(Comparator.comparingDouble(s -> s.sourceSpan().start()));
    } else {
      ordered.sort(Comparator.comparingInt(KeySegment::rank));
    }

    List<Slot> slots = new ArrayList<>();
    for (KeySegment segment : ordered) {
      NarrationClip clip = clips.get(segment.id());
      if (clip != null) {
        double colour =
            Math.min(properties.colourExcerptSeconds(), segment.sourceSpan().duration());
        if (colour > 0) {
          slots.add(
              new Slot(
                  EntryKind.ORIGINAL_EXCERPT,
                  RECORDING_REF,
                  segment.sourceSpan().start(),
                  colour,
                  segment.id()));
        }
        slots.add(
            new Slot(
                EntryKind.NARRATION,
                narrationRef(segment.id()),
                0.0,
                clip.durationSeconds(),
                segment.id()));
      } else {
        slots.add(
            new Slot(
                EntryKind.ORIGINAL_EXCERPT,
                RECORDING_REF,
                segment.sourceSpan().start(),
                segment.sourceSpan().duration(),
                segment.id()));
      }
    }

    double crossfade = properties.crossfadeMs() / 1000.0;
    List<TimelineEntry> foreground = new ArrayList<>(slots.size());
    double cursor = 0.0;
    for (int i = 0; i < slots.size(); i++) {
      Slot slot = slots.get(i);
      double start = cursor;
      if (i > 0) {
        start -= overlap(slots.get(i - 1).duration(), slot.duration(), crossfade);
      }
      foreground.add(
          new TimelineEntry(
              slot.kind(),
              slot.ref(),
              slot.sourceOffset(),
              start,
              slot.duration(),
              slot.segmentId()));
      cursor = start + slot.duration();
    }
    double total = cursor;

    List<TimelineEntry> entries = new ArrayList<>(foreground.size() + 1);
    if (musicRef != null) {
      entries.add(new TimelineEntry(EntryKind.MUSIC_BED, musicRef, 0.0, 0.0, total, null));
    }
    entries.addAll(foreground);

    LOGGER.info(
        "Built timeline: {} segments, {} entries, music={}, duration={}s",
        ordered.size(),
        entries.size(),
        musicRef != null,
        total);
    return new Timeline(entries, total);
  }

  /**
   * Mix a timeline into canonical WAV audio.
   *
   * <p>Foreground entries are normalized to the target RMS level, faded linearly across their
   * overlaps and summed. The music bed is looped, normalized, lowered by the music gain and
   * ducked under the foreground (the narration duck wins where narration and an excerpt
   * overlap). The sum is hard-limited to 16-bit range.
   *
   * @param timeline the render plan
   * @param assets resolves source references
   * @return the rendered podcast
   * @throws EmptyTimelineException if the timeline has no foreground entries
   * @throws AssetUnreadableException if any referenced asset cannot be used; no partial output is
   *     produced
   */
  public RenderedPodcast render(Timeline timeline, AssetResolver assets) {
    List<TimelineEntry> foreground = timeline.foreground();
    if (foreground.isEmpty()) {
      throw new EmptyTimelineException("Timeline has no foreground entries");
    }
    long startedAt = System.currentTimeMillis();

    Map<String, short[]> decoded = new HashMap<>();
    int total = AudioFormat.samplesFor(timeline.totalDuration());
    double[] mix = new double[total];

    for (int i = 0; i < foreground.size(); i++) {
      TimelineEntry entry = foreground.get(i);
      short[] source = decode(entry.sourceRef(), assets, decoded);

      int from = AudioFormat.samplesFor(entry.sourceOffset());
      int length = AudioFormat.samplesFor(entry.duration());
      if (from + length > source.length + EXCERPT_TOLERANCE_SAMPLES) {
        throw new AssetUnreadableException(
            entry.sourceRef(),
            String.format(
                "Excerpt [%.3f+%.3f]s lies outside asset '%s' (%.3fs long)",
                entry.sourceOffset(),
                entry.duration(),
                entry.sourceRef(),
                AudioFormat.secondsFor(source.length)));
      }
      length = Math.max(0, Math.min(length, source.length - from));

      int fadeIn = i > 0 ? fadeSamples(foreground.get(i - 1), entry) : 0;
      int fadeOut = i + 1 < foreground.size() ? fadeSamples(entry, foreground.get(i + 1)) : 0;
      double gain = normalizationGain(source, from, length);
      int outStart = AudioFormat.samplesFor(entry.startOffset());

      for (int k = 0; k < length; k++) {
        int out = outStart + k;
        if (out >= total) {
          break;
        }
        double envelope = 1.0;
        if (k < fadeIn) {
          envelope *= (k + 0.5) / fadeIn;
        }
        int remaining = length - k;
        if (remaining <= fadeOut) {
          envelope *= (remaining - 0.5) / fadeOut;
        }
        mix[out] += source[from + k] * gain * envelope;
      }
    }

    timeline
        .musicBed()
        .ifPresent(bed -> mixMusic(bed, foreground, decode(bed.sourceRef(), assets, decoded), mix));

    short[] output = new short[total];
    for (int s = 0; s < total; s++) {
      long rounded = Math.round(mix[s]);
      output[s] = (short) Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, rounded));
    }

    RenderedPodcast rendered =
        new RenderedPodcast(WavCodec.encode(output), AudioFormat.secondsFor(total));
    STRUCTURED_LOGGER.logRenderFinished(
        timeline.entries().size(),
        rendered.durationSeconds(),
        System.currentTimeMillis() - startedAt);
    return rendered;
  }

  private void mixMusic(
      TimelineEntry bed, List<TimelineEntry> foreground, short[] music, double[] mix) {
    if (music.length == 0) {
      throw new AssetUnreadableException(bed.sourceRef(), "Music asset contains no audio");
    }
    double narrationDuck = dbToLinear(properties.narrationDuckDb());
    double excerptDuck = dbToLinear(properties.excerptDuckDb());

    double[] duck = new double[mix.length];
    Arrays.fill(duck, 1.0);
    // Excerpts first so narration overwrites them where both play
    for (EntryKind kind : new EntryKind[] {EntryKind.ORIGINAL_EXCERPT, EntryKind.NARRATION}) {
      double level = kind == EntryKind.NARRATION ? narrationDuck : excerptDuck;
      for (TimelineEntry entry : foreground) {
        if (entry.kind() != kind) {
          continue;
        }
        int from = AudioFormat.samplesFor(entry.startOffset());
        int to = Math.min(mix.length, AudioFormat.samplesFor(entry.endOffset()));
        for (int s = from; s < to; s++) {
          duck[s] = kind == EntryKind.NARRATION ? level : Math.min(duck[s], level);
        }
      }
    }

    double gain =
        normalizationGain(music, 0, music.length) * dbToLinear(properties.musicGainDb());
    int musicOffset = AudioFormat.samplesFor(bed.sourceOffset());
    int from = AudioFormat.samplesFor(bed.startOffset());
    int to = Math.min(mix.length, AudioFormat.samplesFor(bed.endOffset()));
    for (int s = from; s < to; s++) {
      int index = (musicOffset + s - from) % music.length;
      mix[s] += music[index] * gain * duck[s];
    }
  }

  private short[] decode(String sourceRef, AssetResolver assets, Map<String, short[]> decoded) {
    short[] cached = decoded.get(sourceRef);
    if (cached != null) {
      return cached;
    }
    try {
      byte[] bytes = assets.load(sourceRef);
      if (bytes == null) {
        throw new AssetUnreadableException(sourceRef, "Asset not found: " + sourceRef);
      }
      short[] samples = WavCodec.decode(bytes);
      decoded.put(sourceRef, samples);
      return samples;
    } catch (IOException | WavFormatException e) {
      throw new AssetUnreadableException(
          sourceRef, "Cannot read asset '" + sourceRef + "': " + e.getMessage(), e);
    }
  }

  /** Gain that brings the RMS of {@code samples[from, from+length)} to the target level. */
  private double normalizationGain(short[] samples, int from, int length) {
    if (length <= 0) {
      return 1.0;
    }
    double sumSquares = 0;
    for (int i = from; i < from + length; i++) {
      double normalized = samples[i] / (double) Short.MAX_VALUE;
      sumSquares += normalized * normalized;
    }
    double rms = Math.sqrt(sumSquares / length);
    if (rms == 0) {
      return 1.0;
    }
    double gain = dbToLinear(properties.targetRmsDbfs()) / rms;
    return Math.min(gain, dbToLinear(properties.maxGainDb()));
  }

  private static int fadeSamples(TimelineEntry earlier, TimelineEntry later) {
    return Math.max(0, AudioFormat.samplesFor(earlier.endOffset() - later.startOffset()));
  }

  private static double overlap(double previousDuration, double duration, double crossfade) {
    return Math.max(0, Math.min(crossfade, Math.min(previousDuration, duration) / 2));
  }

  private static double dbToLinear(double db) {
    return Math.pow(10, db / 20);
  }

  private record Slot(
      EntryKind kind, String ref, double sourceOffset, double duration, String segmentId) {}
}
