package com.scholary.podcast.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.narration.NarrationClip;
import com.scholary.podcast.narration.VoiceId;
import com.scholary.podcast.selection.KeySegment;
import com.scholary.podcast.selection.SegmentStyle;
import com.scholary.podcast.transcript.TimeRange;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AudioAssemblerTest {

  private static final AssemblyProperties PROPERTIES =
      new AssemblyProperties(300, 0, -20, 20, -18, -12, -6, "", TimelineOrdering.RANK);

  private final AudioAssembler assembler = new AudioAssembler(PROPERTIES);
  private final MusicLibrary musicLibrary = new MusicLibrary(PROPERTIES);

  private final byte[] recording = tone(60.0, 440);

  @Test
  void buildTimeline_shouldSubtractOneCrossfadePerJunction() {
    List<KeySegment> segments = segments();
    Map<String, NarrationClip> clips = clips(10.0, 8.0, 12.0);

    Timeline timeline = assembler.buildTimeline(segments, clips, null);

    assertThat(timeline.totalDuration()).isCloseTo(30.0 - 2 * 0.3, within(1e-9));
    assertThat(timeline.musicBed()).isEmpty();
    assertThat(timeline.foreground())
        .extracting(TimelineEntry::kind)
        .containsOnly(EntryKind.NARRATION);
    assertThat(timeline.foreground().get(1).startOffset()).isCloseTo(9.7, within(1e-9));
  }

  @Test
  void buildTimeline_shouldSpanMusicBedOverWholeOutput() {
    Timeline timeline =
        assembler.buildTimeline(segments(), clips(10.0, 8.0, 12.0), musicLibrary.trackRef());

    TimelineEntry bed = timeline.musicBed().orElseThrow();
    assertThat(bed.startOffset()).isZero();
    assertThat(bed.duration()).isEqualTo(timeline.totalDuration());
    assertThat(bed.sourceRef()).isEqualTo(MusicLibrary.BUILT_IN_REF);
  }

  @Test
  void buildTimeline_shouldFallBackToOriginalExcerptWithoutNarration() {
    Map<String, NarrationClip> clips = clips(10.0, 8.0, 12.0);
    clips.remove("seg-02");

    Timeline timeline = assembler.buildTimeline(segments(), clips, null);

    TimelineEntry fallback = timeline.foreground().get(1);
    assertThat(fallback.kind()).isEqualTo(EntryKind.ORIGINAL_EXCERPT);
    assertThat(fallback.sourceRef()).isEqualTo(AudioAssembler.RECORDING_REF);
    assertThat(fallback.sourceOffset()).isEqualTo(20.0);
    assertThat(fallback.duration()).isEqualTo(6.0);
  }

  @Test
  void buildTimeline_shouldOrderChronologicallyWhenConfigured() {
    AudioAssembler chronological =
        new AudioAssembler(
            new AssemblyProperties(
                300, 0, -20, 20, -18, -12, -6, "", TimelineOrdering.CHRONOLOGICAL));

    Timeline timeline = chronological.buildTimeline(segments(), clips(10.0, 8.0, 12.0), null);

    assertThat(timeline.foreground())
        .extracting(TimelineEntry::keySegmentId)
        .containsExactly("seg-03", "seg-01", "seg-02");
  }

  @Test
  void buildTimeline_shouldRejectEmptySelection() {
    assertThatThrownBy(() -> assembler.buildTimeline(List.of(), Map.of(), null))
        .isInstanceOfSatisfying(
            EmptyTimelineException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.EMPTY_TIMELINE));
  }

  @Test
  void render_shouldMatchTimelineDurationAndBeDeterministic() {
    Map<String, NarrationClip> clips = clips(10.0, 8.0, 12.0);
    Timeline timeline = assembler.buildTimeline(segments(), clips, musicLibrary.trackRef());

    RenderedPodcast first = assembler.render(timeline, assets(clips));
    RenderedPodcast second = assembler.render(timeline, assets(clips));

    assertThat(first.durationSeconds()).isCloseTo(29.4, within(1.0 / AudioFormat.SAMPLE_RATE));
    assertThat(WavCodec.durationSeconds(first.wav())).isEqualTo(first.durationSeconds());
    assertThat(first.wav()).isEqualTo(second.wav());
  }

  @Test
  void render_shouldFailWithoutPartialOutputWhenAssetIsUnreadable() {
    Map<String, NarrationClip> clips = clips(10.0, 8.0, 12.0);
    Timeline timeline = assembler.buildTimeline(segments(), clips, null);
    AssetResolver broken =
        ref -> {
          if (ref.equals(AudioAssembler.narrationRef("seg-02"))) {
            return "not audio".getBytes();
          }
          return assets(clips).load(ref);
        };

    assertThatThrownBy(() -> assembler.render(timeline, broken))
        .isInstanceOfSatisfying(
            AssetUnreadableException.class,
            e -> {
              assertThat(e.kind()).isEqualTo(ErrorKind.ASSET_UNREADABLE);
              assertThat(e.sourceRef()).isEqualTo("narration:seg-02");
            });
  }

  @Test
  void render_shouldRejectExcerptBeyondRecording() {
    KeySegment late =
        new KeySegment(
            "seg-01", new TimeRange(55, 75), 1, 0.9, "late", SegmentStyle.CALM, "late");
    Timeline timeline = assembler.buildTimeline(List.of(late), Map.of(), null);

    assertThatThrownBy(() -> assembler.render(timeline, assets(Map.of())))
        .isInstanceOf(AssetUnreadableException.class)
        .hasMessageContaining("outside asset");
  }

  @Test
  void render_shouldStayWithinSixteenBitRange() {
    Map<String, NarrationClip> clips = clips(10.0, 8.0, 12.0);
    Timeline timeline = assembler.buildTimeline(segments(), clips, musicLibrary.trackRef());

    short[] samples = WavCodec.decode(assembler.render(timeline, assets(clips)).wav());

    double peak = 0;
    for (short sample : samples) {
      peak = Math.max(peak, Math.abs((double) sample));
    }
    assertThat(peak).isGreaterThan(0).isLessThanOrEqualTo(Short.MAX_VALUE);
  }

  private AssetResolver assets(Map<String, NarrationClip> clips) {
    return ref -> {
      if (ref.equals(AudioAssembler.RECORDING_REF)) {
        return recording;
      }
      String segmentId = AudioAssembler.narrationSegmentId(ref);
      if (segmentId != null) {
        return clips.get(segmentId).audio();
      }
      if (musicLibrary.owns(ref)) {
        return musicLibrary.load(ref);
      }
      throw new IOException("unknown " + ref);
    };
  }

  private static List<KeySegment> segments() {
    return List.of(
        new KeySegment(
            "seg-01", new TimeRange(10, 20), 1, 0.9, "first", SegmentStyle.CALM, "first"),
        new KeySegment(
            "seg-02", new TimeRange(20, 26), 2, 0.8, "second", SegmentStyle.CALM, "second"),
        new KeySegment(
            "seg-03", new TimeRange(0, 5), 3, 0.7, "third", SegmentStyle.CALM, "third"));
  }

  private static Map<String, NarrationClip> clips(double... durations) {
    Map<String, NarrationClip> clips = new HashMap<>();
    for (int i = 0; i < durations.length; i++) {
      String id = KeySegment.idForRank(i + 1);
      byte[] audio = tone(durations[i], 200 + 40 * i);
      clips.put(id, new NarrationClip(id, audio, durations[i], VoiceId.DEFAULT));
    }
    return clips;
  }

  private static byte[] tone(double seconds, double hz) {
    short[] samples = new short[AudioFormat.samplesFor(seconds)];
    for (int i = 0; i < samples.length; i++) {
      samples[i] =
          (short) Math.round(8000 * Math.sin(2 * Math.PI * hz * i / AudioFormat.SAMPLE_RATE));
    }
    return WavCodec.encode(samples);
  }
}
