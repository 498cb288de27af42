package com.scholary.podcast.assembly;

import java.util.List;
import java.util.Optional;

/**
 * Ordered render plan: every foreground entry in playback order, plus an optional music bed.
 *
 * <p>The timeline is the single source of truth for the mix. It can be rebuilt from the key
 * segments, the narration clips and the music reference alone.
 */
public record Timeline(List<TimelineEntry> entries, double totalDuration) {

  public Timeline {
    entries = List.copyOf(entries);
  }

  /** Excerpts and narration, in playback order. */
  public List<TimelineEntry> foreground() {
    return entries.stream().filter(e -> e.kind() != EntryKind.MUSIC_BED).toList();
  }

  public Optional<TimelineEntry> musicBed() {
    return entries.stream().filter(e -> e.kind() == EntryKind.MUSIC_BED).findFirst();
  }
}
