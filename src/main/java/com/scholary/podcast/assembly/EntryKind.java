package com.scholary.podcast.assembly;

/** What a timeline entry plays. */
public enum EntryKind {
  ORIGINAL_EXCERPT,
  NARRATION,
  MUSIC_BED
}
