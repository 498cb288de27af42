package com.scholary.podcast.selection;

import com.scholary.podcast.transcript.TimeRange;

/** A chunk-aligned transcript span that may become a key segment. */
public record CandidateSpan(int index, TimeRange range, String speakerLabel, String text) {}
