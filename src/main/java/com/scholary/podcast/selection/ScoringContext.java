package com.scholary.podcast.selection;

/**
 * What a scorer knows about a span besides its own text.
 *
 * @param style the requested podcast style
 * @param previousText text of the preceding span, empty for the first one
 * @param nextText text of the following span, empty for the last one
 */
public record ScoringContext(SegmentStyle style, String previousText, String nextText) {}
