package com.scholary.podcast.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Represents a single segment of transcribed audio as returned by the Whisper service.
 *
 * <p>{@code speaker} is only present when the service runs with diarization enabled.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text, String speaker) {}
