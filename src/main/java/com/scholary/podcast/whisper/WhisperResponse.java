package com.scholary.podcast.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains a list of segments and the detected language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<TranscriptSegment> segments, String language) {}
