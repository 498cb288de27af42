package com.scholary.podcast.narration;

/**
 * Rendered narration for one key segment.
 *
 * @param keySegmentId the segment this clip narrates
 * @param audio canonical WAV bytes, owned by the clip
 * @param durationSeconds length of the audio
 * @param voice the voice used
 */
public record NarrationClip(
    String keySegmentId, byte[] audio, double durationSeconds, VoiceId voice) {}
