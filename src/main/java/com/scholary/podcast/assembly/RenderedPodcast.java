package com.scholary.podcast.assembly;

/**
 * Final mixed audio.
 *
 * @param wav canonical WAV bytes
 * @param durationSeconds length of the audio
 */
public record RenderedPodcast(byte[] wav, double durationSeconds) {}
