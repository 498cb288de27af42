package com.scholary.podcast.storage;

/**
 * Where a finished podcast was written.
 *
 * @param bucket object store bucket
 * @param audioKey key of the rendered WAV
 * @param mp3Key key of the MP3 export, or null when none was written
 * @param manifestKey key of the JSON manifest
 * @param captionsKey key of the SRT captions
 * @param audioUrl time-limited download URL for the audio
 */
public record StoredPodcast(
    String bucket,
    String audioKey,
    String mp3Key,
    String manifestKey,
    String captionsKey,
    String audioUrl) {}
