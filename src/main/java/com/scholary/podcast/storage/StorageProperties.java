package com.scholary.podcast.storage;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where finished podcasts are written.
 *
 * @param bucket output bucket; the object store's default bucket when blank
 * @param keyPrefix prefix for every output key, e.g. {@code podcasts/}
 * @param urlTtlHours validity of the presigned audio URL
 * @param exportMp3 also upload an MP3 rendition next to the WAV
 * @param mp3Bitrate encoder bitrate of the MP3 rendition
 */
@ConfigurationProperties(prefix = "podcast.storage")
@Validated
public record StorageProperties(
    String bucket,
    @NotNull String keyPrefix,
    @Positive int urlTtlHours,
    boolean exportMp3,
    @NotBlank String mp3Bitrate) {}
