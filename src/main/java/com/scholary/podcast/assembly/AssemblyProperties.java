package com.scholary.podcast.assembly;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Mixing parameters for the audio assembler.
 *
 * @param crossfadeMs overlap between consecutive entries
 * @param colourExcerptSeconds length of the original excerpt played before each narration; 0
 *     disables it
 * @param targetRmsDbfs loudness every foreground entry is normalized to
 * @param maxGainDb cap on normalization gain, so near-silent audio is not blown up into noise
 * @param musicGainDb music level relative to the foreground target
 * @param narrationDuckDb music attenuation while narration plays
 * @param excerptDuckDb music attenuation while an original excerpt plays
 * @param musicTrack path of a canonical WAV music file; blank selects the built-in bed
 * @param ordering order of segments in the output
 */
@ConfigurationProperties(prefix = "podcast.assembly")
@Validated
public record AssemblyProperties(
    @PositiveOrZero int crossfadeMs,
    @PositiveOrZero double colourExcerptSeconds,
    double targetRmsDbfs,
    @PositiveOrZero double maxGainDb,
    double musicGainDb,
    double narrationDuckDb,
    double excerptDuckDb,
    String musicTrack,
    @NotNull TimelineOrdering ordering) {}
