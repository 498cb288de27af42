package com.scholary.podcast.selection;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for key segment selection.
 *
 * @param windowSeconds window length used to group chunks when no speaker labels are present
 * @param maxSpanSeconds upper bound for a single candidate span
 * @param minGapSeconds minimum distance between two accepted segments
 */
@ConfigurationProperties(prefix = "podcast.selection")
@Validated
public record SelectionProperties(
    @Positive double windowSeconds,
    @Positive double maxSpanSeconds,
    @PositiveOrZero double minGapSeconds) {}
