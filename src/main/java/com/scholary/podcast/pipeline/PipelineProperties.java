package com.scholary.podcast.pipeline;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Resource limits for running jobs.
 *
 * @param tempDir parent directory for per-job working files
 * @param pipelineThreads jobs processed concurrently
 * @param pipelineQueueSize jobs waiting for a pipeline thread before new ones are rejected
 * @param captureThreads threads for live capture and transcript ingestion, two per live meeting
 * @param liveQueueCapacity transcript chunks buffered between live transcription and ingestion
 * @param captureBufferBytes read size for the recording stream
 */
@ConfigurationProperties(prefix = "podcast.pipeline")
@Validated
public record PipelineProperties(
    @NotBlank String tempDir,
    @Positive int pipelineThreads,
    @Positive int pipelineQueueSize,
    @Positive int captureThreads,
    @Positive int liveQueueCapacity,
    @Positive int captureBufferBytes) {}
