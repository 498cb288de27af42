package com.scholary.podcast.pipeline;

import com.scholary.podcast.job.PodcastConfig;
import com.scholary.podcast.job.WorkflowKind;
import com.scholary.podcast.transcript.TranscriptChunk;
import java.util.List;

/**
 * Everything needed to start a job.
 *
 * @param workflow upload or live meeting
 * @param title optional title for the podcast
 * @param audioBucket bucket of the uploaded audio; the default bucket when null
 * @param audioKey object key of the uploaded audio, required for uploads
 * @param transcript transcript supplied with an upload, or null to transcribe the audio
 * @param config validated job settings
 */
public record CreatePodcastCommand(
    WorkflowKind workflow,
    String title,
    String audioBucket,
    String audioKey,
    List<TranscriptChunk> transcript,
    PodcastConfig config) {}
