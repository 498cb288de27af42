package com.scholary.podcast.api;

import com.scholary.podcast.job.WorkflowKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Request to turn a meeting into a podcast.
 *
 * <p>Voice and style are matched case-insensitively; unknown names are rejected with 400. Omitted
 * settings take their defaults: voice {@code default}, style {@code professional}, five segments,
 * no music.
 *
 * @param workflow {@code UPLOAD} for audio in the object store, {@code LIVE_MEETING} to record
 * @param audioBucket bucket of the uploaded audio, optional
 * @param audioKey object key of the uploaded audio, required for uploads
 * @param transcript transcript of the upload, optional; the audio is transcribed when absent
 */
public record CreatePodcastRequest(
    @NotNull WorkflowKind workflow,
    @Size(max = 200) String title,
    String audioBucket,
    String audioKey,
    @Valid List<TranscriptChunkRequest> transcript,
    String voice,
    String style,
    @Min(3) @Max(10) Integer segmentCount,
    Boolean addMusic) {

  /** One transcript chunk, times in seconds. */
  public record TranscriptChunkRequest(
      @PositiveOrZero double start,
      @PositiveOrZero double end,
      String speaker,
      @NotNull String text) {}
}
