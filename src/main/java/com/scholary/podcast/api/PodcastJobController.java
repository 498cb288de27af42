package com.scholary.podcast.api;

import com.scholary.podcast.job.InvalidConfigException;
import com.scholary.podcast.job.JobSnapshot;
import com.scholary.podcast.job.PodcastConfig;
import com.scholary.podcast.pipeline.CreatePodcastCommand;
import com.scholary.podcast.pipeline.PodcastPipelineOrchestrator;
import com.scholary.podcast.transcript.TranscriptChunk;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for meeting-to-podcast jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Creating a job from uploaded audio or a live meeting (returns the job id immediately)
 *   <li>Polling job status
 *   <li>Previewing key segments while a meeting is still being recorded
 *   <li>Stopping a recording, cancelling a job and acknowledging its outcome
 * </ul>
 */
@RestController
@RequestMapping("/api/podcasts")
@Tag(name = "Podcasts", description = "Turn meeting recordings into narrated podcasts")
public class PodcastJobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PodcastJobController.class);

  private final PodcastPipelineOrchestrator orchestrator;

  public PodcastJobController(PodcastPipelineOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping
  @Operation(
      summary = "Create podcast job",
      description =
          "Start an asynchronous job and return its id for status polling. UPLOAD jobs read "
              + "audioKey from the object store; LIVE_MEETING jobs record until stop-recording.")
  public ResponseEntity<AsyncJobResponse> create(@Valid @RequestBody CreatePodcastRequest request) {
    LOGGER.info(
        "Create request: workflow={}, audioKey={}, voice={}, style={}, segments={}",
        request.workflow(),
        request.audioKey(),
        request.voice(),
        request.style(),
        request.segmentCount());

    PodcastConfig config =
        PodcastConfig.parse(
            request.voice(), request.style(), request.segmentCount(), request.addMusic());
    JobSnapshot job =
        orchestrator.createJob(
            new CreatePodcastCommand(
                request.workflow(),
                request.title(),
                request.audioBucket(),
                request.audioKey(),
                toChunks(request.transcript()),
                config));
    return ResponseEntity.accepted().body(new AsyncJobResponse(job.id(), job.state()));
  }

  @GetMapping("/{id}")
  @Operation(
      summary = "Get job status",
      description = "State, progress, error log, degraded segments and, once done, the podcast")
  public JobStatusResponse status(@PathVariable String id) {
    return JobStatusResponse.from(orchestrator.status(id));
  }

  @GetMapping("/{id}/preview")
  @Operation(
      summary = "Preview key segments",
      description = "Key segments of the transcript so far, scored locally without vendor calls")
  public SegmentPreviewResponse preview(@PathVariable String id) {
    return SegmentPreviewResponse.from(id, orchestrator.previewSegments(id));
  }

  @PostMapping("/{id}/stop-recording")
  @Operation(
      summary = "Stop recording",
      description = "End the recording of a live meeting. Repeated calls have no effect.")
  public JobStatusResponse stopRecording(@PathVariable String id) {
    return JobStatusResponse.from(orchestrator.stopRecording(id));
  }

  @PostMapping("/{id}/cancel")
  @Operation(
      summary = "Cancel job",
      description = "Cancel a running job. Cancelling twice is allowed; finished jobs give 409.")
  public JobStatusResponse cancel(@PathVariable String id) {
    return JobStatusResponse.from(orchestrator.cancel(id));
  }

  @DeleteMapping("/{id}")
  @Operation(
      summary = "Acknowledge job",
      description = "Confirm the outcome of a finished job and remove it. Running jobs give 409.")
  public ResponseEntity<Void> acknowledge(@PathVariable String id) {
    orchestrator.acknowledge(id);
    return ResponseEntity.noContent().build();
  }

  private static List<TranscriptChunk> toChunks(
      List<CreatePodcastRequest.TranscriptChunkRequest> transcript) {
    if (transcript == null) {
      return null;
    }
    List<TranscriptChunk> chunks = new ArrayList<>(transcript.size());
    for (int i = 0; i < transcript.size(); i++) {
      CreatePodcastRequest.TranscriptChunkRequest chunk = transcript.get(i);
      try {
        chunks.add(new TranscriptChunk(chunk.start(), chunk.end(), chunk.speaker(), chunk.text()));
      } catch (IllegalArgumentException e) {
        throw new InvalidConfigException("transcript[" + i + "]: " + e.getMessage());
      }
    }
    return chunks;
  }
}
