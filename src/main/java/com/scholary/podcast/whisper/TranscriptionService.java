package com.scholary.podcast.whisper;

import com.scholary.podcast.transcript.TranscriptChunk;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Speech-to-text collaborator.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the pipeline.
 * Chunks are always delivered in time order and never overlap.
 */
public interface TranscriptionService {

  /**
   * Transcribe a complete recording.
   *
   * @param wavFile canonical WAV file
   * @return ordered, non-overlapping transcript chunks
   * @throws WhisperException if transcription fails
   */
  List<TranscriptChunk> transcribe(Path wavFile);

  /**
   * Open a streaming session for a live meeting.
   *
   * @param listener receives chunks as they are recognized, on a transcription thread
   * @return the session to feed audio into
   */
  LiveTranscription startLive(Consumer<TranscriptChunk> listener);
}
