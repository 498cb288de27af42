package com.scholary.podcast.error;

/**
 * Machine-readable failure categories surfaced in a job's error log and in API error bodies.
 *
 * <p>Input errors are reported immediately and never retried. Transient service errors are retried
 * with bounded backoff before they are reported.
 */
public enum ErrorKind {
  OUT_OF_ORDER_CHUNK,
  OVERLAP,
  BUFFER_CLOSED,
  INVALID_CONFIG,
  INVALID_VOICE,
  SYNTHESIS_UNAVAILABLE,
  SCORER_UNAVAILABLE,
  ASSET_UNREADABLE,
  EMPTY_TIMELINE,
  RECORDING_DISCONNECTED,
  TRANSCRIPTION_FAILED,
  STORAGE_FAILED,
  INTERNAL
}
