package com.scholary.podcast.job;

/** How a job obtains its meeting audio. */
public enum WorkflowKind {
  /** Audio already exists in the object store. */
  UPLOAD,
  /** Audio is captured live until the caller stops the recording. */
  LIVE_MEETING
}
