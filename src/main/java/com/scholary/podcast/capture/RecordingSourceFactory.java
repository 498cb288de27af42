package com.scholary.podcast.capture;

/** Creates the recording source for a live meeting job. */
@FunctionalInterface
public interface RecordingSourceFactory {

  RecordingSource create(String jobId);
}
