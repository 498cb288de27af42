package com.scholary.podcast.job;

/** The requested operation is not allowed in the job's current state. */
public class JobStateConflictException extends RuntimeException {

  private final JobState state;

  public JobStateConflictException(JobState state, String message) {
    super(message);
    this.state = state;
  }

  public JobState state() {
    return state;
  }
}
