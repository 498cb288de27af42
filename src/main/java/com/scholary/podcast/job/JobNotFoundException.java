package com.scholary.podcast.job;

/** No job with the given id exists (never created, acknowledged or expired). */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}
