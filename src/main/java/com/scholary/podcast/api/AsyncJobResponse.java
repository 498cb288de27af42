package com.scholary.podcast.api;

import com.scholary.podcast.job.JobState;

/** Response for a newly created job; poll {@code GET /api/podcasts/{jobId}} for its status. */
public record AsyncJobResponse(String jobId, JobState state) {}
