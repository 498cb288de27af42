package com.scholary.podcast.job;

import java.time.Instant;

/** An entry in a job's state history. */
public record StateChange(JobState state, Instant at) {}
