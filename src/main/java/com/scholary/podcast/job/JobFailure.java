package com.scholary.podcast.job;

import com.scholary.podcast.error.ErrorKind;

/** Why a job ended in {@link JobState#FAILED}. */
public record JobFailure(JobState stage, ErrorKind kind, String message) {}
