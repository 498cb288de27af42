package com.scholary.podcast.job;

/**
 * Lifecycle of a pipeline job.
 *
 * <pre>
 * CREATED -> RECORDING (live only) -> TRANSCRIBING -> SELECTING -> SYNTHESIZING -> ASSEMBLING
 * -> DONE
 * </pre>
 *
 * <p>Upload jobs go straight from CREATED to TRANSCRIBING. FAILED is reachable from every
 * non-terminal state, CANCELLED from every state before DONE.
 */
public enum JobState {
  CREATED,
  RECORDING,
  TRANSCRIBING,
  SELECTING,
  SYNTHESIZING,
  ASSEMBLING,
  DONE,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED || this == CANCELLED;
  }

  /**
   * Whether a job of the given workflow may move from this state to {@code next}.
   *
   * @param next the target state
   * @param workflow the job's workflow
   * @return true if the transition is legal
   */
  public boolean canTransitionTo(JobState next, WorkflowKind workflow) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED || next == CANCELLED) {
      return true;
    }
    return switch (this) {
      case CREATED ->
          workflow == WorkflowKind.LIVE_MEETING ? next == RECORDING : next == TRANSCRIBING;
      case RECORDING -> next == TRANSCRIBING;
      case TRANSCRIBING -> next == SELECTING;
      case SELECTING -> next == SYNTHESIZING;
      case SYNTHESIZING -> next == ASSEMBLING;
      case ASSEMBLING -> next == DONE;
      default -> false;
    };
  }
}
