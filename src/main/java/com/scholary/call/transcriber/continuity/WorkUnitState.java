package com.scholary.call.transcriber.continuity;

/** Lifecycle of one work unit. */
public enum WorkUnitState {
  STARTING,
  STREAMING,
  TIME_BUDGET_REACHED,
  SOURCE_CLOSED,
  ERROR,
  FINALIZING,
  DONE
}
