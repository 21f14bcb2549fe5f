package com.scholary.call.transcriber.continuity;

/** How a work unit left the call. */
public enum WorkUnitOutcome {
  /** A successor work unit was launched. */
  CONTINUED,
  /** The call ended and was finalized. */
  COMPLETED,
  /** An ERROR event was written. */
  FAILED,
  /** The customization hook declined the call. */
  VETOED,
  /** The work-unit cap was hit; nothing further is launched. */
  RUNAWAY
}
