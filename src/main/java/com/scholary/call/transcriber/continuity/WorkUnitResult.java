package com.scholary.call.transcriber.continuity;

/**
 * @param outcome how the work unit ended
 * @param session the call as this work unit last saw it
 * @param successor checkpoint handed to the next work unit, null unless continued
 * @param error failure message, null unless failed
 */
public record WorkUnitResult(
    WorkUnitOutcome outcome, CallSession session, CallSession successor, String error) {

  static WorkUnitResult of(WorkUnitOutcome outcome, CallSession session) {
    return new WorkUnitResult(outcome, session, null, null);
  }
}
