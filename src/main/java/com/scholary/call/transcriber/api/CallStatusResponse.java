package com.scholary.call.transcriber.api;

import com.scholary.call.transcriber.continuity.WorkUnitState;
import com.scholary.call.transcriber.registry.WorkUnitStatus;
import java.time.Instant;

/** Latest work unit of a call, as seen by this instance. */
public record CallStatusResponse(
    String callId,
    String workUnitId,
    int sequence,
    WorkUnitState state,
    String recognitionSessionId,
    String lastCallerFragment,
    String lastAgentFragment,
    String error,
    Instant startedAt,
    Instant updatedAt) {

  static CallStatusResponse from(WorkUnitStatus status) {
    return new CallStatusResponse(
        status.getCallId(),
        status.getWorkUnitId(),
        status.getSequence(),
        status.getState(),
        status.getRecognitionSessionId(),
        status.getLastCallerFragment(),
        status.getLastAgentFragment(),
        status.getError(),
        status.getStartedAt(),
        status.getUpdatedAt());
  }
}
