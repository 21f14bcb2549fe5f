package com.scholary.call.transcriber.registry;

import com.scholary.call.transcriber.continuity.WorkUnitState;
import java.time.Instant;

/**
 * Latest known state of the work unit running for a call.
 *
 * <p>Mutated by the work unit's own thread and read by status requests, hence the volatile fields.
 */
public class WorkUnitStatus {

  private final String callId;
  private final String workUnitId;
  private final int sequence;
  private final Instant startedAt;

  private volatile WorkUnitState state;
  private volatile String recognitionSessionId;
  private volatile String lastCallerFragment;
  private volatile String lastAgentFragment;
  private volatile String error;
  private volatile Instant updatedAt;

  public WorkUnitStatus(String callId, String workUnitId, int sequence, Instant startedAt) {
    this.callId = callId;
    this.workUnitId = workUnitId;
    this.sequence = sequence;
    this.startedAt = startedAt;
    this.updatedAt = startedAt;
    this.state = WorkUnitState.STARTING;
  }

  public String getCallId() {
    return callId;
  }

  public String getWorkUnitId() {
    return workUnitId;
  }

  public int getSequence() {
    return sequence;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public WorkUnitState getState() {
    return state;
  }

  public void setState(WorkUnitState state, Instant at) {
    this.state = state;
    this.updatedAt = at;
  }

  /** True until the work unit reaches DONE. */
  public boolean isActive() {
    return state != WorkUnitState.DONE;
  }

  public String getRecognitionSessionId() {
    return recognitionSessionId;
  }

  public void setRecognitionSessionId(String recognitionSessionId) {
    this.recognitionSessionId = recognitionSessionId;
  }

  public String getLastCallerFragment() {
    return lastCallerFragment;
  }

  public String getLastAgentFragment() {
    return lastAgentFragment;
  }

  public void setLastFragments(String callerFragment, String agentFragment) {
    this.lastCallerFragment = callerFragment;
    this.lastAgentFragment = agentFragment;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
