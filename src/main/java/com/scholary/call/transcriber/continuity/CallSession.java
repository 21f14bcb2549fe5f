package com.scholary.call.transcriber.continuity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scholary.call.transcriber.audio.ChannelRole;

/**
 * Checkpoint of one logical call, handed from each work unit to its successor.
 *
 * <p>Holds everything a fresh work unit needs to pick the call up where the previous one stopped:
 * which live source carries each party, where in each source to resume, and which recognition
 * session to continue. Serialized as JSON when the hand-off crosses a process boundary.
 *
 * @param callId opaque call id, also the event-log partition key
 * @param callerSourceRef live source of the caller's audio, null until resolved
 * @param agentSourceRef live source of the agent's audio, null until resolved
 * @param recognitionSessionId session id assigned by the recognition service, null before the
 *     first session started
 * @param workUnitSequence 0 for the first work unit of the call, incremented on every hand-off
 * @param lastCallerFragment last caller fragment already processed, null to start at "now"
 * @param lastAgentFragment last agent fragment already processed, null to start at "now"
 * @param fromNumber calling party number
 * @param toNumber called party number
 * @param agentId agent handling the call, may be null
 * @param metadataJson opaque metadata forwarded on the START event
 * @param recordingEnabled whether raw audio is archived for this call
 */
public record CallSession(
    String callId,
    String callerSourceRef,
    String agentSourceRef,
    String recognitionSessionId,
    int workUnitSequence,
    String lastCallerFragment,
    String lastAgentFragment,
    String fromNumber,
    String toNumber,
    String agentId,
    String metadataJson,
    boolean recordingEnabled) {

  /** A brand-new call, before sources are resolved and before any work unit ran. */
  public static CallSession newCall(
      String callId,
      String callerSourceRef,
      String agentSourceRef,
      String fromNumber,
      String toNumber,
      String agentId,
      String metadataJson) {
    return new CallSession(
        callId,
        callerSourceRef,
        agentSourceRef,
        null,
        0,
        null,
        null,
        fromNumber,
        toNumber,
        agentId,
        metadataJson,
        true);
  }

  @JsonIgnore
  public boolean isFirstWorkUnit() {
    return workUnitSequence == 0;
  }

  @JsonIgnore
  public boolean hasBothSources() {
    return callerSourceRef != null && agentSourceRef != null;
  }

  /** Both parties arrive as separate tracks of one physical source. */
  @JsonIgnore
  public boolean isSharedSource() {
    return hasBothSources() && callerSourceRef.equals(agentSourceRef);
  }

  public String sourceRef(ChannelRole role) {
    return role == ChannelRole.CALLER ? callerSourceRef : agentSourceRef;
  }

  public String lastFragment(ChannelRole role) {
    return role == ChannelRole.CALLER ? lastCallerFragment : lastAgentFragment;
  }

  public CallSession withSources(String callerRef, String agentRef) {
    return new CallSession(
        callId,
        callerRef,
        agentRef,
        recognitionSessionId,
        workUnitSequence,
        lastCallerFragment,
        lastAgentFragment,
        fromNumber,
        toNumber,
        agentId,
        metadataJson,
        recordingEnabled);
  }

  public CallSession withCallId(String newCallId) {
    return new CallSession(
        newCallId,
        callerSourceRef,
        agentSourceRef,
        recognitionSessionId,
        workUnitSequence,
        lastCallerFragment,
        lastAgentFragment,
        fromNumber,
        toNumber,
        agentId,
        metadataJson,
        recordingEnabled);
  }

  public CallSession withParticipants(
      String newFromNumber, String newToNumber, String newAgentId, String newMetadataJson) {
    return new CallSession(
        callId,
        callerSourceRef,
        agentSourceRef,
        recognitionSessionId,
        workUnitSequence,
        lastCallerFragment,
        lastAgentFragment,
        newFromNumber,
        newToNumber,
        newAgentId,
        newMetadataJson,
        recordingEnabled);
  }

  public CallSession withRecordingEnabled(boolean enabled) {
    return new CallSession(
        callId,
        callerSourceRef,
        agentSourceRef,
        recognitionSessionId,
        workUnitSequence,
        lastCallerFragment,
        lastAgentFragment,
        fromNumber,
        toNumber,
        agentId,
        metadataJson,
        enabled);
  }

  /** The checkpoint the next work unit starts from. */
  public CallSession successor(String callerFragment, String agentFragment, String sessionId) {
    return new CallSession(
        callId,
        callerSourceRef,
        agentSourceRef,
        sessionId,
        workUnitSequence + 1,
        callerFragment,
        agentFragment,
        fromNumber,
        toNumber,
        agentId,
        metadataJson,
        recordingEnabled);
  }
}
