package com.scholary.call.transcriber.hook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.call.transcriber.continuity.CallSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answer of the customization hook. Every field is optional; null leaves the call unchanged.
 *
 * @param callId replacement call id
 * @param isCaller false swaps the caller and agent sources
 * @param metadatajson replacement metadata forwarded on the START event
 * @param shouldProcessCall false vetoes processing of the call
 * @param shouldRecordCall false disables the recording for this call
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HookResult(
    String callId,
    @JsonProperty("isCaller") Boolean isCaller,
    String agentId,
    String fromNumber,
    String toNumber,
    String metadatajson,
    Boolean shouldProcessCall,
    Boolean shouldRecordCall) {

  private static final Logger LOGGER = LoggerFactory.getLogger(HookResult.class);

  public static HookResult unchanged() {
    return new HookResult(null, null, null, null, null, null, null, null);
  }

  public boolean vetoed() {
    return Boolean.FALSE.equals(shouldProcessCall);
  }

  /** Apply the overrides. Must run before any source is opened. */
  public CallSession applyTo(CallSession call) {
    CallSession result = call;
    if (hasText(callId) && !callId.equals(call.callId())) {
      LOGGER.info("Hook renamed call {} to {}", call.callId(), callId);
      result = result.withCallId(callId);
    }
    if (Boolean.FALSE.equals(isCaller)) {
      LOGGER.info("Hook swapped caller and agent sources for call {}", result.callId());
      result = result.withSources(result.agentSourceRef(), result.callerSourceRef());
    }
    result =
        result.withParticipants(
            hasText(fromNumber) ? fromNumber : result.fromNumber(),
            hasText(toNumber) ? toNumber : result.toNumber(),
            hasText(agentId) ? agentId : result.agentId(),
            hasText(metadatajson) ? metadatajson : result.metadataJson());
    if (Boolean.FALSE.equals(shouldRecordCall)) {
      LOGGER.info("Hook disabled recording for call {}", result.callId());
      result = result.withRecordingEnabled(false);
    }
    return result;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isEmpty();
  }
}
