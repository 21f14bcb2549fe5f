package com.scholary.call.transcriber.api;

import com.scholary.call.transcriber.continuity.CallSession;
import com.scholary.call.transcriber.continuity.ContinuityController;
import com.scholary.call.transcriber.continuity.LaunchException;
import com.scholary.call.transcriber.continuity.WorkUnitContext;
import com.scholary.call.transcriber.registry.WorkUnitRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for live call processing.
 *
 * <p>Work units run asynchronously: starting a call or handing over a checkpoint answers 202 with
 * the work unit id, and the call's progress is polled through the status endpoint.
 */
@RestController
@RequestMapping("/api/calls")
@Tag(name = "Calls", description = "Live call transcription")
public class CallController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CallController.class);

  private final ContinuityController continuityController;
  private final WorkUnitRegistry registry;
  private final RequestVerifier requestVerifier;

  public CallController(
      ContinuityController continuityController,
      WorkUnitRegistry registry,
      RequestVerifier requestVerifier) {
    this.continuityController = continuityController;
    this.registry = registry;
    this.requestVerifier = requestVerifier;
  }

  @PostMapping
  @Operation(
      summary = "Start processing a call",
      description =
          "Starts the first work unit of a live call. Sources that are not given are looked up "
              + "in the source registry. Returns 409 if the call is already being processed.")
  public ResponseEntity<WorkUnitResponse> startCall(
      @RequestHeader HttpHeaders headers, @Valid @RequestBody CallStartRequest request) {
    if (!requestVerifier.verify(headers)) {
      LOGGER.warn("Rejected unverified start request for call {}", request.callId());
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
    }
    LOGGER.info(
        "Start request: callId={}, callerSource={}, agentSource={}",
        request.callId(),
        request.callerSourceRef(),
        request.agentSourceRef());

    CallSession session =
        CallSession.newCall(
            request.callId(),
            request.callerSourceRef(),
            request.agentSourceRef(),
            request.fromNumber(),
            request.toNumber(),
            request.agentId(),
            request.metadataJson());
    return submit(session);
  }

  @PostMapping("/{callId}/continuations")
  @Operation(
      summary = "Continue a call from a checkpoint",
      description =
          "Starts the successor work unit of a call from the checkpoint handed over by its "
              + "predecessor.")
  public ResponseEntity<WorkUnitResponse> continueCall(
      @RequestHeader HttpHeaders headers,
      @PathVariable String callId,
      @RequestBody CallSession checkpoint) {
    if (!requestVerifier.verify(headers)) {
      LOGGER.warn("Rejected unverified continuation for call {}", callId);
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
    }
    if (!callId.equals(checkpoint.callId())) {
      LOGGER.warn("Checkpoint for call {} posted to call {}", checkpoint.callId(), callId);
      return ResponseEntity.badRequest().build();
    }
    LOGGER.info(
        "Continuation request: callId={}, sequence={}, sessionId={}",
        callId,
        checkpoint.workUnitSequence(),
        checkpoint.recognitionSessionId());
    return submit(checkpoint);
  }

  @GetMapping("/{callId}")
  @Operation(
      summary = "Get call status",
      description = "Latest work unit state, fragment markers and recognition session of a call")
  public ResponseEntity<CallStatusResponse> getCallStatus(@PathVariable String callId) {
    return registry
        .findByCallId(callId)
        .map(status -> ResponseEntity.ok(CallStatusResponse.from(status)))
        .orElse(ResponseEntity.notFound().build());
  }

  private ResponseEntity<WorkUnitResponse> submit(CallSession session) {
    Optional<String> workUnitId;
    try {
      workUnitId = continuityController.submit(session);
    } catch (LaunchException e) {
      LOGGER.error("Failed to queue work unit {}", WorkUnitContext.workUnitId(session), e);
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
    return workUnitId
        .map(
            id ->
                ResponseEntity.accepted()
                    .body(
                        new WorkUnitResponse(session.callId(), id, session.workUnitSequence())))
        .orElse(ResponseEntity.status(HttpStatus.CONFLICT).build());
  }
}
