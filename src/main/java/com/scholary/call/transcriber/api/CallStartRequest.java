package com.scholary.call.transcriber.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to start processing a live call.
 *
 * <p>Source references are optional; missing ones are looked up in the source registry.
 */
public record CallStartRequest(
    @NotBlank String callId,
    String callerSourceRef,
    String agentSourceRef,
    String fromNumber,
    String toNumber,
    String agentId,
    String metadataJson) {}
