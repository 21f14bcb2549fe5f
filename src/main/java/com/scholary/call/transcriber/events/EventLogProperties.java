package com.scholary.call.transcriber.events;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the call event log.
 *
 * <p>{@code savePartialTranscripts=false} forwards only final transcript segments, which cuts
 * log volume several times over on chatty calls.
 */
@ConfigurationProperties(prefix = "eventlog")
@Validated
public record EventLogProperties(
    @NotBlank String streamName, boolean savePartialTranscripts, boolean emitContinueEvents) {}
