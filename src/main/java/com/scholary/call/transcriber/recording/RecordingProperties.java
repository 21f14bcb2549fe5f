package com.scholary.call.transcriber.recording;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for call recordings.
 *
 * <p>Raw per-work-unit segments and the merged recording live in the object store bucket, under
 * separate key prefixes.
 */
@ConfigurationProperties(prefix = "recording")
@Validated
public record RecordingProperties(
    boolean enabled, @NotBlank String rawPrefix, @NotBlank String recordingPrefix) {

  public String rawKey(String callId, int workUnitSequence) {
    return rawPrefix + callId + "-" + workUnitSequence + ".raw";
  }

  public String recordingKey(String callId) {
    return recordingPrefix + callId + ".wav";
  }
}
