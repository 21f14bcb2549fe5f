package com.scholary.call.transcriber.source;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for live media sources and their registration lookup.
 *
 * <p>{@code sourceTable} may be empty when every call arrives with both sources already known.
 */
@ConfigurationProperties(prefix = "mediasource")
@Validated
public record MediaSourceProperties(
    String sourceTable, @Positive int lookupAttempts, @NotNull Duration lookupBackoff) {

  public boolean hasSourceTable() {
    return sourceTable != null && !sourceTable.isBlank();
  }
}
