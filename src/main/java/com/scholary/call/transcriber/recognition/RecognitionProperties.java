package com.scholary.call.transcriber.recognition;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the streaming recognition session.
 *
 * <p>Covers the service mode and language, the start retry policy, the size of the audio pipe and
 * the optional redaction, vocabulary and post-call analytics settings.
 */
@ConfigurationProperties(prefix = "recognition")
@Validated
public record RecognitionProperties(
    @NotNull Mode mode,
    @NotBlank String languageCode,
    String endpoint,
    @Positive int startAttempts,
    @NotNull Duration startBackoff,
    @NotNull Duration startTimeout,
    @NotNull Duration completionTimeout,
    @Positive int audioPipeCapacity,
    @Valid @NotNull ContentRedaction contentRedaction,
    String vocabularyName,
    String languageModelName,
    @Valid @NotNull PostCallAnalytics postCallAnalytics) {

  private static final Set<String> REDACTION_LANGUAGES = Set.of("en-US", "en-AU", "en-GB", "es-US");

  public enum Mode {
    /** Plain transcription with channel identification. */
    STANDARD,
    /** Call analytics: utterances, categories and optional post-call analytics. */
    ANALYTICS
  }

  public record ContentRedaction(boolean enabled, String piiEntityTypes) {}

  public record PostCallAnalytics(
      boolean enabled, String outputLocation, String dataAccessRoleArn, String redactionOutput) {}

  /** Redaction is only requested for languages the service can redact. */
  public boolean redactionApplies() {
    return contentRedaction.enabled() && REDACTION_LANGUAGES.contains(languageCode);
  }
}
