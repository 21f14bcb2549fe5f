package com.scholary.call.transcriber.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ingestion pipeline.
 *
 * <p>Controls the work-unit pool, the demuxers, the interleave cadence, keep-alive injection and
 * the time budget of each work unit.
 */
@ConfigurationProperties(prefix = "transcriber")
@Validated
public record TranscriberProperties(
    @NotBlank String tempDir,
    @Positive int workUnitThreads,
    @Positive int workUnitQueueSize,
    @Valid @NotNull Demux demux,
    @Valid @NotNull Sync sync,
    @Valid @NotNull KeepAlive keepAlive,
    @Valid @NotNull Continuity continuity) {

  public record Demux(
      @NotNull Duration inactivityTimeout,
      @NotBlank String callerTrackName,
      @NotBlank String agentTrackName,
      @Positive int channelBufferCapacity) {}

  public record Sync(
      @NotNull Duration period, @Positive int sampleRateHertz, @NotNull Duration maxSkew) {}

  public record KeepAlive(@NotNull Duration interval) {}

  public record Continuity(
      @NotNull Duration timeBudget,
      @NotNull Duration safetyMargin,
      @NotNull Duration drainTimeout,
      @Positive int maxWorkUnits,
      @NotNull LauncherType launcher,
      String functionArn) {

    /** How long a work unit streams before it starts handing off. */
    public Duration streamingWindow() {
      Duration window = timeBudget.minus(safetyMargin);
      return window.isNegative() ? Duration.ZERO : window;
    }
  }

  public enum LauncherType {
    /** Successors run on this instance's work-unit executor. */
    LOCAL,
    /** Successors are started as asynchronous Lambda invocations. */
    LAMBDA
  }
}
