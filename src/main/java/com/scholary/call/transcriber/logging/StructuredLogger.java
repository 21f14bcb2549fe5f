package com.scholary.call.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts an {@code event_type} and its fields into the MDC for the duration of a
 * single log statement, so log shippers can index pipeline milestones without parsing messages.
 * Call-level context ({@code callId}, {@code workUnit}, {@code sequence}) is set once per work
 * unit with {@link #setCallContext}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a work-unit state transition. */
  public void logStateTransition(String workUnitId, String from, String to) {
    try {
      MDC.put("event_type", "work_unit_state");
      MDC.put("fromState", from);
      MDC.put("toState", to);

      logger.info("Work unit {} state: {} -> {}", workUnitId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log a new fragment seen by a demuxer. */
  public void logFragmentAdvanced(
      String channel, String fragmentNumber, String producerTimestamp, boolean suppressed) {
    try {
      MDC.put("event_type", "fragment_advanced");
      MDC.put("channel", channel);
      MDC.put("fragmentNumber", fragmentNumber);
      MDC.put("producerTimestamp", String.valueOf(producerTimestamp));
      MDC.put("suppressed", String.valueOf(suppressed));

      logger.debug(
          "Fragment advanced: channel={}, fragment={}, producerTimestamp={}, suppressed={}",
          channel,
          fragmentNumber,
          producerTimestamp,
          suppressed);
    } finally {
      clearEventFields();
    }
  }

  /** Log a container element that could not be decoded and was skipped. */
  public void logDecodeError(String channel, long position, String message) {
    try {
      MDC.put("event_type", "decode_error");
      MDC.put("channel", channel);
      MDC.put("position", String.valueOf(position));

      logger.warn(
          "Skipping malformed element: channel={}, position={}, error={}",
          channel,
          position,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a recognition session start retry. */
  public void logSessionStartRetry(
      int attempt, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "session_start_retry");
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Recognition session start retry: attempt={}/{}, error={}, message={}",
          attempt,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a recognition session start that exhausted its retries. */
  public void logSessionStartFailed(int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "session_start_failed");
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.error(
          "Recognition session start failed: maxAttempts={}, error={}, message={}",
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the hand-off to a successor work unit. */
  public void logContinuationLaunched(
      int nextSequence, String sessionId, String callerFragment, String agentFragment) {
    try {
      MDC.put("event_type", "continuation_launched");
      MDC.put("nextSequence", String.valueOf(nextSequence));
      MDC.put("recognitionSessionId", String.valueOf(sessionId));
      MDC.put("callerFragment", String.valueOf(callerFragment));
      MDC.put("agentFragment", String.valueOf(agentFragment));

      logger.info(
          "Continuation launched: nextSequence={}, sessionId={}, callerFragment={},"
              + " agentFragment={}",
          nextSequence,
          sessionId,
          callerFragment,
          agentFragment);
    } finally {
      clearEventFields();
    }
  }

  /** Log a call that hit the work-unit iteration cap. */
  public void logRunawayCap(int sequence, int maxWorkUnits) {
    try {
      MDC.put("event_type", "runaway_cap");
      MDC.put("maxWorkUnits", String.valueOf(maxWorkUnits));

      logger.error(
          "Work unit sequence {} exceeds the cap of {}, not processing or relaunching",
          sequence,
          maxWorkUnits);
    } finally {
      clearEventFields();
    }
  }

  /** Log a raw audio segment upload. */
  public void logRecordingUploaded(String key, long bytes) {
    try {
      MDC.put("event_type", "recording_uploaded");
      MDC.put("objectKey", key);
      MDC.put("bytes", String.valueOf(bytes));

      logger.info("Raw recording uploaded: key={}, bytes={}", key, bytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log a merged recording. */
  public void logRecordingMerged(String key, int parts, long bytes) {
    try {
      MDC.put("event_type", "recording_merged");
      MDC.put("objectKey", key);
      MDC.put("parts", String.valueOf(parts));
      MDC.put("bytes", String.valueOf(bytes));

      logger.info("Recording merged: key={}, parts={}, bytes={}", key, parts, bytes);
    } finally {
      clearEventFields();
    }
  }

  /** Set call context in MDC. */
  public static void setCallContext(String callId, String workUnitId, int sequence) {
    MDC.put("callId", callId);
    MDC.put("workUnit", workUnitId);
    MDC.put("sequence", String.valueOf(sequence));
  }

  /** Clear call context from MDC. */
  public static void clearCallContext() {
    MDC.remove("callId");
    MDC.remove("workUnit");
    MDC.remove("sequence");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromState");
    MDC.remove("toState");
    MDC.remove("channel");
    MDC.remove("fragmentNumber");
    MDC.remove("producerTimestamp");
    MDC.remove("suppressed");
    MDC.remove("position");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("errorType");
    MDC.remove("nextSequence");
    MDC.remove("recognitionSessionId");
    MDC.remove("callerFragment");
    MDC.remove("agentFragment");
    MDC.remove("maxWorkUnits");
    MDC.remove("objectKey");
    MDC.remove("parts");
    MDC.remove("bytes");
  }
}
