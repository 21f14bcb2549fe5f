package com.scholary.call.transcriber.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.call.transcriber.continuity.CallSession;
import com.scholary.call.transcriber.recognition.CategoryMatch;
import com.scholary.call.transcriber.recognition.TranscriptSegment;
import com.scholary.call.transcriber.recognition.Utterance;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns recognition results and lifecycle changes into event-log records.
 *
 * <p>Records are JSON objects with PascalCase keys; every record carries {@code CallId},
 * {@code EventType} and {@code CreatedAt}. Delivery is best-effort: a failed write is logged and
 * dropped, and never reaches the caller.
 *
 * <p>Stateless and thread-safe.
 */
@Service
public class EventSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventSink.class);

  private final EventLog eventLog;
  private final ObjectMapper objectMapper;
  private final EventLogProperties properties;
  private final Clock clock;

  public EventSink(
      EventLog eventLog, ObjectMapper objectMapper, EventLogProperties properties, Clock clock) {
    this.eventLog = eventLog;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  /** Forward a channel-identified transcript segment. Empty and suppressed partials are dropped. */
  public void transcriptSegment(String callId, TranscriptSegment segment) {
    if (skip(segment.transcript(), segment.partial())) {
      return;
    }
    Map<String, Object> record = newRecord(callId, CallEventType.ADD_TRANSCRIPT_SEGMENT);
    record.put("Channel", segment.role().name());
    record.put("SegmentId", segment.segmentId());
    record.put("StartTime", segment.startTime());
    record.put("EndTime", segment.endTime());
    record.put("Transcript", segment.transcript());
    record.put("IsPartial", segment.partial());
    append(callId, record);
  }

  /** Forward a call-analytics utterance. Empty and suppressed partials are dropped. */
  public void utterance(String callId, Utterance utterance) {
    if (skip(utterance.transcript(), utterance.partial())) {
      return;
    }
    Map<String, Object> record = newRecord(callId, CallEventType.ADD_TRANSCRIPT_SEGMENT);
    record.put("Channel", utterance.participantRole());
    record.put("SegmentId", utterance.utteranceId());
    record.put("StartTime", utterance.beginOffsetMillis() / 1000.0);
    record.put("EndTime", utterance.endOffsetMillis() / 1000.0);
    record.put("Transcript", utterance.transcript());
    record.put("IsPartial", utterance.partial());
    if (utterance.sentiment() != null) {
      record.put("Sentiment", utterance.sentiment());
    }
    append(callId, record);
  }

  public void categoryMatch(String callId, CategoryMatch match) {
    List<Map<String, Object>> ranges = new ArrayList<>();
    for (CategoryMatch.OffsetRange range : match.ranges()) {
      Map<String, Object> timestampRange = new LinkedHashMap<>();
      timestampRange.put("BeginOffsetMillis", range.beginOffsetMillis());
      timestampRange.put("EndOffsetMillis", range.endOffsetMillis());
      ranges.add(timestampRange);
    }
    Map<String, Object> categoryEvent = new LinkedHashMap<>();
    categoryEvent.put("MatchedCategories", List.of(match.category()));
    categoryEvent.put(
        "MatchedDetails", Map.of(match.category(), Map.of("TimestampRanges", ranges)));

    Map<String, Object> record = newRecord(callId, CallEventType.ADD_CALL_CATEGORY);
    record.put("CategoryEvent", categoryEvent);
    append(callId, record);
  }

  public void callStarted(CallSession session) {
    Map<String, Object> record = newRecord(session.callId(), CallEventType.START);
    record.put("CustomerPhoneNumber", session.fromNumber());
    record.put("SystemPhoneNumber", session.toNumber());
    record.put("AgentId", session.agentId());
    record.put("Metadatajson", session.metadataJson());
    append(session.callId(), record);
  }

  /** Only written when continue events are enabled; hand-offs are otherwise invisible. */
  public void callContinued(CallSession session) {
    if (!properties.emitContinueEvents()) {
      return;
    }
    Map<String, Object> record = newRecord(session.callId(), CallEventType.CONTINUE);
    record.put("WorkUnitSequence", session.workUnitSequence());
    append(session.callId(), record);
  }

  /** Carries the same party identifiers as the start record so consumers can close the call. */
  public void callEnded(CallSession session) {
    Map<String, Object> record = newRecord(session.callId(), CallEventType.END);
    record.put("CustomerPhoneNumber", session.fromNumber());
    record.put("SystemPhoneNumber", session.toNumber());
    record.put("AgentId", session.agentId());
    append(session.callId(), record);
  }

  public void callFailed(String callId, String errorMessage) {
    Map<String, Object> record = newRecord(callId, CallEventType.ERROR);
    record.put("ErrorMessage", errorMessage);
    append(callId, record);
  }

  public void recordingUrl(String callId, String url) {
    Map<String, Object> record = newRecord(callId, CallEventType.ADD_S3_RECORDING_URL);
    record.put("RecordingUrl", url);
    append(callId, record);
  }

  private boolean skip(String transcript, boolean partial) {
    if (transcript == null || transcript.isEmpty()) {
      return true;
    }
    return partial && !properties.savePartialTranscripts();
  }

  private Map<String, Object> newRecord(String callId, CallEventType type) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("EventType", type.name());
    record.put("CallId", callId);
    record.put("CreatedAt", Instant.now(clock).toString());
    return record;
  }

  private void append(String callId, Map<String, Object> record) {
    try {
      eventLog.append(callId, objectMapper.writeValueAsBytes(record));
      LOGGER.debug("Wrote {} event for call {}", record.get("EventType"), callId);
    } catch (Exception e) {
      LOGGER.error("Failed to write {} event for call {}", record.get("EventType"), callId, e);
    }
  }
}
