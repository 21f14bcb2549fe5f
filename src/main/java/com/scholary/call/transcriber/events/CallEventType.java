package com.scholary.call.transcriber.events;

/** Values of the {@code EventType} field of event-log records. */
public enum CallEventType {
  START,
  CONTINUE,
  END,
  ERROR,
  ADD_TRANSCRIPT_SEGMENT,
  ADD_CALL_CATEGORY,
  ADD_S3_RECORDING_URL
}
