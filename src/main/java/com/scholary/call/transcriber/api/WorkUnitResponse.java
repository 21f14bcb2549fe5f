package com.scholary.call.transcriber.api;

/** Returned when a work unit has been accepted. */
public record WorkUnitResponse(String callId, String workUnitId, int sequence) {}
