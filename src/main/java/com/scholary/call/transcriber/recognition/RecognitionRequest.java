package com.scholary.call.transcriber.recognition;

import java.util.concurrent.Executor;

/**
 * What a session start needs to know about the call.
 *
 * @param callId the call being transcribed
 * @param resumeSessionId session id of the previous work unit, or null for a new session
 * @param audioExecutor runs the loop that pushes audio to the session; owned by the work unit
 */
public record RecognitionRequest(String callId, String resumeSessionId, Executor audioExecutor) {}
