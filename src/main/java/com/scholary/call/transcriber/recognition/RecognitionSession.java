package com.scholary.call.transcriber.recognition;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a started recognition session.
 *
 * @param sessionId id assigned by the service, carried to successor work units
 * @param completion completes when the service has delivered its last result
 */
public record RecognitionSession(String sessionId, CompletableFuture<Void> completion) {}
