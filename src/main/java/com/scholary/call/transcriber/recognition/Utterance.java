package com.scholary.call.transcriber.recognition;

/**
 * An utterance from a call-analytics session.
 *
 * @param utteranceId service-assigned id, shared by partial and final versions
 * @param participantRole AGENT or CUSTOMER
 * @param sentiment null unless the service scored the utterance
 */
public record Utterance(
    String utteranceId,
    String participantRole,
    long beginOffsetMillis,
    long endOffsetMillis,
    String transcript,
    boolean partial,
    String sentiment)
    implements RecognitionResult {}
