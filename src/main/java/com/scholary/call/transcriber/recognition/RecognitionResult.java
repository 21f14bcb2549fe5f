package com.scholary.call.transcriber.recognition;

/**
 * One unit of output from a recognition session.
 *
 * <p>Implemented by {@link TranscriptSegment}, {@link Utterance} and {@link CategoryMatch}.
 */
public interface RecognitionResult {}
