package com.scholary.call.transcriber.recognition;

/**
 * A streaming speech-to-text service.
 *
 * <p>Implementations open one session per call, pull audio from the pipe until it is finished,
 * and report results to the listener.
 */
public interface RecognitionService {

  /**
   * Start a session and wait until the service has accepted it.
   *
   * @throws RecognitionException if the service rejects or does not answer the start request
   */
  RecognitionSession start(
      RecognitionRequest request, AudioPipe audio, RecognitionListener listener);
}
