package com.scholary.call.transcriber.recognition;

/** Exception thrown when a recognition session cannot be started. */
public class RecognitionException extends RuntimeException {

  public RecognitionException(String message) {
    super(message);
  }

  public RecognitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
