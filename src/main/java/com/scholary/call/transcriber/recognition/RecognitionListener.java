package com.scholary.call.transcriber.recognition;

/** Callbacks from a running recognition session, in the order the service delivers them. */
public interface RecognitionListener {

  void onResult(RecognitionResult result);

  /** The session failed after it had started. */
  void onError(Throwable error);

  void onComplete();
}
