package com.scholary.call.transcriber.source;

/** Thrown when a live media source cannot be opened. */
public class MediaSourceException extends RuntimeException {

  public MediaSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
