package com.scholary.call.transcriber.source;

/** Thrown when the media sources of a call could not be resolved in time. */
public class SourceLookupException extends RuntimeException {

  public SourceLookupException(String message) {
    super(message);
  }

  public SourceLookupException(String message, Throwable cause) {
    super(message, cause);
  }
}
