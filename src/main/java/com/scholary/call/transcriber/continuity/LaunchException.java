package com.scholary.call.transcriber.continuity;

/** Thrown when a successor work unit cannot be started. */
public class LaunchException extends RuntimeException {

  public LaunchException(String message) {
    super(message);
  }

  public LaunchException(String message, Throwable cause) {
    super(message, cause);
  }
}
