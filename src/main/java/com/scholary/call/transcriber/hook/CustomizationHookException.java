package com.scholary.call.transcriber.hook;

/** Thrown when the customization hook cannot be invoked or reports a failure. */
public class CustomizationHookException extends RuntimeException {

  public CustomizationHookException(String message) {
    super(message);
  }

  public CustomizationHookException(String message, Throwable cause) {
    super(message, cause);
  }
}
