package com.scholary.call.transcriber.events;

/** Exception thrown when an event record cannot be written to the log. */
public class EventLogException extends RuntimeException {

  public EventLogException(String message, Throwable cause) {
    super(message, cause);
  }
}
