package com.scholary.call.transcriber.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Recording uploads and merges are best-effort, so callers in the pipeline catch this and log
 * it rather than failing the call.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
