package com.scholary.call.transcriber.objectstore;

import java.io.InputStream;

/**
 * Abstraction over the durable object store that holds call recordings.
 *
 * <p>Raw per-work-unit audio segments are written here, read back when a call completes, merged
 * into one playable file and then removed. Everything is streamed; a call recording can run to
 * hundreds of megabytes.
 */
public interface ObjectStoreClient {

  /**
   * Open an object for reading. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream of known length.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
