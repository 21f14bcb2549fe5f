package com.scholary.call.transcriber.recording;

import com.scholary.call.transcriber.audio.PcmFormat;
import com.scholary.call.transcriber.logging.StructuredLogger;
import com.scholary.call.transcriber.objectstore.ObjectStoreClient;
import com.scholary.call.transcriber.objectstore.ObjectStoreException;
import com.scholary.call.transcriber.objectstore.ObjectStoreProperties;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Archives the raw audio of each work unit and builds the final call recording.
 *
 * <p>Each work unit uploads its local raw segment as {@code {rawPrefix}{callId}-{n}.raw}. When the
 * call has really ended, the segments are streamed in sequence order behind a WAV header into
 * {@code {recordingPrefix}{callId}.wav} and the raw segments are removed.
 *
 * <p>Everything here is best-effort. Failures are logged and reported as an empty result; they
 * never fail the call. If the merge fails the raw segments stay in place.
 */
@Service
public class RecordingFinalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingFinalizer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String RAW_CONTENT_TYPE = "application/octet-stream";
  static final String WAV_CONTENT_TYPE = "audio/wav";

  private final ObjectStoreClient objectStore;
  private final ObjectStoreProperties objectStoreProperties;
  private final RecordingProperties properties;
  private final PcmFormat format;

  public RecordingFinalizer(
      ObjectStoreClient objectStore,
      ObjectStoreProperties objectStoreProperties,
      RecordingProperties properties,
      PcmFormat format) {
    this.objectStore = objectStore;
    this.objectStoreProperties = objectStoreProperties;
    this.properties = properties;
    this.format = format;
  }

  /**
   * Upload one work unit's raw segment and remove the local file.
   *
   * @return the object key, or empty if nothing was uploaded
   */
  public Optional<String> uploadSegment(String callId, int workUnitSequence, Path localFile) {
    String key = properties.rawKey(callId, workUnitSequence);
    try {
      if (!Files.exists(localFile)) {
        LOGGER.warn("No local recording segment at {}", localFile);
        return Optional.empty();
      }
      long size = Files.size(localFile);
      if (size == 0) {
        LOGGER.info("Recording segment {} is empty, skipping upload", localFile);
        Files.deleteIfExists(localFile);
        return Optional.empty();
      }
      try (InputStream data = Files.newInputStream(localFile)) {
        objectStore.putObject(objectStoreProperties.bucket(), key, data, size, RAW_CONTENT_TYPE);
      }
      STRUCTURED_LOGGER.logRecordingUploaded(key, size);
      Files.deleteIfExists(localFile);
      return Optional.of(key);

    } catch (IOException | ObjectStoreException e) {
      LOGGER.error(
          "Failed to upload recording segment: key={}, localFile={}", key, localFile, e);
      return Optional.empty();
    }
  }

  /**
   * Merge segments {@code 0..lastSequence} into the final recording.
   *
   * @return the recording URL, or empty if there was nothing to merge or the merge failed
   */
  public Optional<String> merge(String callId, int lastSequence) {
    String bucket = objectStoreProperties.bucket();
    List<String> parts = new ArrayList<>();
    long dataLength = 0;

    for (int sequence = 0; sequence <= lastSequence; sequence++) {
      String key = properties.rawKey(callId, sequence);
      try {
        dataLength += objectStore.getObjectMetadata(bucket, key).contentLength();
        parts.add(key);
      } catch (ObjectStoreException e) {
        LOGGER.warn("Recording segment {} is missing, merging without it", key);
      }
    }

    if (parts.isEmpty()) {
      LOGGER.warn("No recording segments found for call {}", callId);
      return Optional.empty();
    }

    String recordingKey = properties.recordingKey(callId);
    byte[] header = WavHeader.create(format, dataLength);
    PartEnumeration partStreams = new PartEnumeration(bucket, header, parts);
    try (InputStream merged = new SequenceInputStream(partStreams)) {
      try {
        objectStore.putObject(
            bucket, recordingKey, merged, header.length + dataLength, WAV_CONTENT_TYPE);
      } finally {
        // Closing the sequence must not open parts the upload never reached
        partStreams.stop();
      }
    } catch (IOException | ObjectStoreException e) {
      LOGGER.error(
          "Failed to merge {} recording segments into {}, segments are kept",
          parts.size(),
          recordingKey,
          e);
      return Optional.empty();
    }
    STRUCTURED_LOGGER.logRecordingMerged(recordingKey, parts.size(), header.length + dataLength);

    for (String part : parts) {
      try {
        objectStore.deleteObject(bucket, part);
      } catch (ObjectStoreException e) {
        LOGGER.warn("Failed to delete merged recording segment {}", part, e);
      }
    }
    return Optional.of(recordingUrl(callId));
  }

  public String recordingUrl(String callId) {
    return String.format(
        "https://%s.s3.%s.amazonaws.com/%s",
        objectStoreProperties.bucket(),
        objectStoreProperties.region(),
        properties.recordingKey(callId));
  }

  /** The header followed by each part, opened only when the previous one is exhausted. */
  private class PartEnumeration implements Enumeration<InputStream> {

    private final String bucket;
    private final Iterator<String> keys;
    private byte[] header;
    private boolean stopped;

    PartEnumeration(String bucket, byte[] header, List<String> keys) {
      this.bucket = bucket;
      this.header = header;
      this.keys = keys.iterator();
    }

    void stop() {
      stopped = true;
    }

    @Override
    public boolean hasMoreElements() {
      return !stopped && (header != null || keys.hasNext());
    }

    @Override
    public InputStream nextElement() {
      if (header != null) {
        InputStream stream = new ByteArrayInputStream(header);
        header = null;
        return stream;
      }
      if (!keys.hasNext()) {
        throw new NoSuchElementException();
      }
      return objectStore.getObjectStream(bucket, keys.next());
    }
  }
}
