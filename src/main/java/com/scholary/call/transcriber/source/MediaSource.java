package com.scholary.call.transcriber.source;

import java.io.InputStream;

/** A live, resumable media stream per call party. */
public interface MediaSource {

  /**
   * Open the live stream.
   *
   * @param sourceRef identifier of the source, e.g. a stream ARN
   * @param resumeAfterFragment start after this fragment, or null to start at the live edge
   * @return the container byte stream; the caller closes it
   * @throws MediaSourceException if the stream cannot be opened
   */
  InputStream open(String sourceRef, String resumeAfterFragment);
}
