package com.scholary.call.transcriber.demux;

import com.scholary.call.transcriber.audio.ChannelRole;

/**
 * How a demuxer run ended.
 *
 * @param role the channel the demuxer was extracting
 * @param lastFragment last fragment whose audio was delivered, or the resume marker it started
 *     from when nothing new was read
 * @param chunksEmitted audio chunks written to channel buffers
 * @param chunksSuppressed chunks dropped because they belong to an already-processed fragment
 * @param decodeErrors malformed elements that were skipped
 * @param endReason why reading stopped
 */
public record DemuxResult(
    ChannelRole role,
    String lastFragment,
    long chunksEmitted,
    long chunksSuppressed,
    long decodeErrors,
    EndReason endReason) {

  public enum EndReason {
    /** The source closed the stream. */
    END_OF_STREAM,
    /** No data arrived within the inactivity window. */
    INACTIVITY,
    /** The work unit asked to stop at a fragment boundary. */
    STOP_REQUESTED,
    /** The source failed with an I/O error. */
    SOURCE_ERROR
  }
}
