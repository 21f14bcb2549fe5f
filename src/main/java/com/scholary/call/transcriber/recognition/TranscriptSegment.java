package com.scholary.call.transcriber.recognition;

import com.scholary.call.transcriber.audio.ChannelRole;

/**
 * A transcript result from a channel-identified session.
 *
 * @param channelId service channel label, {@code ch_0} for the caller
 * @param startTime seconds from session start
 * @param endTime seconds from session start
 * @param transcript best alternative
 * @param partial true for interim results that a later result will replace
 */
public record TranscriptSegment(
    String channelId, double startTime, double endTime, String transcript, boolean partial)
    implements RecognitionResult {

  public static final String CALLER_CHANNEL_ID = "ch_0";

  /** Stable across partial and final versions of the same segment. */
  public String segmentId() {
    return channelId + "-" + startTime;
  }

  public ChannelRole role() {
    return CALLER_CHANNEL_ID.equals(channelId) ? ChannelRole.CALLER : ChannelRole.AGENT;
  }
}
