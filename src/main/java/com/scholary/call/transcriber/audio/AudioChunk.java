package com.scholary.call.transcriber.audio;

/**
 * A block of 16-bit little-endian mono PCM for one channel.
 *
 * <p>The payload array is handed over on construction and must not be modified afterwards.
 *
 * @param role the channel the samples belong to
 * @param timestampMillis presentation time of the first sample, in milliseconds
 * @param payload raw PCM samples
 * @param fragmentNumber fragment the samples were read from, or null for synthesized silence
 */
public record AudioChunk(
    ChannelRole role, long timestampMillis, byte[] payload, String fragmentNumber) {

  public static AudioChunk silence(ChannelRole role, long timestampMillis, int bytes) {
    return new AudioChunk(role, timestampMillis, new byte[bytes], null);
  }

  public int size() {
    return payload.length;
  }
}
