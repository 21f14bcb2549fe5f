package com.scholary.call.transcriber.audio;

/**
 * A time-aligned two-channel PCM block, caller on the left and agent on the right.
 *
 * @param sequence position of the frame in the work unit's output, starting at 0
 * @param pcm interleaved samples
 * @param durationMillis audio time covered by the frame
 */
public record InterleavedFrame(long sequence, byte[] pcm, long durationMillis) {}
