package com.scholary.call.transcriber.sync;

import com.scholary.call.transcriber.audio.AudioChunk;
import com.scholary.call.transcriber.audio.ChannelBuffer;
import com.scholary.call.transcriber.audio.InterleavedFrame;
import com.scholary.call.transcriber.audio.PcmFormat;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns the caller and agent channels on a common time axis and interleaves them.
 *
 * <p>Every {@link #flush()} drains both channel buffers and lays each channel's chunks into a
 * silence-filled mono buffer, at the offset of its first timestamp from the earliest timestamp of
 * either channel. The two mono buffers are then interleaved sample by sample (caller left, agent
 * right) and cut into frames of exactly one period. Audio that does not fill a whole period is
 * carried into the next flush. A flush that produces no full frame still emits one frame, padded
 * with silence, so the downstream session and recording keep their cadence when both parties are
 * silent.
 *
 * <p>While the sink reports it is backed up a tick emits nothing and leaves the chunks in the
 * channel buffers. Once they are full the demuxers block on them and stop reading their sources,
 * and the held audio goes out as a backlog on the first tick after the sink catches up.
 *
 * <p>Called from a single scheduler thread.
 */
public class ChannelSynchronizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelSynchronizer.class);

  private final ChannelBuffer caller;
  private final ChannelBuffer agent;
  private final PcmFormat format;
  private final FrameSink sink;
  private final int frameBytes;
  private final long periodMillis;
  private final long maxSkewMillis;

  private byte[] carry = new byte[0];
  private long framesEmitted;
  private long silentFrames;
  private long deferredTicks;

  public ChannelSynchronizer(
      ChannelBuffer caller,
      ChannelBuffer agent,
      PcmFormat format,
      Duration period,
      Duration maxSkew,
      FrameSink sink) {
    this.caller = caller;
    this.agent = agent;
    this.format = format;
    this.sink = sink;
    this.periodMillis = period.toMillis();
    this.frameBytes = format.stereoBytes(periodMillis);
    this.maxSkewMillis = maxSkew.toMillis();
    if (frameBytes == 0) {
      throw new IllegalArgumentException("Interleave period is shorter than one sample: " + period);
    }
  }

  /** Drain both channels and emit at least one frame, unless the sink is backed up. */
  public void flush() {
    if (sink.isBackedUp()) {
      if (deferredTicks++ == 0) {
        LOGGER.warn("Frame sink is backed up, holding audio in the channel buffers");
      }
      return;
    }
    emitBuffered();
  }

  private void emitBuffered() {
    List<AudioChunk> callerChunks = caller.drain();
    List<AudioChunk> agentChunks = agent.drain();

    byte[] aligned = align(callerChunks, agentChunks);
    byte[] pending = concat(carry, aligned);

    int offset = 0;
    int emitted = 0;
    while (pending.length - offset >= frameBytes) {
      emit(Arrays.copyOfRange(pending, offset, offset + frameBytes));
      offset += frameBytes;
      emitted++;
    }

    if (emitted == 0) {
      // Nothing filled a whole period: pad what there is and keep the cadence
      if (pending.length == 0) {
        silentFrames++;
      }
      emit(Arrays.copyOf(pending, frameBytes));
      carry = new byte[0];
    } else {
      carry = Arrays.copyOfRange(pending, offset, pending.length);
    }
  }

  /** Flush once more and pad out any carried remainder. Called when the work unit winds down. */
  public void flushRemaining() {
    emitBuffered();
    if (carry.length > 0) {
      emit(Arrays.copyOf(carry, frameBytes));
      carry = new byte[0];
    }
    LOGGER.info(
        "Synchronizer drained: frames={}, silentFrames={}, deferredTicks={}, period={}ms",
        framesEmitted,
        silentFrames,
        deferredTicks,
        periodMillis);
  }

  public long framesEmitted() {
    return framesEmitted;
  }

  public long deferredTicks() {
    return deferredTicks;
  }

  /**
   * Lay both channels onto one time axis and interleave them.
   *
   * @return interleaved stereo bytes, empty when neither channel had data
   */
  byte[] align(List<AudioChunk> callerChunks, List<AudioChunk> agentChunks) {
    if (callerChunks.isEmpty() && agentChunks.isEmpty()) {
      return new byte[0];
    }

    long start = Long.MAX_VALUE;
    if (!callerChunks.isEmpty()) {
      start = Math.min(start, callerChunks.get(0).timestampMillis());
    }
    if (!agentChunks.isEmpty()) {
      start = Math.min(start, agentChunks.get(0).timestampMillis());
    }

    byte[] callerData = concatPayloads(callerChunks);
    byte[] agentData = concatPayloads(agentChunks);
    int callerOffset = offsetBytes(callerChunks, start);
    int agentOffset = offsetBytes(agentChunks, start);

    int monoLength =
        Math.max(callerOffset + callerData.length, agentOffset + agentData.length);
    monoLength -= monoLength % PcmFormat.BYTES_PER_SAMPLE;

    byte[] left = new byte[monoLength];
    byte[] right = new byte[monoLength];
    copyInto(callerData, left, callerOffset);
    copyInto(agentData, right, agentOffset);

    byte[] interleaved = new byte[monoLength * PcmFormat.CHANNELS];
    for (int i = 0, out = 0; i < monoLength; i += PcmFormat.BYTES_PER_SAMPLE, out += 4) {
      interleaved[out] = left[i];
      interleaved[out + 1] = left[i + 1];
      interleaved[out + 2] = right[i];
      interleaved[out + 3] = right[i + 1];
    }
    return interleaved;
  }

  private int offsetBytes(List<AudioChunk> chunks, long start) {
    if (chunks.isEmpty()) {
      return 0;
    }
    long skew = chunks.get(0).timestampMillis() - start;
    if (skew > maxSkewMillis) {
      LOGGER.warn(
          "Channel {} is {}ms behind the other, clamping to {}ms",
          chunks.get(0).role(),
          skew,
          maxSkewMillis);
      skew = maxSkewMillis;
    }
    return format.monoBytes(skew);
  }

  private void emit(byte[] pcm) {
    sink.accept(new InterleavedFrame(framesEmitted++, pcm, format.stereoMillis(pcm.length)));
  }

  private static void copyInto(byte[] source, byte[] target, int offset) {
    int length = Math.min(source.length, target.length - offset);
    if (length > 0) {
      System.arraycopy(source, 0, target, offset, length);
    }
  }

  private static byte[] concatPayloads(List<AudioChunk> chunks) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (AudioChunk chunk : chunks) {
      out.writeBytes(chunk.payload());
    }
    return out.toByteArray();
  }

  private static byte[] concat(byte[] a, byte[] b) {
    if (a.length == 0) {
      return b;
    }
    byte[] joined = Arrays.copyOf(a, a.length + b.length);
    System.arraycopy(b, 0, joined, a.length, b.length);
    return joined;
  }
}
