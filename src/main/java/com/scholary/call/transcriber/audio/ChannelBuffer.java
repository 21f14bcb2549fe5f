package com.scholary.call.transcriber.audio;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue of audio chunks for one channel.
 *
 * <p>Single writer (the demuxer, or the keep-alive injector while the channel is idle) and single
 * reader (the synchronizer). The demuxer blocks when the buffer is full; the reader only ever
 * drains, so it never waits on the writer.
 */
public class ChannelBuffer {

  private final ChannelRole role;
  private final PcmFormat format;
  private final BlockingQueue<AudioChunk> queue;

  private final AtomicLong lastWriteNanos = new AtomicLong(System.nanoTime());
  private final AtomicLong nextTimestampMillis = new AtomicLong(-1);
  private final AtomicLong chunksWritten = new AtomicLong();

  public ChannelBuffer(ChannelRole role, PcmFormat format, int capacity) {
    this.role = role;
    this.format = format;
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  public ChannelRole role() {
    return role;
  }

  /**
   * Append a chunk, waiting for space if the buffer is full.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void put(AudioChunk chunk) throws InterruptedException {
    queue.put(chunk);
    recordWrite(chunk);
  }

  /**
   * Append a chunk only if there is room right now.
   *
   * @return false if the buffer was full
   */
  public boolean offer(AudioChunk chunk) {
    if (!queue.offer(chunk)) {
      return false;
    }
    recordWrite(chunk);
    return true;
  }

  /** Remove and return everything buffered since the last drain, in arrival order. */
  public List<AudioChunk> drain() {
    List<AudioChunk> chunks = new ArrayList<>(queue.size());
    queue.drainTo(chunks);
    return chunks;
  }

  /** Time since the last chunk was written. */
  public Duration idleTime() {
    return Duration.ofNanos(System.nanoTime() - lastWriteNanos.get());
  }

  /** Timestamp right after the last written chunk, or -1 if nothing was written yet. */
  public long nextTimestampMillis() {
    return nextTimestampMillis.get();
  }

  public long chunksWritten() {
    return chunksWritten.get();
  }

  public int size() {
    return queue.size();
  }

  private void recordWrite(AudioChunk chunk) {
    lastWriteNanos.set(System.nanoTime());
    nextTimestampMillis.set(chunk.timestampMillis() + format.monoMillis(chunk.size()));
    chunksWritten.incrementAndGet();
  }
}
