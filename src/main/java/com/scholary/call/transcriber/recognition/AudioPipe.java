package com.scholary.call.transcriber.recognition;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the fan-out stage (producer) and the recognition session's audio push
 * loop (consumer).
 *
 * <p>Offers never wait: the producer runs on the interleave ticker and must keep its cadence.
 * Instead the producer checks {@link #isBackedUp()} before each tick and holds audio back in the
 * channel buffers while the pipe is above its high-water mark. The space above the mark absorbs
 * one full drain of the channel buffers; a frame that still does not fit is dropped for recognition
 * only and counted, the recording keeps it.
 *
 * <p>Closing the pipe marks the end of audio: the consumer drains what is left and then sees
 * {@link #isFinished()}. Abandoning the pipe (after the session failed) discards everything and
 * turns further offers into no-ops.
 */
public class AudioPipe {

  private final BlockingQueue<byte[]> queue;
  private final int highWaterMark;
  private final AtomicLong offered = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  private volatile boolean closed;
  private volatile boolean abandoned;

  public AudioPipe(int capacity) {
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.highWaterMark = Math.max(1, capacity * 3 / 4);
  }

  /**
   * Queue a frame for the session without waiting.
   *
   * @return false if the frame was dropped
   */
  public boolean offer(byte[] frame) {
    if (closed || abandoned) {
      return false;
    }
    offered.incrementAndGet();
    if (queue.offer(frame)) {
      return true;
    }
    dropped.incrementAndGet();
    return false;
  }

  /** True while the session is so far behind that the producer should hold audio back. */
  public boolean isBackedUp() {
    return !abandoned && queue.size() >= highWaterMark;
  }

  /**
   * Take the next frame, waiting up to the given time.
   *
   * @return the frame, or null if none arrived in time
   */
  public byte[] poll(Duration timeout) throws InterruptedException {
    if (abandoned) {
      return null;
    }
    return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** No more frames will be offered. */
  public void close() {
    closed = true;
  }

  /** Discard queued frames and ignore further offers. */
  public void abandon() {
    abandoned = true;
    closed = true;
    queue.clear();
  }

  /** True once the pipe is closed and everything queued has been taken. */
  public boolean isFinished() {
    return closed && queue.isEmpty();
  }

  public boolean isAbandoned() {
    return abandoned;
  }

  public long offered() {
    return offered.get();
  }

  public long dropped() {
    return dropped.get();
  }
}
