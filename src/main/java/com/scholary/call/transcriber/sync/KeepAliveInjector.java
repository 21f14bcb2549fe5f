package com.scholary.call.transcriber.sync;

import com.scholary.call.transcriber.audio.AudioChunk;
import com.scholary.call.transcriber.audio.ChannelBuffer;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a minimal silence chunk into every channel buffer that has been idle for a full
 * interval.
 *
 * <p>The silence is stamped at the most recent stream time seen on any channel, so it lines up
 * with the active party instead of pulling the time axis back.
 */
public class KeepAliveInjector {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeepAliveInjector.class);

  /** One 16-bit sample. */
  static final int SILENCE_BYTES = 2;

  private final List<ChannelBuffer> buffers;
  private final Duration interval;
  private final Clock clock;

  private long injected;

  public KeepAliveInjector(List<ChannelBuffer> buffers, Duration interval, Clock clock) {
    this.buffers = List.copyOf(buffers);
    this.interval = interval;
    this.clock = clock;
  }

  /** Called on every keep-alive tick. */
  public void tick() {
    long streamTime = currentStreamTime();
    for (ChannelBuffer buffer : buffers) {
      if (buffer.idleTime().compareTo(interval) >= 0
          && buffer.offer(AudioChunk.silence(buffer.role(), streamTime, SILENCE_BYTES))) {
        injected++;
        LOGGER.debug("Keep-alive silence written to {} at {}", buffer.role(), streamTime);
      }
    }
  }

  public long injected() {
    return injected;
  }

  private long currentStreamTime() {
    long latest = -1;
    for (ChannelBuffer buffer : buffers) {
      latest = Math.max(latest, buffer.nextTimestampMillis());
    }
    return latest >= 0 ? latest : clock.millis();
  }
}
