package com.scholary.call.transcriber.demux;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

/** Remembers when data last arrived so an idle source can be detected and closed. */
public class ActivityTrackingInputStream extends FilterInputStream {

  private volatile long lastDataNanos = System.nanoTime();

  public ActivityTrackingInputStream(InputStream in) {
    super(in);
  }

  @Override
  public int read() throws IOException {
    int b = super.read();
    if (b >= 0) {
      lastDataNanos = System.nanoTime();
    }
    return b;
  }

  @Override
  public int read(byte[] buffer, int offset, int length) throws IOException {
    int n = super.read(buffer, offset, length);
    if (n > 0) {
      lastDataNanos = System.nanoTime();
    }
    return n;
  }

  /** Restart the idle clock for a source that was not read on purpose. */
  public void markActive() {
    lastDataNanos = System.nanoTime();
  }

  public Duration idleTime() {
    return Duration.ofNanos(System.nanoTime() - lastDataNanos);
  }
}
