package com.scholary.call.transcriber.audio;

/**
 * Signed 16-bit PCM at a fixed sample rate.
 *
 * <p>Converts between durations and byte counts. Byte counts are always sample aligned.
 */
public record PcmFormat(int sampleRateHertz) {

  public static final int BYTES_PER_SAMPLE = 2;
  public static final int CHANNELS = 2;

  public PcmFormat {
    if (sampleRateHertz <= 0) {
      throw new IllegalArgumentException("sampleRateHertz must be positive: " + sampleRateHertz);
    }
  }

  /** Mono byte count covering the given duration. */
  public int monoBytes(long millis) {
    long samples = millis * sampleRateHertz / 1000;
    return Math.toIntExact(samples * BYTES_PER_SAMPLE);
  }

  /** Interleaved two-channel byte count covering the given duration. */
  public int stereoBytes(long millis) {
    return monoBytes(millis) * CHANNELS;
  }

  /** Duration of a mono buffer of the given size. */
  public long monoMillis(int bytes) {
    return (long) (bytes / BYTES_PER_SAMPLE) * 1000 / sampleRateHertz;
  }

  /** Duration of an interleaved two-channel buffer of the given size. */
  public long stereoMillis(int bytes) {
    return monoMillis(bytes / CHANNELS);
  }
}
