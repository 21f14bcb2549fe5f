package com.scholary.call.transcriber.recording;

import com.scholary.call.transcriber.audio.PcmFormat;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/** Canonical 44-byte RIFF/WAVE header for interleaved 16-bit PCM. */
public final class WavHeader {

  public static final int LENGTH = 44;

  private WavHeader() {}

  /**
   * Build the header for a data chunk of the given size.
   *
   * @param format sample rate of each channel
   * @param dataLength number of PCM bytes that follow the header
   */
  public static byte[] create(PcmFormat format, long dataLength) {
    if (dataLength < 0 || dataLength > 0xFFFFFFFFL - (LENGTH - 8)) {
      throw new IllegalArgumentException("WAV data length out of range: " + dataLength);
    }
    int channels = PcmFormat.CHANNELS;
    int bitsPerSample = PcmFormat.BYTES_PER_SAMPLE * 8;
    int blockAlign = channels * PcmFormat.BYTES_PER_SAMPLE;
    int byteRate = format.sampleRateHertz() * blockAlign;

    ByteBuffer header = ByteBuffer.allocate(LENGTH).order(ByteOrder.LITTLE_ENDIAN);
    header.put("RIFF".getBytes(StandardCharsets.US_ASCII));
    header.putInt((int) (dataLength + LENGTH - 8));
    header.put("WAVE".getBytes(StandardCharsets.US_ASCII));
    header.put("fmt ".getBytes(StandardCharsets.US_ASCII));
    header.putInt(16);
    header.putShort((short) 1); // PCM
    header.putShort((short) channels);
    header.putInt(format.sampleRateHertz());
    header.putInt(byteRate);
    header.putShort((short) blockAlign);
    header.putShort((short) bitsPerSample);
    header.put("data".getBytes(StandardCharsets.US_ASCII));
    header.putInt((int) dataLength);
    return header.array();
  }
}
