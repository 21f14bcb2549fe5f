package com.scholary.call.transcriber.recording;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.call.transcriber.audio.PcmFormat;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class WavHeaderTest {

  @Test
  void create_shouldDescribeStereo16BitPcm() {
    byte[] header = WavHeader.create(new PcmFormat(8000), 32_000);
    ByteBuffer buffer = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);

    assertThat(header).hasSize(WavHeader.LENGTH);
    assertThat(new String(header, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
    assertThat(buffer.getInt(4)).isEqualTo(32_036);
    assertThat(new String(header, 8, 8, StandardCharsets.US_ASCII)).isEqualTo("WAVEfmt ");
    assertThat(buffer.getShort(20)).isEqualTo((short) 1);
    assertThat(buffer.getShort(22)).isEqualTo((short) 2);
    assertThat(buffer.getInt(24)).isEqualTo(8000);
    assertThat(buffer.getInt(28)).isEqualTo(32_000);
    assertThat(buffer.getShort(32)).isEqualTo((short) 4);
    assertThat(buffer.getShort(34)).isEqualTo((short) 16);
    assertThat(new String(header, 36, 4, StandardCharsets.US_ASCII)).isEqualTo("data");
    assertThat(buffer.getInt(40)).isEqualTo(32_000);
  }

  @Test
  void create_shouldRejectNegativeLength() {
    assertThatThrownBy(() -> WavHeader.create(new PcmFormat(8000), -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
