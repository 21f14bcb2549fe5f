package com.scholary.call.transcriber.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.call.transcriber.audio.AudioChunk;
import com.scholary.call.transcriber.audio.ChannelBuffer;
import com.scholary.call.transcriber.audio.ChannelRole;
import com.scholary.call.transcriber.audio.InterleavedFrame;
import com.scholary.call.transcriber.audio.PcmFormat;
import com.scholary.call.transcriber.recognition.AudioPipe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChannelSynchronizerTest {

  // 20ms at 8kHz: 160 samples, 320 mono bytes, 640 interleaved bytes
  private static final Duration PERIOD = Duration.ofMillis(20);
  private static final int MONO_PERIOD_BYTES = 320;
  private static final int FRAME_BYTES = 640;

  private final PcmFormat format = new PcmFormat(8000);
  private final List<InterleavedFrame> frames = new ArrayList<>();

  private ChannelBuffer caller;
  private ChannelBuffer agent;
  private ChannelSynchronizer synchronizer;

  @BeforeEach
  void setUp() {
    caller = new ChannelBuffer(ChannelRole.CALLER, format, 16);
    agent = new ChannelBuffer(ChannelRole.AGENT, format, 16);
    synchronizer =
        new ChannelSynchronizer(caller, agent, format, PERIOD, Duration.ofSeconds(2), frames::add);
  }

  @Test
  void flush_shouldEmitSilentFrameWhenBothChannelsAreEmpty() {
    synchronizer.flush();

    assertThat(frames).hasSize(1);
    assertThat(frames.get(0).pcm()).hasSize(FRAME_BYTES).containsOnly(0);
    assertThat(frames.get(0).durationMillis()).isEqualTo(20);
  }

  @Test
  void flush_shouldPutCallerLeftAndAgentRight() {
    caller.offer(chunk(ChannelRole.CALLER, 0, 1, MONO_PERIOD_BYTES));
    agent.offer(chunk(ChannelRole.AGENT, 0, 2, MONO_PERIOD_BYTES));

    synchronizer.flush();

    assertThat(frames).hasSize(1);
    byte[] pcm = frames.get(0).pcm();
    assertThat(pcm).hasSize(FRAME_BYTES);
    for (int i = 0; i < pcm.length; i += 4) {
      assertThat(pcm[i]).isEqualTo((byte) 1);
      assertThat(pcm[i + 1]).isEqualTo((byte) 1);
      assertThat(pcm[i + 2]).isEqualTo((byte) 2);
      assertThat(pcm[i + 3]).isEqualTo((byte) 2);
    }
  }

  @Test
  void flush_shouldFillSilentChannelWithSilence() {
    caller.offer(chunk(ChannelRole.CALLER, 0, 7, MONO_PERIOD_BYTES));

    synchronizer.flush();

    byte[] pcm = frames.get(0).pcm();
    assertThat(pcm).hasSize(FRAME_BYTES);
    assertThat(pcm[0]).isEqualTo((byte) 7);
    assertThat(pcm[2]).isZero();
    assertThat(pcm[FRAME_BYTES - 4]).isEqualTo((byte) 7);
    assertThat(pcm[FRAME_BYTES - 2]).isZero();
  }

  @Test
  void flush_shouldOffsetLaterChannelByItsTimestamp() {
    caller.offer(chunk(ChannelRole.CALLER, 1000, 1, MONO_PERIOD_BYTES));
    // Agent starts 10ms (80 samples) later
    agent.offer(chunk(ChannelRole.AGENT, 1010, 2, MONO_PERIOD_BYTES / 2));

    synchronizer.flush();

    byte[] pcm = frames.get(0).pcm();
    assertThat(rightSample(pcm, 0)).isZero();
    assertThat(rightSample(pcm, 79)).isZero();
    assertThat(rightSample(pcm, 80)).isEqualTo((byte) 2);
    assertThat(rightSample(pcm, 159)).isEqualTo((byte) 2);
    assertThat(pcm[0]).isEqualTo((byte) 1);
  }

  @Test
  void flush_shouldClampSkewToConfiguredMaximum() {
    synchronizer =
        new ChannelSynchronizer(caller, agent, format, PERIOD, Duration.ofMillis(5), frames::add);
    caller.offer(chunk(ChannelRole.CALLER, 0, 1, MONO_PERIOD_BYTES));
    agent.offer(chunk(ChannelRole.AGENT, 500, 2, MONO_PERIOD_BYTES / 2));

    synchronizer.flush();

    byte[] pcm = frames.get(0).pcm();
    // 5ms is 40 samples
    assertThat(rightSample(pcm, 39)).isZero();
    assertThat(rightSample(pcm, 40)).isEqualTo((byte) 2);
  }

  @Test
  void flush_shouldCarryPartialPeriodIntoNextFlush() {
    caller.offer(chunk(ChannelRole.CALLER, 0, 3, MONO_PERIOD_BYTES * 3 / 2));

    synchronizer.flush();
    assertThat(frames).hasSize(1);

    synchronizer.flush();

    assertThat(frames).hasSize(2);
    byte[] second = frames.get(1).pcm();
    assertThat(second).hasSize(FRAME_BYTES);
    assertThat(second[0]).isEqualTo((byte) 3);
    assertThat(second[FRAME_BYTES / 2 - 4]).isEqualTo((byte) 3);
    assertThat(second[FRAME_BYTES / 2]).isZero();
  }

  @Test
  void flush_shouldEmitSeveralFramesForBacklog() {
    caller.offer(chunk(ChannelRole.CALLER, 0, 1, MONO_PERIOD_BYTES * 3));
    agent.offer(chunk(ChannelRole.AGENT, 0, 2, MONO_PERIOD_BYTES * 3));

    synchronizer.flush();

    assertThat(frames).hasSize(3);
    assertThat(frames).extracting(InterleavedFrame::sequence).containsExactly(0L, 1L, 2L);
    assertThat(frames).allSatisfy(f -> assertThat(f.pcm()).hasSize(FRAME_BYTES));
  }

  @Test
  void flushRemaining_shouldPadCarriedAudio() {
    caller.offer(chunk(ChannelRole.CALLER, 0, 4, MONO_PERIOD_BYTES * 3 / 2));
    synchronizer.flush();

    caller.offer(chunk(ChannelRole.CALLER, 30, 5, MONO_PERIOD_BYTES));
    synchronizer.flushRemaining();

    assertThat(frames).hasSize(3);
    assertThat(frames).allSatisfy(f -> assertThat(f.pcm()).hasSize(FRAME_BYTES));
    assertThat(synchronizer.framesEmitted()).isEqualTo(3);
  }

  @Test
  void flush_shouldHoldAudioInChannelBuffersWhileSinkIsBackedUp() {
    HoldingSink sink = new HoldingSink();
    ChannelSynchronizer held =
        new ChannelSynchronizer(caller, agent, format, PERIOD, Duration.ofSeconds(2), sink);
    caller.offer(chunk(ChannelRole.CALLER, 0, 6, MONO_PERIOD_BYTES));
    sink.backedUp = true;

    held.flush();
    held.flush();

    assertThat(sink.frames).isEmpty();
    assertThat(caller.size()).isEqualTo(1);
    assertThat(held.deferredTicks()).isEqualTo(2);

    sink.backedUp = false;
    held.flush();

    assertThat(sink.frames).hasSize(1);
    assertThat(sink.frames.get(0).pcm()[0]).isEqualTo((byte) 6);
    assertThat(caller.size()).isZero();
  }

  @Test
  void flush_shouldReturnWithinOnePeriodWhenSessionPipeIsFull() {
    Duration period = Duration.ofMillis(200);
    AudioPipe pipe = new AudioPipe(4);
    pipe.offer(new byte[] {0});
    pipe.offer(new byte[] {0});
    ChannelSynchronizer fanningOut =
        new ChannelSynchronizer(
            caller, agent, format, period, Duration.ofSeconds(2), new AudioFanOut(null, pipe));
    // Five periods of backlog against two free slots and nobody reading the pipe
    caller.offer(chunk(ChannelRole.CALLER, 0, 1, format.monoBytes(period.toMillis() * 5)));

    long started = System.nanoTime();
    fanningOut.flush();
    long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

    assertThat(elapsedMillis).isLessThan(period.toMillis());
    assertThat(fanningOut.framesEmitted()).isEqualTo(5);
    assertThat(pipe.dropped()).isEqualTo(3);

    started = System.nanoTime();
    fanningOut.flush();
    elapsedMillis = (System.nanoTime() - started) / 1_000_000;

    assertThat(elapsedMillis).isLessThan(period.toMillis());
    assertThat(fanningOut.deferredTicks()).isEqualTo(1);
  }

  @Test
  void constructor_shouldRejectPeriodShorterThanOneSample() {
    assertThatThrownBy(
            () ->
                new ChannelSynchronizer(
                    caller, agent, format, Duration.ZERO, Duration.ofSeconds(1), frames::add))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static AudioChunk chunk(ChannelRole role, long timestamp, int value, int bytes) {
    byte[] payload = new byte[bytes];
    Arrays.fill(payload, (byte) value);
    return new AudioChunk(role, timestamp, payload, "1");
  }

  private static byte rightSample(byte[] pcm, int sample) {
    return pcm[sample * 4 + 2];
  }

  private static final class HoldingSink implements FrameSink {

    private final List<InterleavedFrame> frames = new ArrayList<>();
    private boolean backedUp;

    @Override
    public void accept(InterleavedFrame frame) {
      frames.add(frame);
    }

    @Override
    public boolean isBackedUp() {
      return backedUp;
    }
  }
}
