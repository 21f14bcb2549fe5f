package com.scholary.call.transcriber.demux;

import static com.scholary.call.transcriber.demux.MkvFixture.concat;
import static com.scholary.call.transcriber.demux.MkvFixture.fragment;
import static com.scholary.call.transcriber.demux.MkvFixture.pcm;
import static com.scholary.call.transcriber.demux.MkvFixture.simpleBlock;
import static com.scholary.call.transcriber.demux.MkvFixture.truncatedBlock;
import static com.scholary.call.transcriber.demux.MkvFixture.untaggedSegment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.call.transcriber.audio.AudioChunk;
import com.scholary.call.transcriber.audio.ChannelBuffer;
import com.scholary.call.transcriber.audio.ChannelRole;
import com.scholary.call.transcriber.audio.PcmFormat;
import com.scholary.call.transcriber.demux.DemuxResult.EndReason;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContainerDemuxerTest {

  private final PcmFormat format = new PcmFormat(8000);
  private final AtomicBoolean stop = new AtomicBoolean();

  private ChannelBuffer callerBuffer;
  private ChannelBuffer agentBuffer;

  @BeforeEach
  void setUp() {
    callerBuffer = new ChannelBuffer(ChannelRole.CALLER, format, 64);
    agentBuffer = new ChannelBuffer(ChannelRole.AGENT, format, 64);
  }

  @Test
  void demux_shouldDeliverBlocksInOrderWithClusterRelativeTimestamps() {
    byte[] stream =
        fragment(
            "100",
            1000,
            simpleBlock(1, 0, pcm(1, 320)),
            simpleBlock(1, 20, pcm(2, 320)),
            simpleBlock(1, 40, pcm(3, 320)));

    DemuxResult result = callerDemuxer(null).demux(new ByteArrayInputStream(stream));

    List<AudioChunk> chunks = callerBuffer.drain();
    assertThat(chunks)
        .extracting(AudioChunk::timestampMillis)
        .containsExactly(1000L, 1020L, 1040L);
    assertThat(chunks)
        .extracting(c -> c.payload()[0])
        .containsExactly((byte) 1, (byte) 2, (byte) 3);
    assertThat(chunks).allSatisfy(c -> assertThat(c.fragmentNumber()).isEqualTo("100"));
    assertThat(result.endReason()).isEqualTo(EndReason.END_OF_STREAM);
    assertThat(result.lastFragment()).isEqualTo("100");
    assertThat(result.chunksEmitted()).isEqualTo(3);
    assertThat(result.decodeErrors()).isZero();
  }

  @Test
  void demux_shouldSuppressFragmentsUpToResumeMarker() {
    byte[] stream =
        concat(
            fragment("1", 0, simpleBlock(1, 0, pcm(1, 160))),
            fragment("2", 1000, simpleBlock(1, 0, pcm(2, 160))),
            fragment("3", 2000, simpleBlock(1, 0, pcm(3, 160))));

    DemuxResult result = callerDemuxer("2").demux(new ByteArrayInputStream(stream));

    List<AudioChunk> chunks = callerBuffer.drain();
    assertThat(chunks).extracting(AudioChunk::fragmentNumber).containsExactly("3");
    assertThat(chunks.get(0).payload()[0]).isEqualTo((byte) 3);
    assertThat(result.lastFragment()).isEqualTo("3");
    assertThat(result.chunksSuppressed()).isEqualTo(2);
    assertThat(result.chunksEmitted()).isEqualTo(1);
  }

  @Test
  void demux_shouldKeepResumeMarkerWhenNothingNewArrives() {
    byte[] stream = fragment("7", 0, simpleBlock(1, 0, pcm(1, 160)));

    DemuxResult result = callerDemuxer("7").demux(new ByteArrayInputStream(stream));

    assertThat(callerBuffer.drain()).isEmpty();
    assertThat(result.lastFragment()).isEqualTo("7");
  }

  @Test
  void demux_shouldSuppressBlocksReadBeforeFirstFragmentTagWhenResuming() {
    byte[] stream =
        concat(
            untaggedSegment(0, simpleBlock(1, 0, pcm(9, 160)), simpleBlock(1, 20, pcm(9, 160))),
            fragment("3", 2000, simpleBlock(1, 0, pcm(3, 160))));

    DemuxResult result = callerDemuxer("2").demux(new ByteArrayInputStream(stream));

    List<AudioChunk> chunks = callerBuffer.drain();
    assertThat(chunks).extracting(AudioChunk::fragmentNumber).containsExactly("3");
    assertThat(chunks.get(0).payload()[0]).isEqualTo((byte) 3);
    assertThat(result.chunksSuppressed()).isEqualTo(2);
    assertThat(result.lastFragment()).isEqualTo("3");
  }

  @Test
  void demux_shouldDeliverUntaggedBlocksWhenNotResuming() {
    byte[] stream = untaggedSegment(500, simpleBlock(1, 0, pcm(4, 160)));

    DemuxResult result = callerDemuxer(null).demux(new ByteArrayInputStream(stream));

    List<AudioChunk> chunks = callerBuffer.drain();
    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).timestampMillis()).isEqualTo(500L);
    assertThat(chunks.get(0).fragmentNumber()).isNull();
    assertThat(result.lastFragment()).isNull();
  }

  @Test
  void demux_shouldSkipMalformedElementsAndContinue() {
    byte[] stream =
        concat(
            fragment(
                "1",
                0,
                simpleBlock(1, 0, pcm(1, 160)),
                truncatedBlock(1),
                simpleBlock(1, 40, pcm(2, 160))),
            fragment("2", 1000, simpleBlock(1, 0, pcm(3, 160))));

    DemuxResult result = callerDemuxer(null).demux(new ByteArrayInputStream(stream));

    assertThat(callerBuffer.drain())
        .extracting(c -> c.payload()[0])
        .containsExactly((byte) 1, (byte) 2, (byte) 3);
    assertThat(result.decodeErrors()).isEqualTo(1);
    assertThat(result.endReason()).isEqualTo(EndReason.END_OF_STREAM);
    assertThat(result.lastFragment()).isEqualTo("2");
  }

  @Test
  void demux_shouldStopAtFragmentBoundaryWhenStopRequested() {
    stop.set(true);
    byte[] stream =
        concat(
            fragment("1", 0, simpleBlock(1, 0, pcm(1, 160)), simpleBlock(1, 20, pcm(1, 160))),
            fragment("2", 1000, simpleBlock(1, 0, pcm(2, 160))));

    DemuxResult result = callerDemuxer(null).demux(new ByteArrayInputStream(stream));

    assertThat(callerBuffer.drain()).hasSize(2);
    assertThat(result.endReason()).isEqualTo(EndReason.STOP_REQUESTED);
    assertThat(result.lastFragment()).isEqualTo("1");
  }

  @Test
  void demux_shouldRouteTracksOfSharedSourceByName() {
    byte[] stream =
        fragment(
            "5",
            0,
            simpleBlock(1, 0, pcm(1, 160)),
            simpleBlock(2, 0, pcm(2, 160)),
            simpleBlock(1, 20, pcm(1, 160)));
    Map<ChannelRole, ChannelBuffer> buffers = new EnumMap<>(ChannelRole.class);
    buffers.put(ChannelRole.CALLER, callerBuffer);
    buffers.put(ChannelRole.AGENT, agentBuffer);
    ContainerDemuxer demuxer =
        new ContainerDemuxer(
            ChannelRole.CALLER,
            buffers,
            TrackRoleMap.of(MkvFixture.CALLER_TRACK, MkvFixture.AGENT_TRACK),
            null,
            stop::get);

    demuxer.demux(new ByteArrayInputStream(stream));

    assertThat(callerBuffer.drain()).hasSize(2).allMatch(c -> c.role() == ChannelRole.CALLER);
    List<AudioChunk> agentChunks = agentBuffer.drain();
    assertThat(agentChunks).hasSize(1);
    assertThat(agentChunks.get(0).role()).isEqualTo(ChannelRole.AGENT);
    assertThat(agentChunks.get(0).payload()[0]).isEqualTo((byte) 2);
  }

  @Test
  void demux_shouldSendEveryTrackToOwnBufferForDedicatedSource() {
    byte[] stream =
        fragment("5", 0, simpleBlock(1, 0, pcm(1, 160)), simpleBlock(2, 20, pcm(2, 160)));
    ContainerDemuxer demuxer =
        new ContainerDemuxer(
            ChannelRole.AGENT,
            Map.of(ChannelRole.AGENT, agentBuffer),
            TrackRoleMap.of(MkvFixture.CALLER_TRACK, MkvFixture.AGENT_TRACK),
            null,
            stop::get);

    demuxer.demux(new ByteArrayInputStream(stream));

    assertThat(agentBuffer.drain()).hasSize(2);
    assertThat(callerBuffer.drain()).isEmpty();
  }

  @Test
  void demux_shouldReportMarkedReasonWhenSourceIsClosedFromOutside() {
    ContainerDemuxer demuxer = callerDemuxer(null);
    demuxer.markClosing(EndReason.INACTIVITY);
    demuxer.markClosing(EndReason.STOP_REQUESTED);
    InputStream failing =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("stream closed");
          }
        };

    DemuxResult result = demuxer.demux(failing);

    assertThat(result.endReason()).isEqualTo(EndReason.INACTIVITY);
  }

  @Test
  void demux_shouldReportSourceErrorOnUnexpectedReadFailure() {
    InputStream failing =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("connection reset");
          }
        };

    DemuxResult result = callerDemuxer(null).demux(failing);

    assertThat(result.endReason()).isEqualTo(EndReason.SOURCE_ERROR);
  }

  @Test
  void constructor_shouldRejectMissingOwnBuffer() {
    assertThatThrownBy(
            () ->
                new ContainerDemuxer(
                    ChannelRole.CALLER,
                    Map.of(ChannelRole.AGENT, agentBuffer),
                    TrackRoleMap.of(MkvFixture.CALLER_TRACK, MkvFixture.AGENT_TRACK),
                    null,
                    stop::get))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void compareFragments_shouldCompareLongDecimalNumbersNumerically() {
    assertThat(
            ContainerDemuxer.compareFragments(
                "91343852333181432392682062607743920146264440817",
                "91343852333181432392682062607743920146264440818"))
        .isNegative();
    assertThat(ContainerDemuxer.compareFragments("10", "9")).isPositive();
    assertThat(ContainerDemuxer.compareFragments("42", "42")).isZero();
  }

  private ContainerDemuxer callerDemuxer(String resumeAfter) {
    return new ContainerDemuxer(
        ChannelRole.CALLER,
        Map.of(ChannelRole.CALLER, callerBuffer),
        TrackRoleMap.of(MkvFixture.CALLER_TRACK, MkvFixture.AGENT_TRACK),
        resumeAfter,
        stop::get);
  }
}
