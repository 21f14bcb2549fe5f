package com.scholary.call.transcriber.demux;

import com.amazonaws.kinesisvideo.parser.ebml.EBMLTypeInfo;
import com.amazonaws.kinesisvideo.parser.ebml.InputStreamParserByteSource;
import com.amazonaws.kinesisvideo.parser.ebml.MkvTypeInfos;
import com.amazonaws.kinesisvideo.parser.mkv.Frame;
import com.amazonaws.kinesisvideo.parser.mkv.MkvDataElement;
import com.amazonaws.kinesisvideo.parser.mkv.MkvElement;
import com.amazonaws.kinesisvideo.parser.mkv.MkvElementVisitException;
import com.amazonaws.kinesisvideo.parser.mkv.MkvEndMasterElement;
import com.amazonaws.kinesisvideo.parser.mkv.MkvStartMasterElement;
import com.amazonaws.kinesisvideo.parser.mkv.MkvValue;
import com.amazonaws.kinesisvideo.parser.mkv.StreamingMkvReader;
import com.amazonaws.kinesisvideo.parser.utilities.FragmentMetadata;
import com.amazonaws.kinesisvideo.parser.utilities.FragmentMetadataVisitor;
import com.amazonaws.kinesisvideo.parser.utilities.MkvTag;
import com.scholary.call.transcriber.audio.AudioChunk;
import com.scholary.call.transcriber.audio.ChannelBuffer;
import com.scholary.call.transcriber.audio.ChannelRole;
import com.scholary.call.transcriber.demux.DemuxResult.EndReason;
import com.scholary.call.transcriber.logging.StructuredLogger;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams audio blocks out of a Matroska container, one element at a time, using the Kinesis
 * Video Streams parser.
 *
 * <p>Only the elements needed to route audio are interpreted:
 *
 * <ul>
 *   <li>track entries (number and name), to learn which track carries which party
 *   <li>fragment tags, through {@link FragmentMetadataVisitor}
 *   <li>the timecode scale and cluster timecodes, for chunk timestamps
 *   <li>simple blocks, for the audio payload
 * </ul>
 *
 * <p>An element that fails to decode is logged and skipped; the stream is never aborted for it.
 *
 * <p>When built with buffers for both roles the demuxer serves a source that carries both parties
 * as separate tracks: blocks of its own role go to its own buffer and blocks of the other role
 * are forwarded to the sibling buffer. With a single buffer every block goes to that buffer.
 *
 * <p>Not thread-safe; one instance reads one source on one thread.
 */
public class ContainerDemuxer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContainerDemuxer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public static final String FRAGMENT_NUMBER_TAG = "AWS_KINESISVIDEO_FRAGMENT_NUMBER";
  public static final String SERVER_TIMESTAMP_TAG = "AWS_KINESISVIDEO_SERVER_TIMESTAMP";
  public static final String PRODUCER_TIMESTAMP_TAG = "AWS_KINESISVIDEO_PRODUCER_TIMESTAMP";

  private static final long DEFAULT_TIMECODE_SCALE_NS = 1_000_000L;

  private final ChannelRole role;
  private final Map<ChannelRole, ChannelBuffer> buffers;
  private final TrackRoleMap trackRoles;
  private final String resumeAfter;
  private final BooleanSupplier stopRequested;

  private volatile String lastFragment;
  private volatile EndReason closeReason;

  private String currentFragment;
  private String producerTimestamp;
  private String taggedFragment;
  private String visitedFragment;
  // Blocks seen before the first fragment tag of a resumed read belong to a delivered fragment
  private boolean suppressing;
  private long timecodeScaleNs = DEFAULT_TIMECODE_SCALE_NS;
  private long clusterTimecodeMillis = -1;

  private boolean inTrackEntry;
  private long pendingTrackNumber = -1;
  private String pendingTrackName;

  private long elementIndex;
  private long chunksEmitted;
  private long chunksSuppressed;
  private long decodeErrors;

  /**
   * @param role the channel this demuxer extracts
   * @param buffers the buffer for {@code role} and, for a shared two-party source, the sibling
   *     buffer of the other role
   * @param trackRoles track-name lookup, only consulted when a sibling buffer is present
   * @param resumeAfter fragment marker already processed by a previous work unit, or null to
   *     deliver everything
   * @param stopRequested checked at every fragment boundary
   */
  public ContainerDemuxer(
      ChannelRole role,
      Map<ChannelRole, ChannelBuffer> buffers,
      TrackRoleMap trackRoles,
      String resumeAfter,
      BooleanSupplier stopRequested) {
    if (!buffers.containsKey(role)) {
      throw new IllegalArgumentException("No buffer for demuxer role " + role);
    }
    this.role = role;
    this.buffers = Map.copyOf(buffers);
    this.trackRoles = trackRoles;
    this.resumeAfter = resumeAfter;
    this.stopRequested = stopRequested;
    this.lastFragment = resumeAfter;
    this.suppressing = resumeAfter != null;
  }

  public ChannelRole role() {
    return role;
  }

  /** Last fragment whose audio was delivered. Safe to read from other threads. */
  public String lastFragment() {
    return lastFragment;
  }

  /**
   * Record why the source is about to be closed from outside, so the resulting read failure is
   * reported as that reason instead of an I/O error. The first reason wins.
   */
  public void markClosing(EndReason reason) {
    if (closeReason == null) {
      closeReason = reason;
    }
  }

  /**
   * Read the source until it ends, is closed, or a stop is requested at a fragment boundary.
   *
   * <p>Never throws for stream problems; they are reported through the result's end reason.
   */
  public DemuxResult demux(InputStream source) {
    ReadFailureTracker tracked = new ReadFailureTracker(source);
    StreamingMkvReader reader =
        StreamingMkvReader.createDefault(new InputStreamParserByteSource(tracked));
    FragmentMetadataVisitor fragmentVisitor =
        FragmentMetadataVisitor.create(Optional.of(new FragmentTagProcessor()));
    try {
      while (reader.mightHaveNext()) {
        Optional<MkvElement> next = reader.nextIfAvailable();
        if (!next.isPresent()) {
          continue;
        }
        MkvElement element = next.get();
        elementIndex++;

        if (isStart(element, MkvTypeInfos.EBML)) {
          if (currentFragment != null && stopRequested.getAsBoolean()) {
            return finish(EndReason.STOP_REQUESTED);
          }
          startNewStream();
        }

        try {
          element.accept(fragmentVisitor);
          String observed = observedFragment(fragmentVisitor);
          if (observed != null && !observed.equals(currentFragment)) {
            if (currentFragment != null && stopRequested.getAsBoolean()) {
              // The new fragment is left for the successor
              return finish(EndReason.STOP_REQUESTED);
            }
            onFragment(observed);
          }
          handle(element);
        } catch (MkvElementVisitException | RuntimeException e) {
          decodeError(e.getMessage());
        }
      }
      if (tracked.failure != null) {
        return readFailed(tracked.failure);
      }
      return finish(closeReason != null ? closeReason : EndReason.END_OF_STREAM);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return finish(EndReason.STOP_REQUESTED);
    } catch (RuntimeException e) {
      if (tracked.failure != null) {
        return readFailed(tracked.failure);
      }
      // The parser cannot resynchronise after a broken element header
      decodeError(e.getMessage());
      return finish(closeReason != null ? closeReason : EndReason.SOURCE_ERROR);
    }
  }

  private DemuxResult readFailed(IOException failure) {
    if (closeReason != null) {
      return finish(closeReason);
    }
    LOGGER.warn("Source read failed for {}: {}", role, failure.getMessage());
    return finish(EndReason.SOURCE_ERROR);
  }

  private void startNewStream() {
    completePendingTrack();
    timecodeScaleNs = DEFAULT_TIMECODE_SCALE_NS;
    clusterTimecodeMillis = -1;
  }

  private String observedFragment(FragmentMetadataVisitor fragmentVisitor) {
    String visited =
        fragmentVisitor
            .getCurrentFragmentMetadata()
            .map(FragmentMetadata::getFragmentNumberString)
            .orElse(null);
    if (visited != null && !visited.equals(visitedFragment)) {
      visitedFragment = visited;
      taggedFragment = null;
      return visited;
    }
    String tagged = taggedFragment;
    taggedFragment = null;
    return tagged;
  }

  private void onFragment(String fragmentNumber) {
    currentFragment = fragmentNumber;
    suppressing = resumeAfter != null && compareFragments(fragmentNumber, resumeAfter) <= 0;
    if (!suppressing) {
      lastFragment = fragmentNumber;
    }
    STRUCTURED_LOGGER.logFragmentAdvanced(
        role.name(), fragmentNumber, producerTimestamp, suppressing);
  }

  private void handle(MkvElement element) throws InterruptedException {
    if (isStart(element, MkvTypeInfos.TRACKENTRY)) {
      completePendingTrack();
      inTrackEntry = true;
    } else if (isEnd(element, MkvTypeInfos.TRACKENTRY)) {
      completePendingTrack();
    } else if (isStart(element, MkvTypeInfos.CLUSTER)) {
      clusterTimecodeMillis = -1;
    } else if (element instanceof MkvDataElement) {
      handleData((MkvDataElement) element);
    }
  }

  private void handleData(MkvDataElement data) throws InterruptedException {
    if (is(data, MkvTypeInfos.SIMPLEBLOCK)) {
      handleBlock(data);
    } else if (is(data, MkvTypeInfos.TIMECODE)) {
      clusterTimecodeMillis = toMillis(unsigned(data));
    } else if (is(data, MkvTypeInfos.TIMECODESCALE)) {
      timecodeScaleNs = unsigned(data);
    } else if (inTrackEntry && is(data, MkvTypeInfos.TRACKNUMBER)) {
      pendingTrackNumber = unsigned(data);
    } else if (inTrackEntry && is(data, MkvTypeInfos.NAME)) {
      pendingTrackName = String.valueOf(data.getValueCopy().getVal());
    }
  }

  private void completePendingTrack() {
    if (inTrackEntry && pendingTrackNumber >= 0) {
      trackRoles.register(pendingTrackNumber, pendingTrackName);
      LOGGER.debug("Track {} named {} on {} source", pendingTrackNumber, pendingTrackName, role);
    }
    inTrackEntry = false;
    pendingTrackNumber = -1;
    pendingTrackName = null;
  }

  @SuppressWarnings("unchecked")
  private void handleBlock(MkvDataElement data) throws InterruptedException {
    Frame frame = ((MkvValue<Frame>) data.getValueCopy()).getVal();
    ByteBuffer frameData = frame.getFrameData();
    byte[] payload = new byte[frameData.remaining()];
    frameData.get(payload);

    if (suppressing) {
      chunksSuppressed++;
      return;
    }

    ChannelRole target = role;
    if (buffers.size() > 1) {
      target = trackRoles.roleOf(frame.getTrackNumber()).orElse(role);
    }
    ChannelBuffer buffer = buffers.get(target);
    if (buffer == null) {
      return;
    }

    long timestamp =
        clusterTimecodeMillis >= 0
            ? clusterTimecodeMillis + toMillis(frame.getTimeCode())
            : System.currentTimeMillis();

    buffer.put(new AudioChunk(target, timestamp, payload, currentFragment));
    chunksEmitted++;
  }

  private long toMillis(long timecode) {
    return timecode * timecodeScaleNs / 1_000_000L;
  }

  private void decodeError(String message) {
    decodeErrors++;
    STRUCTURED_LOGGER.logDecodeError(role.name(), elementIndex, message);
  }

  private DemuxResult finish(EndReason reason) {
    LOGGER.info(
        "Demuxer for {} finished: reason={}, lastFragment={}, chunks={}, suppressed={},"
            + " decodeErrors={}",
        role,
        reason,
        lastFragment,
        chunksEmitted,
        chunksSuppressed,
        decodeErrors);
    return new DemuxResult(
        role, lastFragment, chunksEmitted, chunksSuppressed, decodeErrors, reason);
  }

  private static boolean is(MkvElement element, EBMLTypeInfo typeInfo) {
    return typeInfo.equals(element.getElementMetaData().getTypeInfo());
  }

  private static boolean isStart(MkvElement element, EBMLTypeInfo typeInfo) {
    return element instanceof MkvStartMasterElement && is(element, typeInfo);
  }

  private static boolean isEnd(MkvElement element, EBMLTypeInfo typeInfo) {
    return element instanceof MkvEndMasterElement && is(element, typeInfo);
  }

  private static long unsigned(MkvDataElement data) {
    return ((Number) data.getValueCopy().getVal()).longValue();
  }

  /** Fragment numbers are decimal strings too large for a long; fall back to text order. */
  static int compareFragments(String a, String b) {
    try {
      return new BigInteger(a).compareTo(new BigInteger(b));
    } catch (NumberFormatException e) {
      return a.compareTo(b);
    }
  }

  /** Picks up the fragment tags the visitor hands over as they are read. */
  private final class FragmentTagProcessor implements FragmentMetadataVisitor.MkvTagProcessor {

    @Override
    public void process(MkvTag mkvTag, Optional<FragmentMetadata> currentFragmentMetadata) {
      if (FRAGMENT_NUMBER_TAG.equals(mkvTag.getTagName())) {
        taggedFragment = mkvTag.getTagValue();
        producerTimestamp = null;
      } else if (PRODUCER_TIMESTAMP_TAG.equals(mkvTag.getTagName())) {
        producerTimestamp = mkvTag.getTagValue();
      }
    }
  }

  /** Keeps the I/O failure the parser may wrap or swallow while reading. */
  private static final class ReadFailureTracker extends FilterInputStream {

    private volatile IOException failure;

    private ReadFailureTracker(InputStream in) {
      super(in);
    }

    @Override
    public int read() throws IOException {
      try {
        return super.read();
      } catch (IOException e) {
        failure = e;
        throw e;
      }
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      try {
        return super.read(b, off, len);
      } catch (IOException e) {
        failure = e;
        throw e;
      }
    }
  }
}
