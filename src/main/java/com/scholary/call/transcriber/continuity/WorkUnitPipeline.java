package com.scholary.call.transcriber.continuity;

import com.scholary.call.transcriber.audio.ChannelBuffer;
import com.scholary.call.transcriber.audio.ChannelRole;
import com.scholary.call.transcriber.audio.PcmFormat;
import com.scholary.call.transcriber.config.TranscriberProperties;
import com.scholary.call.transcriber.demux.ActivityTrackingInputStream;
import com.scholary.call.transcriber.demux.ContainerDemuxer;
import com.scholary.call.transcriber.demux.DemuxResult;
import com.scholary.call.transcriber.demux.DemuxResult.EndReason;
import com.scholary.call.transcriber.demux.TrackRoleMap;
import com.scholary.call.transcriber.recognition.AudioPipe;
import com.scholary.call.transcriber.recognition.RecognitionProperties;
import com.scholary.call.transcriber.recognition.RecognitionSession;
import com.scholary.call.transcriber.recognition.RecognitionSessionDriver;
import com.scholary.call.transcriber.recording.RecordingProperties;
import com.scholary.call.transcriber.source.MediaSource;
import com.scholary.call.transcriber.sync.AudioFanOut;
import com.scholary.call.transcriber.sync.ChannelSynchronizer;
import com.scholary.call.transcriber.sync.KeepAliveInjector;
import com.scholary.call.transcriber.sync.RecordingBuffer;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The streaming phase of a work unit.
 *
 * <p>Opens the sources, runs one demuxer per source, interleaves both channels on a fixed cadence,
 * injects keep-alive silence, and fans the frames out to the local recording and the recognition
 * session. The session is started before the interleave cadence begins, so no frame is produced
 * that the session could not take; the readers meanwhile fill the channel buffers and then wait.
 * While the session falls behind, the synchronizer holds audio back and the readers pause the same
 * way. Returns when every source has ended, either naturally, after the inactivity window, or
 * at the first fragment boundary after the work unit's deadline. A source that does not reach a
 * boundary within the drain timeout is closed.
 *
 * <p>All tasks run on the executors of the {@link WorkUnitContext}.
 */
@Component
public class WorkUnitPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkUnitPipeline.class);

  private static final Duration WATCHDOG_INTERVAL = Duration.ofSeconds(1);

  private final MediaSource mediaSource;
  private final RecognitionSessionDriver driver;
  private final TranscriberProperties properties;
  private final RecognitionProperties recognitionProperties;
  private final RecordingProperties recordingProperties;
  private final PcmFormat format;
  private final Clock clock;

  public WorkUnitPipeline(
      MediaSource mediaSource,
      RecognitionSessionDriver driver,
      TranscriberProperties properties,
      RecognitionProperties recognitionProperties,
      RecordingProperties recordingProperties,
      PcmFormat format,
      Clock clock) {
    this.mediaSource = mediaSource;
    this.driver = driver;
    this.properties = properties;
    this.recognitionProperties = recognitionProperties;
    this.recordingProperties = recordingProperties;
    this.format = format;
    this.clock = clock;
  }

  /**
   * Stream the call until its sources end or the deadline is reached.
   *
   * @throws com.scholary.call.transcriber.recognition.RecognitionException if no recognition
   *     session could be started
   * @throws com.scholary.call.transcriber.source.MediaSourceException if a source cannot be
   *     opened
   */
  public StreamingResult stream(WorkUnitContext ctx) throws InterruptedException {
    CallSession session = ctx.session();
    TranscriberProperties.Demux demuxConfig = properties.demux();

    Map<ChannelRole, ChannelBuffer> buffers = new EnumMap<>(ChannelRole.class);
    for (ChannelRole role : ChannelRole.values()) {
      buffers.put(role, new ChannelBuffer(role, format, demuxConfig.channelBufferCapacity()));
    }

    RecordingBuffer recording = openRecording(ctx);
    AudioPipe pipe = new AudioPipe(recognitionProperties.audioPipeCapacity());
    AudioFanOut fanOut = new AudioFanOut(recording, pipe);
    ChannelSynchronizer synchronizer =
        new ChannelSynchronizer(
            buffers.get(ChannelRole.CALLER),
            buffers.get(ChannelRole.AGENT),
            format,
            properties.sync().period(),
            properties.sync().maxSkew(),
            fanOut);
    KeepAliveInjector keepAlive =
        new KeepAliveInjector(
            List.copyOf(buffers.values()), properties.keepAlive().interval(), clock);

    List<SourceReader> readers = new ArrayList<>();
    List<ScheduledFuture<?>> ticks = new ArrayList<>();
    try {
      openSources(ctx, buffers, readers);
      for (SourceReader reader : readers) {
        reader.result = ctx.readers().submit(() -> reader.demuxer.demux(reader.stream));
      }
      armDeadline(ctx, readers);

      RecognitionSession recognition =
          driver.start(
              session.callId(), session.recognitionSessionId(), pipe, ctx.audioPush());
      // Readers blocked on full channel buffers during the start were not idle
      readers.forEach(reader -> reader.stream.markActive());

      long periodMillis = properties.sync().period().toMillis();
      long keepAliveMillis = properties.keepAlive().interval().toMillis();
      ticks.add(
          ctx.ticker()
              .scheduleAtFixedRate(
                  guarded("interleave", synchronizer::flush),
                  periodMillis,
                  periodMillis,
                  TimeUnit.MILLISECONDS));
      ticks.add(
          ctx.ticker()
              .scheduleAtFixedRate(
                  guarded("keep-alive", keepAlive::tick),
                  keepAliveMillis,
                  keepAliveMillis,
                  TimeUnit.MILLISECONDS));
      ticks.add(
          ctx.timers()
              .scheduleAtFixedRate(
                  guarded("inactivity watchdog", () -> closeIdleSources(readers, fanOut)),
                  WATCHDOG_INTERVAL.toMillis(),
                  WATCHDOG_INTERVAL.toMillis(),
                  TimeUnit.MILLISECONDS));

      List<DemuxResult> demuxResults = awaitReaders(readers);
      ticks.forEach(tick -> tick.cancel(false));
      drainSynchronizer(ctx, synchronizer);
      pipe.close();
      awaitRecognition(recognition);

      boolean deadlineReached =
          ctx.isStopRequested()
              && demuxResults.stream().anyMatch(r -> r.endReason() != EndReason.END_OF_STREAM);
      LOGGER.info(
          "Streaming finished: frames={}, keepAlives={}, sentToRecognition={}, "
              + "droppedForRecognition={}, recordingFailures={}, deadline={}",
          synchronizer.framesEmitted(),
          keepAlive.injected(),
          pipe.offered(),
          pipe.dropped(),
          fanOut.recordingFailures(),
          deadlineReached);

      return new StreamingResult(
          marker(readers, ChannelRole.CALLER, session),
          marker(readers, ChannelRole.AGENT, session),
          recognition.sessionId(),
          deadlineReached,
          recording == null ? null : recording.path(),
          synchronizer.framesEmitted(),
          demuxResults);

    } catch (RuntimeException | InterruptedException e) {
      ctx.requestStop();
      for (SourceReader reader : readers) {
        reader.demuxer.markClosing(EndReason.STOP_REQUESTED);
      }
      pipe.abandon();
      throw e;
    } finally {
      ticks.forEach(tick -> tick.cancel(false));
      readers.forEach(SourceReader::close);
      closeRecording(recording);
    }
  }

  private void openSources(
      WorkUnitContext ctx, Map<ChannelRole, ChannelBuffer> buffers, List<SourceReader> readers) {
    CallSession session = ctx.session();
    TrackRoleMap trackRoles =
        TrackRoleMap.of(properties.demux().callerTrackName(), properties.demux().agentTrackName());

    if (session.isSharedSource()) {
      // Both parties are tracks of one stream: one reader feeds both buffers
      readers.add(open(ctx, ChannelRole.CALLER, buffers, trackRoles));
      return;
    }
    for (ChannelRole role : ChannelRole.values()) {
      readers.add(open(ctx, role, Map.of(role, buffers.get(role)), trackRoles));
    }
  }

  private SourceReader open(
      WorkUnitContext ctx,
      ChannelRole role,
      Map<ChannelRole, ChannelBuffer> buffers,
      TrackRoleMap trackRoles) {
    CallSession session = ctx.session();
    String resumeAfter = session.lastFragment(role);
    ActivityTrackingInputStream stream =
        new ActivityTrackingInputStream(mediaSource.open(session.sourceRef(role), resumeAfter));
    ContainerDemuxer demuxer =
        new ContainerDemuxer(role, buffers, trackRoles, resumeAfter, ctx::isStopRequested);
    return new SourceReader(session.sourceRef(role), demuxer, stream);
  }

  private void armDeadline(WorkUnitContext ctx, List<SourceReader> readers) {
    TranscriberProperties.Continuity continuity = properties.continuity();
    long elapsed = Duration.between(ctx.startedAt(), clock.instant()).toMillis();
    long delay = Math.max(0, continuity.streamingWindow().toMillis() - elapsed);

    ctx.timers()
        .schedule(
            () -> {
              if (ctx.requestStop()) {
                LOGGER.info(
                    "Time budget reached for {}, stopping at the next fragment boundary",
                    ctx.id());
              }
              ctx.timers()
                  .schedule(
                      () -> forceClose(readers),
                      continuity.drainTimeout().toMillis(),
                      TimeUnit.MILLISECONDS);
            },
            delay,
            TimeUnit.MILLISECONDS);
  }

  private void forceClose(List<SourceReader> readers) {
    for (SourceReader reader : readers) {
      if (!reader.isDone()) {
        LOGGER.warn(
            "Source {} did not reach a fragment boundary within the drain timeout, closing it",
            reader.sourceRef);
        reader.demuxer.markClosing(EndReason.STOP_REQUESTED);
        reader.close();
      }
    }
  }

  private void closeIdleSources(List<SourceReader> readers, AudioFanOut fanOut) {
    if (fanOut.isBackedUp()) {
      // Sources are held back on purpose, not silent
      readers.forEach(reader -> reader.stream.markActive());
      return;
    }
    Duration timeout = properties.demux().inactivityTimeout();
    for (SourceReader reader : readers) {
      if (!reader.isDone() && reader.stream.idleTime().compareTo(timeout) >= 0) {
        LOGGER.info("No data from source {} for {}, closing it", reader.sourceRef, timeout);
        reader.demuxer.markClosing(EndReason.INACTIVITY);
        reader.close();
      }
    }
  }

  private List<DemuxResult> awaitReaders(List<SourceReader> readers) throws InterruptedException {
    List<DemuxResult> results = new ArrayList<>();
    for (SourceReader reader : readers) {
      try {
        results.add(reader.result.get());
      } catch (ExecutionException e) {
        LOGGER.error("Demuxer for source {} failed", reader.sourceRef, e.getCause());
        results.add(
            new DemuxResult(
                reader.demuxer.role(),
                reader.demuxer.lastFragment(),
                0,
                0,
                0,
                EndReason.SOURCE_ERROR));
      }
    }
    return results;
  }

  /** Runs on the ticker thread so it cannot overlap a scheduled flush. */
  private void drainSynchronizer(WorkUnitContext ctx, ChannelSynchronizer synchronizer)
      throws InterruptedException {
    try {
      ctx.ticker().submit(synchronizer::flushRemaining).get();
    } catch (ExecutionException e) {
      LOGGER.error("Failed to flush the last interleaved frames", e.getCause());
    }
  }

  private void awaitRecognition(RecognitionSession recognition) throws InterruptedException {
    Duration timeout = recognitionProperties.completionTimeout();
    try {
      recognition.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOGGER.warn(
          "Recognition session {} did not finish within {}, late results are lost",
          recognition.sessionId(),
          timeout);
      recognition.completion().cancel(true);
    } catch (ExecutionException e) {
      LOGGER.warn(
          "Recognition session {} ended with an error: {}",
          recognition.sessionId(),
          e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
    }
  }

  private RecordingBuffer openRecording(WorkUnitContext ctx) {
    CallSession session = ctx.session();
    if (!recordingProperties.enabled() || !session.recordingEnabled()) {
      return null;
    }
    try {
      RecordingBuffer recording =
          RecordingBuffer.create(
              Path.of(properties.tempDir()), session.callId(), session.workUnitSequence());
      ctx.setRecordingPath(recording.path());
      return recording;
    } catch (IOException e) {
      LOGGER.error("Failed to create local recording, continuing without it", e);
      return null;
    }
  }

  private static void closeRecording(RecordingBuffer recording) {
    if (recording == null) {
      return;
    }
    try {
      recording.close();
    } catch (IOException e) {
      LOGGER.error("Failed to close local recording {}", recording.path(), e);
    }
  }

  private static String marker(List<SourceReader> readers, ChannelRole role, CallSession session) {
    for (SourceReader reader : readers) {
      if (reader.demuxer.role() == role || readers.size() == 1) {
        return reader.demuxer.lastFragment();
      }
    }
    return session.lastFragment(role);
  }

  private static Runnable guarded(String name, Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        // A scheduled task that throws is never run again
        LOGGER.error("Scheduled {} task failed", name, e);
      }
    };
  }

  /** One open source and the demuxer reading it. */
  private static final class SourceReader {

    private final String sourceRef;
    private final ContainerDemuxer demuxer;
    private final ActivityTrackingInputStream stream;
    private volatile Future<DemuxResult> result;
    private volatile boolean closed;

    SourceReader(String sourceRef, ContainerDemuxer demuxer, ActivityTrackingInputStream stream) {
      this.sourceRef = sourceRef;
      this.demuxer = demuxer;
      this.stream = stream;
    }

    boolean isDone() {
      return closed || (result != null && result.isDone());
    }

    synchronized void close() {
      if (closed) {
        return;
      }
      closed = true;
      try {
        stream.close();
      } catch (IOException e) {
        LOGGER.warn("Failed to close source {}: {}", sourceRef, e.getMessage());
      }
    }
  }
}
