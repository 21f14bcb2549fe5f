package com.scholary.call.transcriber.continuity;

import com.scholary.call.transcriber.config.TranscriberProperties;
import com.scholary.call.transcriber.events.EventSink;
import com.scholary.call.transcriber.hook.CustomizationHook;
import com.scholary.call.transcriber.hook.CustomizationHookException;
import com.scholary.call.transcriber.hook.HookResult;
import com.scholary.call.transcriber.logging.StructuredLogger;
import com.scholary.call.transcriber.recognition.RecognitionException;
import com.scholary.call.transcriber.recording.RecordingFinalizer;
import com.scholary.call.transcriber.registry.WorkUnitRegistry;
import com.scholary.call.transcriber.registry.WorkUnitStatus;
import com.scholary.call.transcriber.source.ChannelSources;
import com.scholary.call.transcriber.source.MediaSourceException;
import com.scholary.call.transcriber.source.SourceLookupException;
import com.scholary.call.transcriber.source.SourceResolver;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one work unit of a call from checkpoint to hand-off or completion.
 *
 * <pre>
 * STARTING -> STREAMING -> TIME_BUDGET_REACHED | SOURCE_CLOSED | ERROR -> FINALIZING -> DONE
 * </pre>
 *
 * <p>STARTING resolves the sources and, for the first work unit of a call, runs the customization
 * hook and writes START. STREAMING runs the {@link WorkUnitPipeline} until the sources close or the
 * time budget runs out. FINALIZING always uploads this work unit's raw audio. After a deadline it
 * launches exactly one successor carrying the fragment markers and the recognition session id;
 * after a natural end it writes END, merges the recording and writes its URL. Failures write one
 * ERROR event and finalize without a successor.
 */
@Service
public class ContinuityController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContinuityController.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final SourceResolver sourceResolver;
  private final CustomizationHook customizationHook;
  private final EventSink eventSink;
  private final WorkUnitPipeline pipeline;
  private final RecordingFinalizer recordingFinalizer;
  private final WorkUnitLauncher launcher;
  private final WorkUnitRegistry registry;
  private final TranscriberProperties properties;
  private final Executor workUnitExecutor;
  private final Clock clock;

  public ContinuityController(
      SourceResolver sourceResolver,
      CustomizationHook customizationHook,
      EventSink eventSink,
      WorkUnitPipeline pipeline,
      RecordingFinalizer recordingFinalizer,
      WorkUnitLauncher launcher,
      WorkUnitRegistry registry,
      TranscriberProperties properties,
      @Qualifier("workUnitExecutor") Executor workUnitExecutor,
      Clock clock) {
    this.sourceResolver = sourceResolver;
    this.customizationHook = customizationHook;
    this.eventSink = eventSink;
    this.pipeline = pipeline;
    this.recordingFinalizer = recordingFinalizer;
    this.launcher = launcher;
    this.registry = registry;
    this.properties = properties;
    this.workUnitExecutor = workUnitExecutor;
    this.clock = clock;
  }

  /**
   * Queue a work unit on the work-unit executor.
   *
   * @return the work unit id, or empty if the call already has an active work unit at this or a
   *     later sequence
   * @throws LaunchException if the executor rejects the work unit
   */
  public Optional<String> submit(CallSession checkpoint) {
    String workUnitId = WorkUnitContext.workUnitId(checkpoint);
    WorkUnitStatus status =
        new WorkUnitStatus(
            checkpoint.callId(), workUnitId, checkpoint.workUnitSequence(), clock.instant());
    if (!registry.tryStart(status)) {
      LOGGER.warn("Work unit {} rejected, the call already has an active work unit", workUnitId);
      return Optional.empty();
    }

    try {
      workUnitExecutor.execute(() -> run(checkpoint, status));
    } catch (RejectedExecutionException e) {
      String errorMsg = String.format("Work unit executor is full, rejected %s", workUnitId);
      LOGGER.error(errorMsg, e);
      status.setError(errorMsg);
      status.setState(WorkUnitState.DONE, clock.instant());
      throw new LaunchException(errorMsg, e);
    }
    LOGGER.info("Work unit {} queued", workUnitId);
    return Optional.of(workUnitId);
  }

  /** Run a work unit on the calling thread. */
  public WorkUnitResult run(CallSession checkpoint) {
    WorkUnitStatus status =
        new WorkUnitStatus(
            checkpoint.callId(),
            WorkUnitContext.workUnitId(checkpoint),
            checkpoint.workUnitSequence(),
            clock.instant());
    registry.save(status);
    return run(checkpoint, status);
  }

  WorkUnitResult run(CallSession checkpoint, WorkUnitStatus status) {
    String workUnitId = status.getWorkUnitId();
    StructuredLogger.setCallContext(
        checkpoint.callId(), workUnitId, checkpoint.workUnitSequence());
    try {
      if (checkpoint.workUnitSequence() >= properties.continuity().maxWorkUnits()) {
        STRUCTURED_LOGGER.logRunawayCap(
            checkpoint.workUnitSequence(), properties.continuity().maxWorkUnits());
        status.setError("Work unit cap reached");
        status.setState(WorkUnitState.DONE, clock.instant());
        return WorkUnitResult.of(WorkUnitOutcome.RUNAWAY, checkpoint);
      }
      return execute(checkpoint, status);
    } finally {
      StructuredLogger.clearCallContext();
    }
  }

  private WorkUnitResult execute(CallSession checkpoint, WorkUnitStatus status) {
    CallSession session = checkpoint;
    WorkUnitContext ctx = null;
    try {
      // STARTING
      session = resolveSources(session);
      if (session.isFirstWorkUnit()) {
        HookResult hookResult = customizationHook.customize(session);
        if (hookResult.vetoed()) {
          LOGGER.info("Customization hook declined call {}, not processing it", session.callId());
          transition(status, WorkUnitState.DONE);
          return WorkUnitResult.of(WorkUnitOutcome.VETOED, session);
        }
        session = hookResult.applyTo(session);
        eventSink.callStarted(session);
      } else {
        eventSink.callContinued(session);
      }

      // STREAMING
      ctx = new WorkUnitContext(status.getWorkUnitId(), session, clock.instant());
      transition(status, WorkUnitState.STREAMING);
      StreamingResult streaming = pipeline.stream(ctx);
      status.setRecognitionSessionId(streaming.recognitionSessionId());
      status.setLastFragments(streaming.lastCallerFragment(), streaming.lastAgentFragment());

      if (streaming.deadlineReached()) {
        transition(status, WorkUnitState.TIME_BUDGET_REACHED);
        transition(status, WorkUnitState.FINALIZING);
        uploadRecording(session, streaming.recordingPath());
        return handOff(session, streaming, status);
      }

      transition(status, WorkUnitState.SOURCE_CLOSED);
      transition(status, WorkUnitState.FINALIZING);
      uploadRecording(session, streaming.recordingPath());
      completeCall(session);
      transition(status, WorkUnitState.DONE);
      return WorkUnitResult.of(WorkUnitOutcome.COMPLETED, session);

    } catch (SourceLookupException
        | CustomizationHookException
        | RecognitionException
        | MediaSourceException e) {
      return fail(session, status, ctx, e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return fail(session, status, ctx, "Work unit interrupted", e);
    } catch (RuntimeException e) {
      return fail(session, status, ctx, "Unexpected failure: " + e.getMessage(), e);
    } finally {
      if (ctx != null) {
        ctx.close();
      }
    }
  }

  private CallSession resolveSources(CallSession session) {
    if (session.hasBothSources()) {
      return session;
    }
    ChannelSources sources =
        sourceResolver.resolve(
            session.callId(),
            new ChannelSources(session.callerSourceRef(), session.agentSourceRef()));
    return session.withSources(sources.callerSourceRef(), sources.agentSourceRef());
  }

  private WorkUnitResult handOff(
      CallSession session, StreamingResult streaming, WorkUnitStatus status) {
    CallSession successor =
        session.successor(
            streaming.lastCallerFragment(),
            streaming.lastAgentFragment(),
            streaming.recognitionSessionId());

    if (successor.workUnitSequence() >= properties.continuity().maxWorkUnits()) {
      STRUCTURED_LOGGER.logRunawayCap(
          successor.workUnitSequence(), properties.continuity().maxWorkUnits());
      completeCall(session);
      transition(status, WorkUnitState.DONE);
      return WorkUnitResult.of(WorkUnitOutcome.RUNAWAY, session);
    }

    try {
      launcher.launch(successor);
    } catch (LaunchException e) {
      return fail(session, status, null, e.getMessage(), e);
    }
    STRUCTURED_LOGGER.logContinuationLaunched(
        successor.workUnitSequence(),
        successor.recognitionSessionId(),
        successor.lastCallerFragment(),
        successor.lastAgentFragment());
    transition(status, WorkUnitState.DONE);
    return new WorkUnitResult(WorkUnitOutcome.CONTINUED, session, successor, null);
  }

  private void completeCall(CallSession session) {
    eventSink.callEnded(session);
    if (session.recordingEnabled()) {
      recordingFinalizer
          .merge(session.callId(), session.workUnitSequence())
          .ifPresent(url -> eventSink.recordingUrl(session.callId(), url));
    }
  }

  private void uploadRecording(CallSession session, Path recordingPath) {
    if (recordingPath != null) {
      recordingFinalizer.uploadSegment(session.callId(), session.workUnitSequence(), recordingPath);
    }
  }

  private WorkUnitResult fail(
      CallSession session,
      WorkUnitStatus status,
      WorkUnitContext ctx,
      String message,
      Exception cause) {
    LOGGER.error("Work unit {} failed: {}", status.getWorkUnitId(), message, cause);
    transition(status, WorkUnitState.ERROR);
    status.setError(message);
    eventSink.callFailed(session.callId(), message);

    transition(status, WorkUnitState.FINALIZING);
    if (ctx != null) {
      ctx.close();
      uploadRecording(session, ctx.recordingPath());
    }
    transition(status, WorkUnitState.DONE);
    return new WorkUnitResult(WorkUnitOutcome.FAILED, session, null, message);
  }

  private void transition(WorkUnitStatus status, WorkUnitState next) {
    WorkUnitState previous = status.getState();
    status.setState(next, clock.instant());
    STRUCTURED_LOGGER.logStateTransition(status.getWorkUnitId(), previous.name(), next.name());
  }
}
