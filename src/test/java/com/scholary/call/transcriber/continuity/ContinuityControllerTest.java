package com.scholary.call.transcriber.continuity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.call.transcriber.config.TranscriberProperties;
import com.scholary.call.transcriber.events.EventSink;
import com.scholary.call.transcriber.hook.CustomizationHook;
import com.scholary.call.transcriber.hook.HookResult;
import com.scholary.call.transcriber.recognition.RecognitionException;
import com.scholary.call.transcriber.recording.RecordingFinalizer;
import com.scholary.call.transcriber.registry.WorkUnitRegistry;
import com.scholary.call.transcriber.registry.WorkUnitStatus;
import com.scholary.call.transcriber.source.ChannelSources;
import com.scholary.call.transcriber.source.SourceLookupException;
import com.scholary.call.transcriber.source.SourceResolver;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class ContinuityControllerTest {

  private static final int MAX_WORK_UNITS = 30;
  private static final Path RECORDING = Path.of("/tmp/call-1-0.raw");

  @Mock private SourceResolver sourceResolver;
  @Mock private CustomizationHook customizationHook;
  @Mock private EventSink eventSink;
  @Mock private WorkUnitPipeline pipeline;
  @Mock private RecordingFinalizer recordingFinalizer;
  @Mock private WorkUnitLauncher launcher;
  @Mock private ObjectProvider<ContinuityController> controllerProvider;

  private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

  private WorkUnitRegistry registry;
  private ContinuityController controller;

  @BeforeEach
  void setUp() {
    registry = new WorkUnitRegistry(100, 60);
    controller = controller(Runnable::run);
  }

  @Test
  void run_shouldLaunchExactlyOneSuccessorWhenDeadlineIsReached() throws Exception {
    when(customizationHook.customize(any())).thenReturn(HookResult.unchanged());
    when(pipeline.stream(any())).thenReturn(streaming(true));

    WorkUnitResult result = controller.run(newCall());

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.CONTINUED);
    ArgumentCaptor<CallSession> successor = ArgumentCaptor.forClass(CallSession.class);
    verify(launcher).launch(successor.capture());
    assertThat(successor.getValue().workUnitSequence()).isEqualTo(1);
    assertThat(successor.getValue().recognitionSessionId()).isEqualTo("s-1");
    assertThat(successor.getValue().lastCallerFragment()).isEqualTo("111");
    assertThat(successor.getValue().lastAgentFragment()).isEqualTo("222");
    assertThat(result.successor()).isEqualTo(successor.getValue());
    verify(eventSink).callStarted(any());
    verify(recordingFinalizer).uploadSegment("call-1", 0, RECORDING);
    verify(eventSink, never()).callEnded(any());
    verify(recordingFinalizer, never()).merge(anyString(), anyInt());
    assertThat(registry.findByCallId("call-1").map(WorkUnitStatus::getState))
        .contains(WorkUnitState.DONE);
  }

  @Test
  void run_shouldEndCallAndMergeRecordingWhenSourcesClose() throws Exception {
    when(customizationHook.customize(any())).thenReturn(HookResult.unchanged());
    when(pipeline.stream(any())).thenReturn(streaming(false));
    when(recordingFinalizer.merge("call-1", 0))
        .thenReturn(Optional.of("https://bucket.s3.us-east-1.amazonaws.com/call-1.wav"));

    WorkUnitResult result = controller.run(newCall());

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.COMPLETED);
    verify(eventSink).callEnded(argThat(ended -> ended.callId().equals("call-1")));
    verify(eventSink)
        .recordingUrl("call-1", "https://bucket.s3.us-east-1.amazonaws.com/call-1.wav");
    verifyNoInteractions(launcher);
  }

  @Test
  void run_shouldNotMergeWhenRecordingIsDisabled() throws Exception {
    when(customizationHook.customize(any()))
        .thenReturn(new HookResult(null, null, null, null, null, null, null, false));
    when(pipeline.stream(any())).thenReturn(streaming(false));

    controller.run(newCall());

    verify(eventSink).callEnded(argThat(ended -> ended.callId().equals("call-1")));
    verify(recordingFinalizer, never()).merge(anyString(), anyInt());
  }

  @Test
  void run_shouldContinueCallWithoutHookOrStartEvent() throws Exception {
    when(pipeline.stream(any())).thenReturn(streaming(false));
    CallSession checkpoint = newCall().successor("100", "200", "s-0");

    WorkUnitResult result = controller.run(checkpoint);

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.COMPLETED);
    verifyNoInteractions(customizationHook);
    verify(eventSink, never()).callStarted(any());
    verify(eventSink).callContinued(checkpoint);
    verify(recordingFinalizer).merge("call-1", 1);
  }

  @Test
  void run_shouldWriteOneErrorEventWhenRecognitionCannotStart() throws Exception {
    when(customizationHook.customize(any())).thenReturn(HookResult.unchanged());
    when(pipeline.stream(any())).thenThrow(new RecognitionException("start failed"));

    WorkUnitResult result = controller.run(newCall());

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.FAILED);
    assertThat(result.error()).isEqualTo("start failed");
    verify(eventSink).callFailed("call-1", "start failed");
    verify(eventSink, never()).callEnded(any());
    verifyNoInteractions(launcher);
  }

  @Test
  void run_shouldFailWhenSourcesCannotBeResolved() {
    when(sourceResolver.resolve(eq("call-1"), any()))
        .thenThrow(new SourceLookupException("not registered"));
    CallSession call = CallSession.newCall("call-1", null, null, "+1", "+2", null, null);

    WorkUnitResult result = controller.run(call);

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.FAILED);
    verify(eventSink).callFailed("call-1", "not registered");
    verifyNoInteractions(pipeline, customizationHook);
  }

  @Test
  void run_shouldApplySourceSwapBeforeStreaming() throws Exception {
    when(sourceResolver.resolve(eq("call-1"), any()))
        .thenReturn(new ChannelSources("stream-a", "stream-b"));
    when(customizationHook.customize(any()))
        .thenReturn(new HookResult(null, false, null, null, null, null, null, null));
    when(pipeline.stream(any())).thenReturn(streaming(false));

    controller.run(CallSession.newCall("call-1", null, null, "+1", "+2", null, null));

    ArgumentCaptor<WorkUnitContext> ctx = ArgumentCaptor.forClass(WorkUnitContext.class);
    verify(pipeline).stream(ctx.capture());
    assertThat(ctx.getValue().session().callerSourceRef()).isEqualTo("stream-b");
    assertThat(ctx.getValue().session().agentSourceRef()).isEqualTo("stream-a");
  }

  @Test
  void run_shouldStopWithoutEventsWhenHookVetoes() {
    when(customizationHook.customize(any()))
        .thenReturn(new HookResult(null, null, null, null, null, null, false, null));

    WorkUnitResult result = controller.run(newCall());

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.VETOED);
    verifyNoInteractions(eventSink, pipeline, launcher);
  }

  @Test
  void run_shouldRefuseWorkUnitBeyondCap() {
    CallSession checkpoint = checkpointAt(MAX_WORK_UNITS);

    WorkUnitResult result = controller.run(checkpoint);

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.RUNAWAY);
    verifyNoInteractions(eventSink, pipeline, launcher, recordingFinalizer);
  }

  @Test
  void run_shouldFinalizeInsteadOfLaunchingPastCap() throws Exception {
    when(pipeline.stream(any())).thenReturn(streaming(true));
    CallSession checkpoint = checkpointAt(MAX_WORK_UNITS - 1);

    WorkUnitResult result = controller.run(checkpoint);

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.RUNAWAY);
    verifyNoInteractions(launcher);
    verify(eventSink).callEnded(argThat(ended -> ended.callId().equals("call-1")));
    verify(recordingFinalizer).merge("call-1", MAX_WORK_UNITS - 1);
  }

  @Test
  void run_shouldFailWhenSuccessorCannotBeLaunched() throws Exception {
    when(customizationHook.customize(any())).thenReturn(HookResult.unchanged());
    when(pipeline.stream(any())).thenReturn(streaming(true));
    doThrow(new LaunchException("queue full")).when(launcher).launch(any());

    WorkUnitResult result = controller.run(newCall());

    assertThat(result.outcome()).isEqualTo(WorkUnitOutcome.FAILED);
    verify(eventSink).callFailed("call-1", "queue full");
    verify(eventSink, never()).callEnded(any());
  }

  @Test
  void submit_shouldCarryCallAcrossTwoWorkUnitsThroughLocalLauncher() throws Exception {
    ExecutorService workUnits = Executors.newSingleThreadExecutor();
    WorkUnitLauncher localLauncher = spy(new LocalWorkUnitLauncher(controllerProvider));
    ContinuityController chained =
        new ContinuityController(
            sourceResolver,
            customizationHook,
            eventSink,
            pipeline,
            recordingFinalizer,
            localLauncher,
            registry,
            properties(),
            workUnits,
            clock);
    when(controllerProvider.getObject()).thenReturn(chained);
    when(customizationHook.customize(any())).thenReturn(HookResult.unchanged());
    List<CallSession> streamed = new CopyOnWriteArrayList<>();
    when(pipeline.stream(any()))
        .thenAnswer(
            invocation -> {
              CallSession session = invocation.<WorkUnitContext>getArgument(0).session();
              streamed.add(session);
              return session.workUnitSequence() == 0
                  ? streaming(true)
                  : new StreamingResult("333", "444", "s-1", false, RECORDING, 50, List.of());
            });

    try {
      assertThat(chained.submit(newCall())).contains("call-1#0");

      verify(eventSink, timeout(5_000)).callEnded(any());
    } finally {
      workUnits.shutdown();
    }

    assertThat(workUnits.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    verify(localLauncher, times(1)).launch(any());
    assertThat(streamed).extracting(CallSession::workUnitSequence).containsExactly(0, 1);
    assertThat(streamed.get(1).lastCallerFragment()).isEqualTo("111");
    assertThat(streamed.get(1).lastAgentFragment()).isEqualTo("222");
    assertThat(streamed.get(1).recognitionSessionId()).isEqualTo("s-1");
    verify(recordingFinalizer).uploadSegment("call-1", 0, RECORDING);
    verify(recordingFinalizer).uploadSegment("call-1", 1, RECORDING);
    verify(recordingFinalizer, times(1)).merge(anyString(), anyInt());
    verify(recordingFinalizer).merge("call-1", 1);
    verify(eventSink, times(1)).callStarted(any());
    verify(eventSink, times(1)).callContinued(any());
    verify(eventSink, times(1))
        .callEnded(argThat(ended -> ended.workUnitSequence() == 1));
    verify(eventSink, never()).callFailed(anyString(), anyString());
    assertThat(registry.findByCallId("call-1").map(WorkUnitStatus::getSequence)).contains(1);
    assertThat(registry.findByCallId("call-1").map(WorkUnitStatus::getState))
        .contains(WorkUnitState.DONE);
  }

  @Test
  void submit_shouldRejectSecondWorkUnitForActiveCall() {
    controller = controller(runnable -> {});

    assertThat(controller.submit(newCall())).contains("call-1#0");
    assertThat(controller.submit(newCall())).isEmpty();
  }

  @Test
  void submit_shouldRunQueuedWorkUnit() throws Exception {
    when(customizationHook.customize(any())).thenReturn(HookResult.unchanged());
    when(pipeline.stream(any())).thenReturn(streaming(false));

    assertThat(controller.submit(newCall())).contains("call-1#0");

    verify(eventSink).callEnded(argThat(ended -> ended.callId().equals("call-1")));
  }

  @Test
  void submit_shouldReportFullExecutor() {
    controller =
        controller(
            runnable -> {
              throw new RejectedExecutionException("full");
            });

    assertThatThrownBy(() -> controller.submit(newCall())).isInstanceOf(LaunchException.class);
    assertThat(registry.findByCallId("call-1").map(WorkUnitStatus::isActive)).contains(false);
  }

  private ContinuityController controller(Executor executor) {
    return new ContinuityController(
        sourceResolver,
        customizationHook,
        eventSink,
        pipeline,
        recordingFinalizer,
        launcher,
        registry,
        properties(),
        executor,
        clock);
  }

  private static CallSession newCall() {
    return CallSession.newCall("call-1", "caller", "agent", "+15550001", "+15550002", null, null);
  }

  private static CallSession checkpointAt(int sequence) {
    CallSession session = newCall();
    while (session.workUnitSequence() < sequence) {
      session = session.successor("1", "2", "s-9");
    }
    return session;
  }

  private static StreamingResult streaming(boolean deadlineReached) {
    return new StreamingResult("111", "222", "s-1", deadlineReached, RECORDING, 100, List.of());
  }

  private static TranscriberProperties properties() {
    return new TranscriberProperties(
        "/tmp/transcriber",
        2,
        10,
        new TranscriberProperties.Demux(
            Duration.ofMinutes(5), "AUDIO_FROM_CUSTOMER", "AUDIO_TO_CUSTOMER", 64),
        new TranscriberProperties.Sync(Duration.ofMillis(200), 8000, Duration.ofSeconds(2)),
        new TranscriberProperties.KeepAlive(Duration.ofSeconds(10)),
        new TranscriberProperties.Continuity(
            Duration.ofMinutes(15),
            Duration.ofMinutes(3),
            Duration.ofSeconds(30),
            MAX_WORK_UNITS,
            TranscriberProperties.LauncherType.LOCAL,
            null));
  }
}
