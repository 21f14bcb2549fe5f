package com.scholary.call.transcriber.recognition;

import com.scholary.call.transcriber.audio.PcmFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.transcribestreaming.TranscribeStreamingAsyncClient;
import software.amazon.awssdk.services.transcribestreaming.model.AudioStream;
import software.amazon.awssdk.services.transcribestreaming.model.ChannelDefinition;
import software.amazon.awssdk.services.transcribestreaming.model.ConfigurationEvent;
import software.amazon.awssdk.services.transcribestreaming.model.ContentRedactionType;
import software.amazon.awssdk.services.transcribestreaming.model.MediaEncoding;
import software.amazon.awssdk.services.transcribestreaming.model.ParticipantRole;
import software.amazon.awssdk.services.transcribestreaming.model.PostCallAnalyticsSettings;
import software.amazon.awssdk.services.transcribestreaming.model.StartCallAnalyticsStreamTranscriptionRequest;
import software.amazon.awssdk.services.transcribestreaming.model.StartCallAnalyticsStreamTranscriptionResponseHandler;
import software.amazon.awssdk.services.transcribestreaming.model.StartStreamTranscriptionRequest;
import software.amazon.awssdk.services.transcribestreaming.model.StartStreamTranscriptionResponseHandler;

/**
 * {@link RecognitionService} backed by Amazon Transcribe streaming.
 *
 * <p>Audio is sent as 16-bit little-endian stereo PCM, caller on channel 0 and agent on channel 1.
 * In standard mode the service identifies channels itself; in analytics mode a configuration
 * event maps the channels to participant roles before the first audio event.
 */
public class TranscribeRecognitionService implements RecognitionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscribeRecognitionService.class);

  private final TranscribeStreamingAsyncClient client;
  private final RecognitionProperties properties;
  private final PcmFormat format;

  public TranscribeRecognitionService(
      TranscribeStreamingAsyncClient client, RecognitionProperties properties, PcmFormat format) {
    this.client = client;
    this.properties = properties;
    this.format = format;
  }

  @Override
  public RecognitionSession start(
      RecognitionRequest request, AudioPipe audio, RecognitionListener listener) {
    CompletableFuture<String> sessionId = new CompletableFuture<>();
    CompletableFuture<Void> completion;

    if (properties.mode() == RecognitionProperties.Mode.ANALYTICS) {
      completion = startAnalytics(request, audio, listener, sessionId);
    } else {
      completion = startStandard(request, audio, listener, sessionId);
    }

    // A start that fails before the response arrives surfaces through the session id future
    completion.whenComplete(
        (ignored, error) -> {
          if (error != null) {
            sessionId.completeExceptionally(error);
          }
        });

    try {
      String id = sessionId.get(properties.startTimeout().toMillis(), TimeUnit.MILLISECONDS);
      return new RecognitionSession(id, completion);
    } catch (TimeoutException e) {
      completion.cancel(true);
      throw new RecognitionException(
          String.format(
              "Recognition service did not accept the session within %s",
              properties.startTimeout()),
          e);
    } catch (ExecutionException e) {
      String errorMsg =
          String.format("Recognition service rejected the session for call %s", request.callId());
      LOGGER.error(errorMsg, e.getCause());
      throw new RecognitionException(errorMsg, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      completion.cancel(true);
      throw new RecognitionException("Interrupted while starting recognition session", e);
    }
  }

  private CompletableFuture<Void> startStandard(
      RecognitionRequest request,
      AudioPipe audio,
      RecognitionListener listener,
      CompletableFuture<String> sessionId) {
    StartStreamTranscriptionRequest.Builder builder =
        StartStreamTranscriptionRequest.builder()
            .languageCode(properties.languageCode())
            .mediaEncoding(MediaEncoding.PCM)
            .mediaSampleRateHertz(format.sampleRateHertz())
            .numberOfChannels(PcmFormat.CHANNELS)
            .enableChannelIdentification(true)
            .sessionId(request.resumeSessionId());
    if (properties.redactionApplies()) {
      builder.contentRedactionType(ContentRedactionType.PII);
      if (hasText(properties.contentRedaction().piiEntityTypes())) {
        builder.piiEntityTypes(properties.contentRedaction().piiEntityTypes());
      }
    }
    if (hasText(properties.vocabularyName())) {
      builder.vocabularyName(properties.vocabularyName());
    }
    if (hasText(properties.languageModelName())) {
      builder.languageModelName(properties.languageModelName());
    }

    StartStreamTranscriptionResponseHandler handler =
        StartStreamTranscriptionResponseHandler.builder()
            .onResponse(response -> sessionId.complete(response.sessionId()))
            .onError(error -> reportError(sessionId, listener, error))
            .onComplete(listener::onComplete)
            .subscriber(
                event ->
                    TranscribeResultMapper.fromTranscriptStream(event).forEach(listener::onResult))
            .build();

    return client.startStreamTranscription(
        builder.build(), new AudioPipePublisher(audio, null, request.audioExecutor()), handler);
  }

  private CompletableFuture<Void> startAnalytics(
      RecognitionRequest request,
      AudioPipe audio,
      RecognitionListener listener,
      CompletableFuture<String> sessionId) {
    StartCallAnalyticsStreamTranscriptionRequest.Builder builder =
        StartCallAnalyticsStreamTranscriptionRequest.builder()
            .languageCode(properties.languageCode())
            .mediaEncoding(MediaEncoding.PCM)
            .mediaSampleRateHertz(format.sampleRateHertz())
            .sessionId(request.resumeSessionId());
    if (properties.redactionApplies()) {
      builder.contentRedactionType(ContentRedactionType.PII);
      if (hasText(properties.contentRedaction().piiEntityTypes())) {
        builder.piiEntityTypes(properties.contentRedaction().piiEntityTypes());
      }
    }
    if (hasText(properties.vocabularyName())) {
      builder.vocabularyName(properties.vocabularyName());
    }
    if (hasText(properties.languageModelName())) {
      builder.languageModelName(properties.languageModelName());
    }

    StartCallAnalyticsStreamTranscriptionResponseHandler handler =
        StartCallAnalyticsStreamTranscriptionResponseHandler.builder()
            .onResponse(response -> sessionId.complete(response.sessionId()))
            .onError(error -> reportError(sessionId, listener, error))
            .onComplete(listener::onComplete)
            .subscriber(
                event ->
                    TranscribeResultMapper.fromAnalyticsStream(event).forEach(listener::onResult))
            .build();

    AudioPipePublisher publisher =
        new AudioPipePublisher(audio, analyticsConfiguration(), request.audioExecutor());
    return client.startCallAnalyticsStreamTranscription(builder.build(), publisher, handler);
  }

  AudioStream analyticsConfiguration() {
    ConfigurationEvent.Builder configuration =
        AudioStream.configurationEventBuilder()
            .channelDefinitions(
                ChannelDefinition.builder()
                    .channelId(0)
                    .participantRole(ParticipantRole.CUSTOMER)
                    .build(),
                ChannelDefinition.builder()
                    .channelId(1)
                    .participantRole(ParticipantRole.AGENT)
                    .build());
    RecognitionProperties.PostCallAnalytics postCall = properties.postCallAnalytics();
    if (postCall.enabled()) {
      PostCallAnalyticsSettings.Builder settings =
          PostCallAnalyticsSettings.builder()
              .outputLocation(postCall.outputLocation())
              .dataAccessRoleArn(postCall.dataAccessRoleArn());
      if (hasText(postCall.redactionOutput())) {
        settings.contentRedactionOutput(postCall.redactionOutput());
      }
      configuration.postCallAnalyticsSettings(settings.build());
    }
    return configuration.build();
  }

  /** Errors before the session was accepted belong to the start attempt, not to the listener. */
  private static void reportError(
      CompletableFuture<String> sessionId, RecognitionListener listener, Throwable error) {
    if (sessionId.isDone()) {
      listener.onError(error);
    } else {
      sessionId.completeExceptionally(error);
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
