package com.scholary.call.transcriber.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.call.transcriber.api.AllowAllRequestVerifier;
import com.scholary.call.transcriber.api.RequestVerifier;
import com.scholary.call.transcriber.api.SecurityProperties;
import com.scholary.call.transcriber.api.SharedSecretRequestVerifier;
import com.scholary.call.transcriber.audio.PcmFormat;
import com.scholary.call.transcriber.continuity.ContinuityController;
import com.scholary.call.transcriber.continuity.LambdaWorkUnitLauncher;
import com.scholary.call.transcriber.continuity.LocalWorkUnitLauncher;
import com.scholary.call.transcriber.continuity.WorkUnitLauncher;
import com.scholary.call.transcriber.events.EventLog;
import com.scholary.call.transcriber.events.EventLogProperties;
import com.scholary.call.transcriber.events.KinesisEventLog;
import com.scholary.call.transcriber.hook.CustomizationHook;
import com.scholary.call.transcriber.hook.HookProperties;
import com.scholary.call.transcriber.hook.LambdaCustomizationHook;
import com.scholary.call.transcriber.hook.NoOpCustomizationHook;
import com.scholary.call.transcriber.recognition.RecognitionProperties;
import com.scholary.call.transcriber.recognition.RecognitionService;
import com.scholary.call.transcriber.recognition.TranscribeRecognitionService;
import com.scholary.call.transcriber.source.ChannelSources;
import com.scholary.call.transcriber.source.DynamoDbSourceRegistry;
import com.scholary.call.transcriber.source.KinesisVideoMediaSource;
import com.scholary.call.transcriber.source.MediaSource;
import com.scholary.call.transcriber.source.MediaSourceProperties;
import com.scholary.call.transcriber.source.SourceRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesisvideo.KinesisVideoClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.transcribestreaming.TranscribeStreamingAsyncClient;

/**
 * Wires the pipeline's ports to their adapters.
 *
 * <p>Optional collaborators (source table, customization hook, Lambda relaunch, shared-secret
 * verification) fall back to a local implementation when their setting is empty.
 */
@Configuration
@EnableConfigurationProperties({
  TranscriberProperties.class,
  RecognitionProperties.class,
  EventLogProperties.class,
  MediaSourceProperties.class,
  HookProperties.class,
  SecurityProperties.class
})
public class PipelineConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PcmFormat pcmFormat(TranscriberProperties properties) {
    return new PcmFormat(properties.sync().sampleRateHertz());
  }

  @Bean
  public RecognitionService recognitionService(
      TranscribeStreamingAsyncClient client, RecognitionProperties properties, PcmFormat format) {
    LOGGER.info(
        "Recognition: mode={}, language={}, redaction={}",
        properties.mode(),
        properties.languageCode(),
        properties.redactionApplies());
    return new TranscribeRecognitionService(client, properties, format);
  }

  @Bean
  public EventLog eventLog(KinesisClient kinesisClient, EventLogProperties properties) {
    return new KinesisEventLog(kinesisClient, properties.streamName());
  }

  @Bean
  public MediaSource mediaSource(
      KinesisVideoClient kinesisVideoClient, Region region, AwsCredentialsProvider credentials) {
    return new KinesisVideoMediaSource(kinesisVideoClient, region, credentials);
  }

  @Bean
  public SourceRegistry sourceRegistry(
      MediaSourceProperties properties, ObjectProvider<DynamoDbClient> dynamoDbClient) {
    if (!properties.hasSourceTable()) {
      LOGGER.info("No source table configured, calls must name both sources");
      return callId -> ChannelSources.none();
    }
    return new DynamoDbSourceRegistry(dynamoDbClient.getObject(), properties.sourceTable());
  }

  @Bean
  public CustomizationHook customizationHook(
      HookProperties properties,
      ObjectProvider<LambdaClient> lambdaClient,
      ObjectMapper objectMapper) {
    if (!properties.isEnabled()) {
      return new NoOpCustomizationHook();
    }
    LOGGER.info("Customization hook enabled: {}", properties.functionArn());
    return new LambdaCustomizationHook(
        lambdaClient.getObject(), objectMapper, properties.functionArn());
  }

  @Bean
  public WorkUnitLauncher workUnitLauncher(
      TranscriberProperties properties,
      ObjectProvider<ContinuityController> controller,
      ObjectProvider<LambdaClient> lambdaClient,
      ObjectMapper objectMapper) {
    TranscriberProperties.Continuity continuity = properties.continuity();
    if (continuity.launcher() == TranscriberProperties.LauncherType.LAMBDA) {
      if (continuity.functionArn() == null || continuity.functionArn().isBlank()) {
        throw new IllegalStateException(
            "transcriber.continuity.functionArn is required when the launcher is LAMBDA");
      }
      return new LambdaWorkUnitLauncher(
          lambdaClient.getObject(), objectMapper, continuity.functionArn());
    }
    return new LocalWorkUnitLauncher(controller);
  }

  @Bean
  public RequestVerifier requestVerifier(SecurityProperties properties) {
    if (properties.hasSharedSecret()) {
      return new SharedSecretRequestVerifier(properties.sharedSecret());
    }
    return new AllowAllRequestVerifier();
  }
}
