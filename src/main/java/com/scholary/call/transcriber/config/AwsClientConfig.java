package com.scholary.call.transcriber.config;

import com.scholary.call.transcriber.recognition.RecognitionProperties;
import java.net.URI;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesisvideo.KinesisVideoClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.transcribestreaming.TranscribeStreamingAsyncClient;
import software.amazon.awssdk.services.transcribestreaming.TranscribeStreamingAsyncClientBuilder;

/** AWS SDK clients, all in one region and on the default credentials chain. */
@Configuration
@EnableConfigurationProperties(AwsProperties.class)
public class AwsClientConfig {

  @Bean
  public Region awsRegion(AwsProperties properties) {
    return Region.of(properties.region());
  }

  @Bean
  public AwsCredentialsProvider awsCredentialsProvider() {
    return DefaultCredentialsProvider.create();
  }

  @Bean(destroyMethod = "close")
  public TranscribeStreamingAsyncClient transcribeStreamingAsyncClient(
      Region region, AwsCredentialsProvider credentials, RecognitionProperties recognition) {
    TranscribeStreamingAsyncClientBuilder builder =
        TranscribeStreamingAsyncClient.builder().region(region).credentialsProvider(credentials);
    if (recognition.endpoint() != null && !recognition.endpoint().isBlank()) {
      builder.endpointOverride(URI.create(recognition.endpoint()));
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  public KinesisVideoClient kinesisVideoClient(Region region, AwsCredentialsProvider credentials) {
    return KinesisVideoClient.builder().region(region).credentialsProvider(credentials).build();
  }

  @Bean(destroyMethod = "close")
  public KinesisClient kinesisClient(Region region, AwsCredentialsProvider credentials) {
    return KinesisClient.builder().region(region).credentialsProvider(credentials).build();
  }

  @Bean(destroyMethod = "close")
  public DynamoDbClient dynamoDbClient(Region region, AwsCredentialsProvider credentials) {
    return DynamoDbClient.builder().region(region).credentialsProvider(credentials).build();
  }

  @Bean(destroyMethod = "close")
  public LambdaClient lambdaClient(Region region, AwsCredentialsProvider credentials) {
    return LambdaClient.builder().region(region).credentialsProvider(credentials).build();
  }
}
