package com.scholary.call.transcriber.source;

import java.io.InputStream;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kinesisvideo.KinesisVideoClient;
import software.amazon.awssdk.services.kinesisvideo.model.APIName;
import software.amazon.awssdk.services.kinesisvideo.model.GetDataEndpointRequest;
import software.amazon.awssdk.services.kinesisvideomedia.KinesisVideoMediaClient;
import software.amazon.awssdk.services.kinesisvideomedia.model.GetMediaRequest;
import software.amazon.awssdk.services.kinesisvideomedia.model.StartSelector;
import software.amazon.awssdk.services.kinesisvideomedia.model.StartSelectorType;

/**
 * Opens Kinesis Video streams with {@code GetMedia}.
 *
 * <p>A source reference starting with {@code arn:} is used as a stream ARN, anything else as a
 * stream name. Media clients are cached per data endpoint.
 */
public class KinesisVideoMediaSource implements MediaSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(KinesisVideoMediaSource.class);

  private final KinesisVideoClient kinesisVideo;
  private final Region region;
  private final AwsCredentialsProvider credentialsProvider;
  private final Map<String, KinesisVideoMediaClient> mediaClients = new ConcurrentHashMap<>();

  public KinesisVideoMediaSource(
      KinesisVideoClient kinesisVideo, Region region, AwsCredentialsProvider credentialsProvider) {
    this.kinesisVideo = kinesisVideo;
    this.region = region;
    this.credentialsProvider = credentialsProvider;
  }

  @Override
  public InputStream open(String sourceRef, String resumeAfterFragment) {
    boolean isArn = sourceRef.startsWith("arn:");
    try {
      GetDataEndpointRequest.Builder endpointRequest =
          GetDataEndpointRequest.builder().apiName(APIName.GET_MEDIA);
      if (isArn) {
        endpointRequest.streamARN(sourceRef);
      } else {
        endpointRequest.streamName(sourceRef);
      }
      String endpoint = kinesisVideo.getDataEndpoint(endpointRequest.build()).dataEndpoint();

      StartSelector startSelector =
          resumeAfterFragment == null
              ? StartSelector.builder().startSelectorType(StartSelectorType.NOW).build()
              : StartSelector.builder()
                  .startSelectorType(StartSelectorType.FRAGMENT_NUMBER)
                  .afterFragmentNumber(resumeAfterFragment)
                  .build();

      GetMediaRequest.Builder mediaRequest = GetMediaRequest.builder().startSelector(startSelector);
      if (isArn) {
        mediaRequest.streamARN(sourceRef);
      } else {
        mediaRequest.streamName(sourceRef);
      }

      InputStream stream = mediaClient(endpoint).getMedia(mediaRequest.build());
      LOGGER.info(
          "Opened media source {} at {}",
          sourceRef,
          resumeAfterFragment == null ? "NOW" : "fragment " + resumeAfterFragment);
      return stream;

    } catch (SdkException e) {
      String errorMsg = String.format("Failed to open media source %s", sourceRef);
      LOGGER.error(errorMsg, e);
      throw new MediaSourceException(errorMsg, e);
    }
  }

  private KinesisVideoMediaClient mediaClient(String endpoint) {
    return mediaClients.computeIfAbsent(
        endpoint,
        url ->
            KinesisVideoMediaClient.builder()
                .endpointOverride(URI.create(url))
                .region(region)
                .credentialsProvider(credentialsProvider)
                .build());
  }
}
