package com.scholary.call.transcriber.config;

import com.scholary.call.transcriber.objectstore.ObjectStoreClient;
import com.scholary.call.transcriber.objectstore.ObjectStoreProperties;
import com.scholary.call.transcriber.objectstore.S3ObjectStoreClient;
import com.scholary.call.transcriber.recording.RecordingProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Raw segments and merged recordings share the bucket from {@code objectstore.bucket}.
 */
@Configuration
@EnableConfigurationProperties({ObjectStoreProperties.class, RecordingProperties.class})
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
