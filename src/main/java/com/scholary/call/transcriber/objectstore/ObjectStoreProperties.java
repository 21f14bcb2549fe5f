package com.scholary.call.transcriber.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. Leave endpoint and keys empty to
 * talk to real S3 with the default credentials chain; set them to point at MinIO.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    String endpoint,
    String accessKey,
    String secretKey,
    @NotBlank String bucket,
    @NotBlank String region,
    boolean pathStyleAccess) {

  public boolean hasEndpointOverride() {
    return endpoint != null && !endpoint.isBlank();
  }

  public boolean hasStaticCredentials() {
    return accessKey != null && !accessKey.isBlank() && secretKey != null && !secretKey.isBlank();
  }
}
