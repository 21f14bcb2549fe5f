package com.scholary.call.transcriber.api;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** An empty shared secret turns request verification off. */
@ConfigurationProperties(prefix = "security")
public record SecurityProperties(String sharedSecret) {

  public boolean hasSharedSecret() {
    return sharedSecret != null && !sharedSecret.isEmpty();
  }
}
