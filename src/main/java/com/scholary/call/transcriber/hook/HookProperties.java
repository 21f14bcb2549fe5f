package com.scholary.call.transcriber.hook;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** The hook is disabled when {@code functionArn} is empty. */
@ConfigurationProperties(prefix = "hook")
public record HookProperties(String functionArn) {

  public boolean isEnabled() {
    return functionArn != null && !functionArn.isBlank();
  }
}
