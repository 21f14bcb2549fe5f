package com.scholary.call.transcriber.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller and agent sources of a call.
 *
 * <p>References already known are kept. Missing ones are polled from the registry with a fixed
 * backoff until both are present or the attempts run out.
 */
@Component
public class SourceResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourceResolver.class);

  private final SourceRegistry registry;
  private final MediaSourceProperties properties;

  public SourceResolver(SourceRegistry registry, MediaSourceProperties properties) {
    this.registry = registry;
    this.properties = properties;
  }

  /**
   * @param callId the call to resolve
   * @param known references the caller already has, either may be null
   * @return both references
   * @throws SourceLookupException if a reference is still missing after the last attempt
   */
  public ChannelSources resolve(String callId, ChannelSources known) {
    ChannelSources sources = known;
    int maxAttempts = properties.lookupAttempts();
    int attempt = 0;

    while (!sources.isComplete() && attempt < maxAttempts) {
      attempt++;
      try {
        sources = sources.orElse(registry.lookup(callId));
      } catch (SourceLookupException e) {
        LOGGER.warn(
            "Source lookup attempt {}/{} failed for call {}: {}",
            attempt,
            maxAttempts,
            callId,
            e.getMessage());
      }
      if (!sources.isComplete() && attempt < maxAttempts) {
        sleep(callId);
      }
    }

    if (!sources.isComplete()) {
      String errorMsg =
          String.format(
              "Sources for call %s not registered after %d attempts: caller=%s, agent=%s",
              callId, maxAttempts, sources.callerSourceRef(), sources.agentSourceRef());
      LOGGER.error(errorMsg);
      throw new SourceLookupException(errorMsg);
    }
    if (attempt > 0) {
      LOGGER.info("Resolved sources for call {} after {} lookups", callId, attempt);
    }
    return sources;
  }

  private void sleep(String callId) {
    try {
      Thread.sleep(properties.lookupBackoff().toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SourceLookupException("Interrupted while resolving sources for call " + callId, e);
    }
  }
}
