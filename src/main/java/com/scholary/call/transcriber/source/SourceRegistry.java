package com.scholary.call.transcriber.source;

/** Store where the media sources of each call party are registered as they appear. */
public interface SourceRegistry {

  /**
   * Look up whatever is registered for the call right now.
   *
   * @throws SourceLookupException if the store cannot be queried
   */
  ChannelSources lookup(String callId);
}
