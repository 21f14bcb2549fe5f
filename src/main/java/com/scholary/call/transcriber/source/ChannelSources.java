package com.scholary.call.transcriber.source;

/**
 * Source references registered for a call so far. Either side may still be missing, since the two
 * parties are registered by independent events.
 */
public record ChannelSources(String callerSourceRef, String agentSourceRef) {

  public static ChannelSources none() {
    return new ChannelSources(null, null);
  }

  public boolean isComplete() {
    return callerSourceRef != null && agentSourceRef != null;
  }

  /** Fill the gaps of this lookup with values from another one. */
  public ChannelSources orElse(ChannelSources other) {
    return new ChannelSources(
        callerSourceRef != null ? callerSourceRef : other.callerSourceRef(),
        agentSourceRef != null ? agentSourceRef : other.agentSourceRef());
  }
}
