package com.scholary.call.transcriber.audio;

/**
 * The party a channel of audio belongs to.
 *
 * <p>Channel 0 of every interleaved frame is the caller, channel 1 is the agent.
 */
public enum ChannelRole {
  CALLER(0),
  AGENT(1);

  private final int channelIndex;

  ChannelRole(int channelIndex) {
    this.channelIndex = channelIndex;
  }

  public int channelIndex() {
    return channelIndex;
  }

  public ChannelRole other() {
    return this == CALLER ? AGENT : CALLER;
  }
}
