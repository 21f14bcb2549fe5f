package com.scholary.call.transcriber.sync;

import com.scholary.call.transcriber.audio.InterleavedFrame;

/** Receives the synchronizer's output, one frame at a time, in order. */
@FunctionalInterface
public interface FrameSink {

  void accept(InterleavedFrame frame);

  /** While true the synchronizer leaves audio in the channel buffers instead of emitting it. */
  default boolean isBackedUp() {
    return false;
  }
}
