package com.scholary.call.transcriber.continuity;

/** Starts the successor of a work unit from its checkpoint. Returns without waiting for it. */
public interface WorkUnitLauncher {

  /**
   * @throws LaunchException if the successor could not be started
   */
  void launch(CallSession checkpoint);
}
