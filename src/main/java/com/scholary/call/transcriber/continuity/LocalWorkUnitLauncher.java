package com.scholary.call.transcriber.continuity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;

/** Runs successors on this instance's work-unit executor. */
public class LocalWorkUnitLauncher implements WorkUnitLauncher {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalWorkUnitLauncher.class);

  private final ObjectProvider<ContinuityController> controller;

  public LocalWorkUnitLauncher(ObjectProvider<ContinuityController> controller) {
    this.controller = controller;
  }

  @Override
  public void launch(CallSession checkpoint) {
    String workUnitId =
        controller
            .getObject()
            .submit(checkpoint)
            .orElseThrow(
                () ->
                    new LaunchException(
                        String.format(
                            "Call %s already has a work unit at sequence %d or later",
                            checkpoint.callId(), checkpoint.workUnitSequence())));
    LOGGER.debug("Queued successor work unit {}", workUnitId);
  }
}
