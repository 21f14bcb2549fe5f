package com.scholary.call.transcriber.hook;

import com.scholary.call.transcriber.continuity.CallSession;

/**
 * Synchronous hook invoked once per call before streaming starts. It may rename the call, swap the
 * two parties, set participant details or veto processing.
 */
public interface CustomizationHook {

  /**
   * @throws CustomizationHookException if the hook fails; the call then ends with an ERROR event
   */
  HookResult customize(CallSession call);
}
