package com.scholary.call.transcriber.hook;

import com.scholary.call.transcriber.continuity.CallSession;

/** Used when no hook is configured: every call is processed unchanged. */
public class NoOpCustomizationHook implements CustomizationHook {

  @Override
  public HookResult customize(CallSession call) {
    return HookResult.unchanged();
  }
}
