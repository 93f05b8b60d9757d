package com.e2eq.access.policy.script;

import com.e2eq.access.model.decision.DenyReason;

/**
 * Every script slot stayed busy for the whole checkout wait.
 */
public class ScriptSlotUnavailableException extends ScriptAbortException {

   public ScriptSlotUnavailableException(String message) {
      super(message);
   }

   @Override
   public DenyReason toDenyReason() {
      return DenyReason.resourceExhausted(getMessage());
   }
}
