package com.e2eq.access.policy.script;

import com.e2eq.access.model.decision.DenyReason;

/**
 * Aborts a running policy script. Never escapes {@link ScriptSandboxPool}; each
 * subclass maps to the deny reason reported for the policy.
 */
public abstract class ScriptAbortException extends RuntimeException {

   protected ScriptAbortException(String message) {
      super(message);
   }

   protected ScriptAbortException(String message, Throwable cause) {
      super(message, cause);
   }

   public abstract DenyReason toDenyReason();
}
