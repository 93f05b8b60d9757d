package com.e2eq.access.policy.script;

import com.e2eq.access.model.decision.DenyReason;

/**
 * Syntax errors, type errors, unknown functions and explicit {@code throw}s.
 */
public class ScriptExecutionException extends ScriptAbortException {

   public ScriptExecutionException(String message) {
      super(message);
   }

   public ScriptExecutionException(String message, Throwable cause) {
      super(message, cause);
   }

   @Override
   public DenyReason toDenyReason() {
      return DenyReason.scriptError(getMessage());
   }
}
