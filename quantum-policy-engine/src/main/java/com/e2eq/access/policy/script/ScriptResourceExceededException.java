package com.e2eq.access.policy.script;

import com.e2eq.access.model.decision.DenyReason;

/**
 * A counted limit was hit: operations, call depth, expression depth, string length,
 * array or map size, statements.
 */
public class ScriptResourceExceededException extends ScriptAbortException {

   private final String limit;

   public ScriptResourceExceededException(String limit, String message) {
      super(message);
      this.limit = limit;
   }

   public String getLimit() {
      return limit;
   }

   @Override
   public DenyReason toDenyReason() {
      return DenyReason.scriptResourceExceeded(limit);
   }
}
