package com.e2eq.access.policy.script;

import com.e2eq.access.model.decision.DenyReason;

public class ScriptMemoryLimitException extends ScriptAbortException {

   private final long limitBytes;

   public ScriptMemoryLimitException(long limitBytes) {
      super("Policy script allocated more than " + limitBytes + " bytes");
      this.limitBytes = limitBytes;
   }

   @Override
   public DenyReason toDenyReason() {
      return DenyReason.scriptMemoryLimit(limitBytes);
   }
}
