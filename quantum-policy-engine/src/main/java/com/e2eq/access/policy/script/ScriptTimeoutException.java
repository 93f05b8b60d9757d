package com.e2eq.access.policy.script;

import com.e2eq.access.model.decision.DenyReason;
import com.e2eq.access.util.Deadline;

import java.time.Duration;

/**
 * The script ran out of time. {@code timeoutMillis} is the budget the run actually had:
 * the engine timeout, or less when the caller's deadline was closer.
 */
public class ScriptTimeoutException extends ScriptAbortException {

   private final long timeoutMillis;

   public ScriptTimeoutException(long timeoutMillis) {
      super("Policy script did not finish within " + timeoutMillis + " ms");
      this.timeoutMillis = timeoutMillis;
   }

   /**
    * Milliseconds a run starting now may take: the engine timeout capped by what is left
    * of {@code deadline}.
    */
   public static long budgetMillis(Duration engineTimeout, Deadline deadline) {
      return Math.max(0L, Math.min(engineTimeout.toMillis(), deadline.remainingMillis()));
   }

   public long getTimeoutMillis() {
      return timeoutMillis;
   }

   @Override
   public DenyReason toDenyReason() {
      return DenyReason.scriptTimeout(timeoutMillis);
   }
}
