package com.e2eq.access.policy.script;

import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.decision.DenyReason;
import org.jboss.logging.Logger;

import java.util.Locale;
import java.util.Map;

/**
 * Maps what a policy script returned onto a decision: {@code true} allows,
 * {@code false} denies, a {@code {decision, reason}} map decides explicitly, anything
 * else abstains.
 */
public final class ScriptResults {

   private static final Logger LOG = Logger.getLogger(ScriptResults.class);

   public static final String DECISION = "decision";
   public static final String REASON = "reason";
   public static final String ALLOW = "allow";
   public static final String DENY = "deny";
   public static final String ABSTAIN = "abstain";

   static final String RETURNED_FALSE = "Policy script returned false";

   private ScriptResults() {
   }

   public static AccessDecision toDecision(Object result) {
      if (result instanceof Boolean b) {
         return fromBoolean(b);
      }
      if (result instanceof Map<?, ?> map && map.get(DECISION) instanceof String decision) {
         Object reason = map.get(REASON);
         return fromDecision(decision, reason instanceof String s ? s : null);
      }
      LOG.debugf("Policy script returned %s, abstaining", result == null ? "nothing" : result.getClass().getSimpleName());
      return AccessDecision.abstain();
   }

   public static AccessDecision fromBoolean(boolean allowed) {
      return allowed ? AccessDecision.allow() : AccessDecision.deny(DenyReason.scriptDenied(RETURNED_FALSE));
   }

   public static AccessDecision fromDecision(String decision, String reason) {
      switch (decision.toLowerCase(Locale.ROOT)) {
         case ALLOW:
            return AccessDecision.allow();
         case DENY:
            return AccessDecision.deny(DenyReason.scriptDenied(reason));
         default:
            return AccessDecision.abstain();
      }
   }
}
