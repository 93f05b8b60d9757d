package com.e2eq.access.policy.audit;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Writes access decisions to the {@code access-audit} logger: denials at info, allows
 * at debug.
 */
@ApplicationScoped
@DefaultBean
public class LoggingAuditService implements AuditService {

   private static final Logger AUDIT = Logger.getLogger("access-audit");

   @Override
   public void record(AccessDecisionEvent event) {
      if (event.getDecision().isDenied()) {
         AUDIT.infof("DENY %s %s/%s client=%s user=%s code=%s policy=%s request=%s (%d us)",
                 event.getOperation(), event.getResourceType(), event.getResourceId(),
                 event.getClientId(), event.getUserId(), event.getDecision().getReason().code(),
                 event.getDecidingPolicyId(), event.getRequestId(), event.getEvaluationMicros());
      } else if (AUDIT.isDebugEnabled()) {
         AUDIT.debugf("%s %s %s/%s client=%s user=%s policies=%d request=%s (%d us)",
                 event.getDecision().getEffect(), event.getOperation(), event.getResourceType(),
                 event.getResourceId(), event.getClientId(), event.getUserId(),
                 event.getEvaluatedPolicies().size(), event.getRequestId(), event.getEvaluationMicros());
      }
   }
}
