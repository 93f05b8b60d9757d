package com.e2eq.access.policy.audit;

/**
 * Receives one event per access decision. Implementations must not block the caller
 * for long and must not throw; failures are logged and otherwise ignored.
 */
public interface AuditService {

   void record(AccessDecisionEvent event);
}
