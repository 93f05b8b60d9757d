package com.e2eq.access.model.decision;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Map;
import java.util.Objects;

/**
 * Machine readable code plus human readable message explaining a denial.
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DenyReason(
        @JsonProperty("code") String code,
        @JsonProperty("message") String message,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("policyId") String policyId
) {
    public static final String POLICY_DENIED = "policy-denied";
    public static final String NO_MATCHING_POLICY = "no-matching-policy";
    public static final String POLICY_ERROR = "policy-error";
    public static final String INSUFFICIENT_SCOPE = "insufficient-scope";
    public static final String SCRIPT_DENIED = "script-denied";
    public static final String SCRIPT_ERROR = "script-error";
    public static final String SCRIPT_TIMEOUT = "script-timeout";
    public static final String SCRIPT_MEMORY_LIMIT = "script-memory-limit";
    public static final String SCRIPT_RESOURCE_EXCEEDED = "script-resource-exceeded";
    public static final String RESOURCE_EXHAUSTED = "resource-exhausted";

    public static final String DEFAULT_POLICY_DENY_MESSAGE = "Access denied by policy";

    public DenyReason {
        Objects.requireNonNull(code, "code cannot be null");
        if (message == null) {
            message = code;
        }
        details = details == null ? null : Map.copyOf(details);
    }

    public DenyReason(String code, String message) {
        this(code, message, null, null);
    }

    public DenyReason withPolicyId(String id) {
        return new DenyReason(code, message, details, id);
    }

    public static DenyReason policyDenied(String message) {
        return new DenyReason(POLICY_DENIED, message != null ? message : DEFAULT_POLICY_DENY_MESSAGE);
    }

    public static DenyReason noMatchingPolicy() {
        return new DenyReason(NO_MATCHING_POLICY, "No policy granted access to this resource");
    }

    public static DenyReason policyError(String detail) {
        return new DenyReason(POLICY_ERROR, "Failed to evaluate access policies",
                detail == null ? null : Map.of("error", detail), null);
    }

    public static DenyReason insufficientScope(String requiredScope) {
        return new DenyReason(INSUFFICIENT_SCOPE, "Insufficient scope for this operation",
                Map.of("required_scope", requiredScope), null);
    }

    public static DenyReason scriptDenied(String message) {
        return new DenyReason(SCRIPT_DENIED, message != null ? message : DEFAULT_POLICY_DENY_MESSAGE);
    }

    public static DenyReason scriptError(String detail) {
        return new DenyReason(SCRIPT_ERROR, "Policy script error",
                detail == null ? null : Map.of("error", detail), null);
    }

    public static DenyReason scriptTimeout(long timeoutMillis) {
        return new DenyReason(SCRIPT_TIMEOUT, "Policy script execution timeout",
                Map.of("timeout_ms", timeoutMillis), null);
    }

    public static DenyReason scriptMemoryLimit(long limitBytes) {
        return new DenyReason(SCRIPT_MEMORY_LIMIT, "Policy script exceeded memory limit",
                Map.of("limit_bytes", limitBytes), null);
    }

    public static DenyReason scriptResourceExceeded(String detail) {
        return new DenyReason(SCRIPT_RESOURCE_EXCEEDED, "Policy script exceeded a resource limit",
                detail == null ? null : Map.of("limit", detail), null);
    }

    public static DenyReason resourceExhausted(String detail) {
        return new DenyReason(RESOURCE_EXHAUSTED, "No script engine available to evaluate policy",
                detail == null ? null : Map.of("error", detail), null);
    }
}
