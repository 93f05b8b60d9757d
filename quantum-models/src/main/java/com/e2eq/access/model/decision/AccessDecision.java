package com.e2eq.access.model.decision;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating one policy or a whole policy set.
 * {@link Effect#ABSTAIN} means the policy did not decide; it is never the final result
 * of an evaluation.
 */
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AccessDecision {

   public enum Effect {
      ALLOW,
      DENY,
      ABSTAIN
   }

   private static final AccessDecision ALLOW = new AccessDecision(Effect.ALLOW, null);
   private static final AccessDecision ABSTAIN = new AccessDecision(Effect.ABSTAIN, null);

   private final Effect effect;
   private final DenyReason reason;

   private AccessDecision(Effect effect, DenyReason reason) {
      this.effect = effect;
      this.reason = reason;
   }

   @JsonCreator
   static AccessDecision of(@JsonProperty("effect") Effect effect, @JsonProperty("reason") DenyReason reason) {
      return switch (effect) {
         case ALLOW -> ALLOW;
         case ABSTAIN -> ABSTAIN;
         case DENY -> deny(reason);
      };
   }

   public static AccessDecision allow() {
      return ALLOW;
   }

   public static AccessDecision abstain() {
      return ABSTAIN;
   }

   public static AccessDecision deny(DenyReason reason) {
      return new AccessDecision(Effect.DENY, Objects.requireNonNull(reason, "deny reason cannot be null"));
   }

   public static AccessDecision deny(String code, String message) {
      return deny(new DenyReason(code, message));
   }

   @JsonProperty("effect")
   public Effect getEffect() {
      return effect;
   }

   @JsonProperty("reason")
   public DenyReason getReason() {
      return reason;
   }

   @JsonIgnore
   public Optional<DenyReason> denyReason() {
      return Optional.ofNullable(reason);
   }

   @JsonIgnore
   public boolean isAllowed() {
      return effect == Effect.ALLOW;
   }

   @JsonIgnore
   public boolean isDenied() {
      return effect == Effect.DENY;
   }

   @JsonIgnore
   public boolean isAbstain() {
      return effect == Effect.ABSTAIN;
   }

   /**
    * Tags a deny with the id of the policy that produced it. Allow and abstain are
    * returned unchanged, as is a deny that already names a policy.
    */
   public AccessDecision attributedTo(String policyId) {
      if (effect != Effect.DENY || reason.policyId() != null) {
         return this;
      }
      return new AccessDecision(Effect.DENY, reason.withPolicyId(policyId));
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof AccessDecision)) return false;
      AccessDecision that = (AccessDecision) o;
      return effect == that.effect && Objects.equals(reason, that.reason);
   }

   @Override
   public int hashCode() {
      return Objects.hash(effect, reason);
   }

   @Override
   public String toString() {
      return reason == null ? effect.name() : effect.name() + "{" + reason.code() + ": " + reason.message() + "}";
   }
}
