package com.e2eq.access.policy.store;

import com.e2eq.access.model.fhir.FhirOperation;
import com.e2eq.access.model.policy.AccessPolicy;
import com.e2eq.access.model.policy.PolicyMatcher;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process local policy store. Replaced by any other {@link PolicyStore} bean.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryPolicyStore implements PolicyStore {

   private final Map<String, AccessPolicy> policies = new ConcurrentHashMap<>();

   public InMemoryPolicyStore() {
   }

   public InMemoryPolicyStore(Collection<AccessPolicy> initial) {
      initial.forEach(this::save);
   }

   @Override
   public List<AccessPolicy> findApplicable(String resourceType, FhirOperation operation) {
      return policies.values().stream()
              .filter(AccessPolicy::isActive)
              .filter(p -> mayApply(p.getMatcher(), resourceType, operation))
              .collect(Collectors.toList());
   }

   // coarse prefilter on resource type and operation only
   private static boolean mayApply(PolicyMatcher matcher, String resourceType, FhirOperation operation) {
      if (matcher == null) {
         return true;
      }
      List<String> types = matcher.getResourceTypes();
      if (types != null && !types.isEmpty() && !types.contains("*") && !types.contains(resourceType)) {
         return false;
      }
      List<String> ops = matcher.getOperations();
      return ops == null || ops.isEmpty() || operation == null
              || ops.stream().anyMatch(code -> FhirOperation.expand(code).contains(operation));
   }

   @Override
   public List<AccessPolicy> findAll() {
      return new ArrayList<>(policies.values());
   }

   @Override
   public Optional<AccessPolicy> findById(String id) {
      return Optional.ofNullable(policies.get(id));
   }

   @Override
   public void save(AccessPolicy policy) {
      Objects.requireNonNull(policy.getId(), "policy id cannot be null");
      policies.put(policy.getId(), policy);
   }

   @Override
   public boolean delete(String id) {
      return policies.remove(id) != null;
   }

   public void clear() {
      policies.clear();
   }
}
