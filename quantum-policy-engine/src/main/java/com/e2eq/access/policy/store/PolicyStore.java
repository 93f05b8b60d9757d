package com.e2eq.access.policy.store;

import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.model.fhir.FhirOperation;
import com.e2eq.access.model.policy.AccessPolicy;

import java.util.List;
import java.util.Optional;

/**
 * Source of access policies. {@link #findApplicable} may return more than what
 * applies; the evaluator still runs every policy's matcher.
 */
public interface PolicyStore {

   /**
    * Policies that may apply to {@code operation} on {@code resourceType}, in any order.
    */
   List<AccessPolicy> findApplicable(String resourceType, FhirOperation operation) throws StorageUnavailableException;

   List<AccessPolicy> findAll() throws StorageUnavailableException;

   Optional<AccessPolicy> findById(String id) throws StorageUnavailableException;

   /**
    * Inserts or replaces the policy with the same id.
    */
   void save(AccessPolicy policy) throws StorageUnavailableException;

   boolean delete(String id) throws StorageUnavailableException;
}
