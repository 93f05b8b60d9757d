package com.e2eq.access.policy;

import com.e2eq.access.exceptions.ConfigurationException;
import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.model.json.JSONUtils;
import com.e2eq.access.model.policy.AccessPolicy;
import com.e2eq.access.policy.store.PolicyStore;
import com.e2eq.access.util.ResourceLocations;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.List;

/**
 * Reads a JSON array of policies, validates the whole set and stores it.
 */
@ApplicationScoped
public class JsonPolicyLoader {

   private static final Logger LOG = Logger.getLogger(JsonPolicyLoader.class);

   private static final TypeReference<List<AccessPolicy>> POLICY_LIST = new TypeReference<>() {
   };

   private final PolicyValidator validator;

   @Inject
   public JsonPolicyLoader(PolicyValidator validator) {
      this.validator = validator;
   }

   /**
    * @throws ConfigurationException when the document is not a valid policy array
    */
   public List<AccessPolicy> parse(String json) {
      List<AccessPolicy> policies;
      try {
         policies = JSONUtils.instance().mapper().readValue(json, POLICY_LIST);
      } catch (JsonProcessingException e) {
         throw new ConfigurationException("Malformed policy document: " + e.getOriginalMessage(), e);
      }
      if (policies == null) {
         throw new ConfigurationException("Policy document is empty");
      }
      validator.requireValid(policies);
      return policies;
   }

   public List<AccessPolicy> load(String location) throws IOException {
      return parse(ResourceLocations.readString(location));
   }

   /**
    * Loads {@code location} and saves every policy into {@code store}.
    *
    * @return the number of policies stored
    */
   public int loadInto(String location, PolicyStore store) throws IOException, StorageUnavailableException {
      List<AccessPolicy> policies = load(location);
      for (AccessPolicy policy : policies) {
         store.save(policy);
      }
      LOG.infof("Loaded %d access policies from %s", policies.size(), location);
      return policies.size();
   }
}
