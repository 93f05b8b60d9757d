package com.e2eq.access.policy;

import com.e2eq.access.exceptions.ConfigurationException;
import com.e2eq.access.model.fhir.FhirOperation;
import com.e2eq.access.model.policy.AccessPolicy;
import com.e2eq.access.model.policy.CompartmentMatcher;
import com.e2eq.access.model.policy.MatchPattern;
import com.e2eq.access.model.policy.PolicyMatcher;
import com.e2eq.access.model.policy.ScriptEngineSpec;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.policy.script.ScriptAbortException;
import com.e2eq.access.policy.script.expression.ExpressionScriptEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks policies before they are stored or loaded. Expression scripts are also
 * parsed when an {@link ExpressionScriptEngine} is available.
 */
@ApplicationScoped
public class PolicyValidator {

   public static final Set<String> USER_TYPES = Set.of(
           "Patient", "Practitioner", "PractitionerRole", "RelatedPerson", "Person", PatternMatcher.ANY);

   private final ExpressionScriptEngine expressions;

   @Inject
   public PolicyValidator(ExpressionScriptEngine expressions) {
      this.expressions = expressions;
   }

   public PolicyValidator() {
      this(null);
   }

   /**
    * @return every problem found, empty when the policy is valid
    */
   public List<String> validate(AccessPolicy policy) {
      List<String> violations = new ArrayList<>();
      if (StringUtils.isBlank(policy.getId())) {
         violations.add("id is required");
      }
      if (StringUtils.isBlank(policy.getName())) {
         violations.add("name is required");
      }
      if (policy.getPriority() < AccessPolicy.MIN_PRIORITY || policy.getPriority() > AccessPolicy.MAX_PRIORITY) {
         violations.add("priority must be between " + AccessPolicy.MIN_PRIORITY + " and "
                 + AccessPolicy.MAX_PRIORITY + ", was " + policy.getPriority());
      }
      if (policy.getEngine() == null) {
         violations.add("engine is required");
      } else if (policy.getEngine() instanceof ScriptEngineSpec script) {
         validateScript(script, violations);
      }
      if (policy.getMatcher() != null) {
         validateMatcher(policy.getMatcher(), violations);
      }
      return violations;
   }

   /**
    * @throws ConfigurationException listing every violation
    */
   public void requireValid(AccessPolicy policy) {
      List<String> violations = validate(policy);
      if (!violations.isEmpty()) {
         throw new ConfigurationException("Invalid policy '" + policy.getId() + "'", violations);
      }
   }

   /**
    * Validates a whole policy set, including id uniqueness.
    */
   public void requireValid(Collection<AccessPolicy> policies) {
      List<String> violations = new ArrayList<>();
      Set<String> ids = new HashSet<>();
      for (AccessPolicy policy : policies) {
         String label = policy.getId() == null ? "<no id>" : policy.getId();
         for (String v : validate(policy)) {
            violations.add(label + ": " + v);
         }
         if (policy.getId() != null && !ids.add(policy.getId())) {
            violations.add(label + ": duplicate policy id");
         }
      }
      if (!violations.isEmpty()) {
         throw new ConfigurationException("Invalid policy set", violations);
      }
   }

   private void validateScript(ScriptEngineSpec script, List<String> violations) {
      if (StringUtils.isBlank(script.script())) {
         violations.add("script is required for script engines");
         return;
      }
      if (script.language() == ScriptLanguage.EXPRESSION && expressions != null) {
         try {
            expressions.compile(script.script());
         } catch (ScriptAbortException e) {
            violations.add("script does not compile: " + e.getMessage());
         }
      }
   }

   private static void validateMatcher(PolicyMatcher matcher, List<String> violations) {
      if (matcher.getOperations() != null) {
         Set<String> known = FhirOperation.matcherCodes();
         for (String op : matcher.getOperations()) {
            if (op == null || !known.contains(op)) {
               violations.add("unknown operation '" + op + "'");
            }
         }
      }
      if (matcher.getUserTypes() != null) {
         for (String type : matcher.getUserTypes()) {
            if (!USER_TYPES.contains(type)) {
               violations.add("unknown user type '" + type + "'");
            }
         }
      }
      if (matcher.getSourceIps() != null) {
         for (String cidr : matcher.getSourceIps()) {
            if (!PatternMatcher.isValidCidr(cidr)) {
               violations.add("invalid CIDR '" + cidr + "'");
            }
         }
      }
      if (matcher.getClients() != null) {
         for (MatchPattern pattern : matcher.getClients()) {
            if (pattern.type() == MatchPattern.Kind.REGEX) {
               checkRegex(pattern.value(), "client pattern", violations);
            }
         }
      }
      if (matcher.getPaths() != null) {
         for (String path : matcher.getPaths()) {
            if (StringUtils.isBlank(path)) {
               violations.add("path patterns cannot be blank");
            }
         }
      }
      if (matcher.getCompartments() != null) {
         for (CompartmentMatcher compartment : matcher.getCompartments()) {
            validateCompartment(compartment, violations);
         }
      }
   }

   private static void validateCompartment(CompartmentMatcher compartment, List<String> violations) {
      if (StringUtils.isBlank(compartment.compartmentType())) {
         violations.add("compartment type is required");
      }
      if (compartment.source() == null) {
         violations.add("compartment source is required");
         return;
      }
      switch (compartment.source().type()) {
         case FIXED:
            if (StringUtils.isBlank(compartment.source().value())) {
               violations.add("fixed compartment source needs a value");
            }
            break;
         case REQUEST_PARAM:
            if (StringUtils.isBlank(compartment.source().param())) {
               violations.add("request-param compartment source needs a param");
            }
            break;
         default:
            break;
      }
   }

   private static void checkRegex(String regex, String what, List<String> violations) {
      try {
         Pattern.compile(regex);
      } catch (PatternSyntaxException e) {
         violations.add("invalid " + what + " regex '" + regex + "': " + e.getDescription());
      }
   }
}
