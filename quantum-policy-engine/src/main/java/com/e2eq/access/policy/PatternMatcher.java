package com.e2eq.access.policy;

import com.e2eq.access.model.context.EnvironmentContext;
import com.e2eq.access.model.context.FhirReferences;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.context.RequestContext;
import com.e2eq.access.model.context.ResourceContext;
import com.e2eq.access.model.context.UserIdentity;
import com.e2eq.access.model.fhir.FhirOperation;
import com.e2eq.access.model.policy.CompartmentMatcher;
import com.e2eq.access.model.policy.MatchPattern;
import com.e2eq.access.model.policy.PolicyMatcher;
import com.e2eq.access.util.WildCardMatcher;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.net.InetAddresses;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.net.InetAddress;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a policy's {@link PolicyMatcher} selects a request. Every field that
 * is set must match; unset or empty fields are ignored. Compiled regular expressions
 * (client regex patterns and path globs) are cached by their source.
 */
@ApplicationScoped
public class PatternMatcher {

   private static final Logger LOG = Logger.getLogger(PatternMatcher.class);

   public static final String ANY = "*";
   static final String PATIENT = "Patient";
   static final String PRACTITIONER = "Practitioner";
   static final String ENCOUNTER = "Encounter";

   private final Cache<String, Optional<Pattern>> regexCache = CacheBuilder.newBuilder()
           .maximumSize(1024)
           .build();

   public boolean matches(PolicyMatcher matcher, PolicyContext context) {
      if (matcher == null) {
         return true;
      }
      return matchesClients(matcher.getClients(), context)
              && matchesRoles(matcher.getRoles(), context)
              && matchesUserTypes(matcher.getUserTypes(), context)
              && matchesResourceTypes(matcher.getResourceTypes(), context.getRequest())
              && matchesOperations(matcher.getOperations(), context.getRequest())
              && matchesOperationIds(matcher.getOperationIds(), context.getRequest())
              && matchesPaths(matcher.getPaths(), context.getRequest())
              && matchesSourceIps(matcher.getSourceIps(), context.getEnvironment())
              && matchesCompartments(matcher.getCompartments(), context)
              && matchesRequiredScopes(matcher.getRequiredScopes(), context);
   }

   private static boolean unset(List<?> values) {
      return values == null || values.isEmpty();
   }

   boolean matchesClients(List<MatchPattern> patterns, PolicyContext context) {
      if (unset(patterns)) {
         return true;
      }
      String clientId = context.getClient().getId();
      return clientId != null && patterns.stream().anyMatch(p -> matchesPattern(p, clientId));
   }

   boolean matchesRoles(List<String> roles, PolicyContext context) {
      if (unset(roles)) {
         return true;
      }
      return context.user().map(u -> roles.stream().anyMatch(u::hasRole)).orElse(false);
   }

   boolean matchesUserTypes(List<String> userTypes, PolicyContext context) {
      if (unset(userTypes)) {
         return true;
      }
      Optional<String> type = context.user().map(UserIdentity::getFhirUserType);
      return type.isPresent() && (userTypes.contains(type.get()) || userTypes.contains(ANY));
   }

   boolean matchesResourceTypes(List<String> resourceTypes, RequestContext request) {
      if (unset(resourceTypes)) {
         return true;
      }
      return resourceTypes.contains(ANY) || resourceTypes.contains(request.getResourceType());
   }

   boolean matchesOperations(List<String> operations, RequestContext request) {
      if (unset(operations)) {
         return true;
      }
      FhirOperation op = request.getOperation();
      return op != null && operations.stream().anyMatch(code -> FhirOperation.expand(code).contains(op));
   }

   boolean matchesOperationIds(List<String> patterns, RequestContext request) {
      if (unset(patterns)) {
         return true;
      }
      String operationId = request.getOperationId();
      if (operationId == null) {
         return false;
      }
      return patterns.stream().anyMatch(p -> matchesOperationId(p, operationId));
   }

   static boolean matchesOperationId(String pattern, String operationId) {
      if (ANY.equals(pattern)) {
         return true;
      }
      if (pattern.endsWith(".*")) {
         return operationId.startsWith(pattern.substring(0, pattern.length() - 1));
      }
      return pattern.equals(operationId);
   }

   boolean matchesPaths(List<String> globs, RequestContext request) {
      if (unset(globs)) {
         return true;
      }
      String path = request.getPath();
      return path != null && globs.stream().anyMatch(g -> matchesGlob(g, path));
   }

   boolean matchesSourceIps(List<String> cidrs, EnvironmentContext environment) {
      if (unset(cidrs)) {
         return true;
      }
      String sourceIp = environment.getSourceIp();
      if (sourceIp == null || !InetAddresses.isInetAddress(sourceIp)) {
         return false;
      }
      InetAddress address = InetAddresses.forString(sourceIp);
      return cidrs.stream().anyMatch(c -> inCidr(c, address));
   }

   boolean matchesCompartments(List<CompartmentMatcher> compartments, PolicyContext context) {
      if (unset(compartments)) {
         return true;
      }
      return compartments.stream().allMatch(c -> matchesCompartment(c, context));
   }

   boolean matchesRequiredScopes(List<String> scopes, PolicyContext context) {
      if (unset(scopes)) {
         return true;
      }
      return scopes.stream().allMatch(context.getScopes()::contains);
   }

   // patterns

   public boolean matchesPattern(MatchPattern pattern, String value) {
      switch (pattern.type()) {
         case EXACT:
            return value.equals(pattern.value());
         case PREFIX:
            return value.startsWith(pattern.value());
         case SUFFIX:
            return value.endsWith(pattern.value());
         case REGEX:
            return compiled(pattern.value()).map(p -> p.matcher(value).find()).orElse(false);
         case WILDCARD:
            return ANY.equals(pattern.value()) || WildCardMatcher.wildcardMatch(value, pattern.value());
         default:
            return false;
      }
   }

   /**
    * {@code **} spans segments, {@code *} stays within one segment, {@code ?} is one
    * character; the whole path must match.
    */
   public boolean matchesGlob(String glob, String path) {
      return compiled(globToRegex(glob)).map(p -> p.matcher(path).matches()).orElse(false);
   }

   static String globToRegex(String glob) {
      StringBuilder regex = new StringBuilder("^");
      for (int i = 0; i < glob.length(); i++) {
         char c = glob.charAt(i);
         if (c == '*') {
            if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
               regex.append(".*");
               i++;
            } else {
               regex.append("[^/]*");
            }
         } else if (c == '?') {
            regex.append('.');
         } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
            regex.append('\\').append(c);
         } else {
            regex.append(c);
         }
      }
      return regex.append('$').toString();
   }

   private Optional<Pattern> compiled(String regex) {
      Optional<Pattern> pattern = regexCache.getIfPresent(regex);
      if (pattern == null) {
         try {
            pattern = Optional.of(Pattern.compile(regex));
         } catch (PatternSyntaxException e) {
            LOG.warnf("Ignoring invalid pattern '%s': %s", regex, e.getDescription());
            pattern = Optional.empty();
         }
         regexCache.put(regex, pattern);
      }
      return pattern;
   }

   /**
    * True when {@code address} lies in {@code cidr}. A bare address matches only
    * itself; malformed blocks match nothing.
    */
   public static boolean inCidr(String cidr, InetAddress address) {
      int slash = cidr.indexOf('/');
      String network = slash < 0 ? cidr : cidr.substring(0, slash);
      if (!InetAddresses.isInetAddress(network)) {
         return false;
      }
      byte[] net = InetAddresses.forString(network).getAddress();
      byte[] addr = address.getAddress();
      if (net.length != addr.length) {
         return false;
      }
      int prefix;
      try {
         prefix = slash < 0 ? net.length * 8 : Integer.parseInt(cidr.substring(slash + 1));
      } catch (NumberFormatException e) {
         return false;
      }
      if (prefix < 0 || prefix > net.length * 8) {
         return false;
      }
      int fullBytes = prefix / 8;
      for (int i = 0; i < fullBytes; i++) {
         if (net[i] != addr[i]) {
            return false;
         }
      }
      int remaining = prefix % 8;
      if (remaining == 0) {
         return true;
      }
      int mask = (0xFF << (8 - remaining)) & 0xFF;
      return (net[fullBytes] & mask) == (addr[fullBytes] & mask);
   }

   public static boolean isValidCidr(String cidr) {
      if (cidr == null) {
         return false;
      }
      int slash = cidr.indexOf('/');
      String network = slash < 0 ? cidr : cidr.substring(0, slash);
      if (!InetAddresses.isInetAddress(network)) {
         return false;
      }
      if (slash < 0) {
         return true;
      }
      try {
         int prefix = Integer.parseInt(cidr.substring(slash + 1));
         return prefix >= 0 && prefix <= InetAddresses.forString(network).getAddress().length * 8;
      } catch (NumberFormatException e) {
         return false;
      }
   }

   // compartments

   boolean matchesCompartment(CompartmentMatcher matcher, PolicyContext context) {
      String ownerId = compartmentOwner(matcher, context);
      return ownerId != null && inCompartment(matcher.compartmentType(), ownerId, context);
   }

   static String compartmentOwner(CompartmentMatcher matcher, PolicyContext context) {
      String type = matcher.compartmentType();
      switch (matcher.source().type()) {
         case LAUNCH_CONTEXT:
            if (PATIENT.equals(type)) {
               return context.getEnvironment().getPatientContext();
            }
            if (ENCOUNTER.equals(type)) {
               return context.getEnvironment().getEncounterContext();
            }
            return null;
         case USER_RESOURCE:
            return context.user()
                    .filter(u -> type.equals(u.getFhirUserType()))
                    .map(UserIdentity::getFhirUserId)
                    .orElse(null);
         case FIXED:
            return matcher.source().value();
         case REQUEST_PARAM:
            return context.getRequest().getQueryParams() == null ? null
                    : context.getRequest().getQueryParams().get(matcher.source().param());
         default:
            return null;
      }
   }

   static boolean inCompartment(String type, String ownerId, PolicyContext context) {
      RequestContext request = context.getRequest();
      Optional<ResourceContext> resource = context.resource();
      boolean targetsOwner = type.equals(request.getResourceType()) && ownerId.equals(request.getResourceId());
      boolean requestCompartment = type.equals(request.getCompartmentType()) && ownerId.equals(request.getCompartmentId());

      if (PATIENT.equals(type)) {
         return resource.map(r -> FhirReferences.refersTo(r.getSubject(), PATIENT, ownerId)).orElse(false)
                 || targetsOwner
                 || requestCompartment;
      }
      if (PRACTITIONER.equals(type)) {
         return resource.map(r -> FhirReferences.refersTo(r.getAuthor(), PRACTITIONER, ownerId)).orElse(false)
                 || targetsOwner;
      }
      return requestCompartment;
   }
}
