package com.e2eq.access.policy.script.expression;

import com.e2eq.access.policy.script.ScriptExecutionException;
import com.e2eq.access.policy.script.ScriptResults;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global functions available to expression scripts.
 */
final class ExpressionBuiltins {

   static final Logger SCRIPT_LOG = Logger.getLogger("policy-script");

   @FunctionalInterface
   interface Builtin {
      Object apply(List<Object> args);
   }

   private static final Map<String, Builtin> FUNCTIONS = new HashMap<>();

   static {
      FUNCTIONS.put("allow", args -> {
         arity("allow", args, 0, 0);
         return decision(ScriptResults.ALLOW, null);
      });
      FUNCTIONS.put("deny", args -> {
         arity("deny", args, 0, 1);
         return decision(ScriptResults.DENY, args.isEmpty() ? null : ExpressionValues.display(args.get(0)));
      });
      FUNCTIONS.put("abstain", args -> {
         arity("abstain", args, 0, 0);
         return decision(ScriptResults.ABSTAIN, null);
      });
      FUNCTIONS.put("has_role", args -> {
         arity("has_role", args, 2, 2);
         return roles(args.get(0)).contains(args.get(1));
      });
      FUNCTIONS.put("has_any_role", args -> {
         arity("has_any_role", args, 2, 2);
         List<?> held = roles(args.get(0));
         if (!(args.get(1) instanceof List<?> wanted)) {
            throw new ScriptExecutionException("has_any_role expects an array of roles");
         }
         return wanted.stream().anyMatch(held::contains);
      });
      FUNCTIONS.put("is_patient_user", args -> {
         arity("is_patient_user", args, 1, 1);
         return "Patient".equals(member(args.get(0), "fhirUserType"));
      });
      FUNCTIONS.put("is_practitioner_user", args -> {
         arity("is_practitioner_user", args, 1, 1);
         return "Practitioner".equals(member(args.get(0), "fhirUserType"));
      });
      FUNCTIONS.put("get_resource_subject", args -> {
         arity("get_resource_subject", args, 1, 1);
         return member(args.get(0), "subject");
      });
      FUNCTIONS.put("in_patient_compartment", args -> {
         arity("in_patient_compartment", args, 1, 1);
         return inPatientCompartment(args.get(0));
      });
      FUNCTIONS.put("type_of", args -> {
         arity("type_of", args, 1, 1);
         return ExpressionValues.typeOf(args.get(0));
      });
      FUNCTIONS.put("parse_int", args -> {
         arity("parse_int", args, 1, 1);
         String text = ExpressionValues.requireString(args.get(0), "parse_int");
         try {
            return Long.parseLong(text.trim());
         } catch (NumberFormatException e) {
            throw new ScriptExecutionException("Cannot parse '" + text + "' as an integer");
         }
      });
      FUNCTIONS.put("parse_float", args -> {
         arity("parse_float", args, 1, 1);
         String text = ExpressionValues.requireString(args.get(0), "parse_float");
         try {
            return Double.parseDouble(text.trim());
         } catch (NumberFormatException e) {
            throw new ScriptExecutionException("Cannot parse '" + text + "' as a float");
         }
      });
      FUNCTIONS.put("print", args -> {
         SCRIPT_LOG.info(join(args));
         return null;
      });
      FUNCTIONS.put("debug", args -> {
         SCRIPT_LOG.debug(join(args));
         return null;
      });
   }

   private ExpressionBuiltins() {
   }

   static Builtin lookup(String name) {
      return FUNCTIONS.get(name);
   }

   /**
    * True when the launch patient owns the request compartment or the subject of the
    * targeted resource.
    */
   static boolean inPatientCompartment(Object context) {
      Object patient = member(member(context, "environment"), "patientContext");
      if (!(patient instanceof String patientId)) {
         return false;
      }
      Object request = member(context, "request");
      if ("Patient".equals(member(request, "compartmentType"))) {
         Object compartmentId = member(request, "compartmentId");
         if (patientId.equals(compartmentId) || patientId.equals("Patient/" + compartmentId)) {
            return true;
         }
      }
      Object subject = member(member(context, "resource"), "subject");
      return subject instanceof String s && (s.equals(patientId) || s.endsWith("/" + patientId));
   }

   private static Map<String, Object> decision(String decision, String reason) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put(ScriptResults.DECISION, decision);
      if (reason != null) {
         map.put(ScriptResults.REASON, reason);
      }
      return map;
   }

   private static List<?> roles(Object user) {
      return member(user, "roles") instanceof List<?> roles ? roles : List.of();
   }

   private static Object member(Object map, String key) {
      return map instanceof Map<?, ?> m ? m.get(key) : null;
   }

   private static String join(List<Object> args) {
      StringBuilder sb = new StringBuilder();
      for (Object arg : args) {
         if (sb.length() > 0) {
            sb.append(' ');
         }
         sb.append(ExpressionValues.display(arg));
      }
      return sb.toString();
   }

   private static void arity(String name, List<Object> args, int min, int max) {
      if (args.size() < min || args.size() > max) {
         throw new ScriptExecutionException("Function " + name + " called with " + args.size() + " argument(s)");
      }
   }
}
