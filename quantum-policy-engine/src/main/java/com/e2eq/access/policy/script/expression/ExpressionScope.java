package com.e2eq.access.policy.script.expression;

import com.e2eq.access.policy.script.ScriptExecutionException;

import java.util.HashMap;
import java.util.Map;

/**
 * Lexical variable scope; lookups fall through to the parent.
 */
final class ExpressionScope {

   private static final class Variable {
      Object value;
      final boolean constant;

      Variable(Object value, boolean constant) {
         this.value = value;
         this.constant = constant;
      }
   }

   private final ExpressionScope parent;
   private final Map<String, Variable> variables = new HashMap<>();

   ExpressionScope(ExpressionScope parent) {
      this.parent = parent;
   }

   /**
    * Declares {@code name} in this scope, shadowing any outer declaration.
    */
   void define(String name, Object value, boolean constant) {
      variables.put(name, new Variable(value, constant));
   }

   boolean isDefined(String name) {
      return find(name) != null;
   }

   Object get(String name) {
      Variable v = find(name);
      if (v == null) {
         throw new ScriptExecutionException("Variable not found: " + name);
      }
      return v.value;
   }

   void assign(String name, Object value) {
      Variable v = find(name);
      if (v == null) {
         throw new ScriptExecutionException("Variable not found: " + name);
      }
      if (v.constant) {
         throw new ScriptExecutionException("Cannot assign to constant " + name);
      }
      v.value = value;
   }

   private Variable find(String name) {
      for (ExpressionScope s = this; s != null; s = s.parent) {
         Variable v = s.variables.get(name);
         if (v != null) {
            return v;
         }
      }
      return null;
   }
}
