package com.e2eq.access.policy.script.expression;

import com.e2eq.access.grammar.PolicyScriptParser;

import java.util.List;

/**
 * An anonymous function {@code |x, y| body} together with the scope it was created in.
 */
record ExpressionClosure(List<String> parameters, PolicyScriptParser.ExpressionContext body, ExpressionScope captured) {

   @Override
   public String toString() {
      return "Fn(" + String.join(", ", parameters) + ")";
   }
}
