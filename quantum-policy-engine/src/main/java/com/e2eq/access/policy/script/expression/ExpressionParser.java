package com.e2eq.access.policy.script.expression;

import com.e2eq.access.grammar.PolicyScriptLexer;
import com.e2eq.access.grammar.PolicyScriptParser;
import com.e2eq.access.policy.script.ScriptExecutionException;
import com.e2eq.access.policy.script.ScriptResourceExceededException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * Parses expression scripts and rejects trees nested deeper than the configured
 * expression depth.
 */
final class ExpressionParser {

   private static final BaseErrorListener FAIL_ON_ERROR = new BaseErrorListener() {
      @Override
      public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                              int charPositionInLine, String msg, RecognitionException e) {
         throw new ScriptExecutionException("Syntax error at " + line + ":" + charPositionInLine + " " + msg, e);
      }
   };

   private ExpressionParser() {
   }

   static PolicyScriptParser.ScriptContext parse(String script, int maxDepth) {
      PolicyScriptLexer lexer = new PolicyScriptLexer(CharStreams.fromString(script));
      lexer.removeErrorListeners();
      lexer.addErrorListener(FAIL_ON_ERROR);
      PolicyScriptParser parser = new PolicyScriptParser(new CommonTokenStream(lexer));
      parser.removeErrorListeners();
      parser.addErrorListener(FAIL_ON_ERROR);

      PolicyScriptParser.ScriptContext tree;
      try {
         tree = parser.script();
         checkDepth(tree, 0, maxDepth);
      } catch (StackOverflowError e) {
         throw new ScriptResourceExceededException("expression-depth", "Script is nested too deeply to parse");
      }
      return tree;
   }

   private static void checkDepth(ParseTree node, int depth, int maxDepth) {
      int current = nests(node) ? depth + 1 : depth;
      if (current > maxDepth) {
         throw new ScriptResourceExceededException("expression-depth",
                 "Expression nesting exceeds the maximum depth of " + maxDepth);
      }
      for (int i = 0; i < node.getChildCount(); i++) {
         checkDepth(node.getChild(i), current, maxDepth);
      }
   }

   // Operator chains such as a + b + c do not count; brackets, blocks, calls and unary operators do.
   private static boolean nests(ParseTree node) {
      return node instanceof PolicyScriptParser.BlockContext
              || node instanceof PolicyScriptParser.ParenthesizedPrimaryContext
              || node instanceof PolicyScriptParser.ArrayPrimaryContext
              || node instanceof PolicyScriptParser.MapPrimaryContext
              || node instanceof PolicyScriptParser.ArgumentsContext
              || node instanceof PolicyScriptParser.IndexExpressionContext
              || node instanceof PolicyScriptParser.UnaryExpressionContext
              || node instanceof PolicyScriptParser.ClosurePrimaryContext;
   }
}
