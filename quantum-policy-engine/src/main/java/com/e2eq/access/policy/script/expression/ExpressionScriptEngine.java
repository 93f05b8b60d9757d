package com.e2eq.access.policy.script.expression;

import com.e2eq.access.config.PolicyEngineConfig;
import com.e2eq.access.grammar.PolicyScriptParser;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.policy.script.PolicyScriptEngine;
import com.e2eq.access.policy.script.ScriptAbortException;
import com.e2eq.access.policy.script.ScriptBindings;
import com.e2eq.access.policy.script.ScriptResourceExceededException;
import com.e2eq.access.policy.script.ScriptResults;
import com.e2eq.access.policy.script.ScriptTimeoutException;
import com.e2eq.access.util.Deadline;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Runs policy scripts written in the embedded expression language on the calling
 * thread. Parsed scripts are cached by source text; every run gets a fresh
 * interpreter, so nothing leaks from one evaluation to the next.
 */
@ApplicationScoped
public class ExpressionScriptEngine implements PolicyScriptEngine {

   private static final Logger LOG = Logger.getLogger(ExpressionScriptEngine.class);

   private final ExpressionLimits limits;
   private final Duration timeout;
   private final Cache<String, PolicyScriptParser.ScriptContext> parsed;

   @Inject
   public ExpressionScriptEngine(PolicyEngineConfig config) {
      this(ExpressionLimits.from(config.script()), config.script().expressionTimeout(),
              config.script().parsedScriptCacheSize());
   }

   public ExpressionScriptEngine(ExpressionLimits limits, Duration timeout, int cacheSize) {
      this.limits = limits;
      this.timeout = timeout;
      this.parsed = CacheBuilder.newBuilder().maximumSize(cacheSize).build();
   }

   @Override
   public ScriptLanguage language() {
      return ScriptLanguage.EXPRESSION;
   }

   @Override
   public Duration timeout() {
      return timeout;
   }

   public ExpressionLimits limits() {
      return limits;
   }

   @Override
   public AccessDecision evaluate(String script, PolicyContext context, Deadline deadline) throws ScriptAbortException {
      long budgetMillis = ScriptTimeoutException.budgetMillis(timeout, deadline);
      PolicyScriptParser.ScriptContext tree = parse(script);
      ExpressionInterpreter interpreter = new ExpressionInterpreter(limits, deadline.limitedTo(timeout), budgetMillis);
      Object result;
      try {
         result = interpreter.run(tree, ScriptBindings.of(context));
      } catch (StackOverflowError e) {
         throw new ScriptResourceExceededException("call-levels", "Script recursion exhausted the stack");
      }
      if (LOG.isTraceEnabled()) {
         LOG.tracef("Expression script finished after %d operations", interpreter.operations());
      }
      return ScriptResults.toDecision(result);
   }

   /**
    * Parses {@code script} without running it.
    *
    * @throws ScriptAbortException when the script does not parse or nests too deeply
    */
   public void compile(String script) throws ScriptAbortException {
      parse(script);
   }

   /**
    * Parses {@code script}, reusing an earlier parse of the same text. Parse trees are
    * only read after construction, so one tree can back concurrent runs.
    */
   PolicyScriptParser.ScriptContext parse(String script) {
      PolicyScriptParser.ScriptContext tree = parsed.getIfPresent(script);
      if (tree == null) {
         tree = ExpressionParser.parse(script, limits.maxExpressionDepth());
         parsed.put(script, tree);
      }
      return tree;
   }

   long cachedScripts() {
      return parsed.size();
   }
}
