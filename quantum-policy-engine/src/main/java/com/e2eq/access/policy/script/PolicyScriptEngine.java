package com.e2eq.access.policy.script;

import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.util.Deadline;

import java.time.Duration;

/**
 * One scripting language the sandbox pool can run policy scripts in.
 */
public interface PolicyScriptEngine extends AutoCloseable {

   ScriptLanguage language();

   /**
    * The configured per-execution timeout.
    */
   Duration timeout();

   /**
    * Runs {@code script} against {@code context}.
    *
    * @param deadline absolute limit for this execution, already narrowed to
    *                 {@link #timeout()}
    * @throws ScriptAbortException when the script faults or exceeds a limit
    */
   AccessDecision evaluate(String script, PolicyContext context, Deadline deadline) throws ScriptAbortException;

   @Override
   default void close() {
   }
}
