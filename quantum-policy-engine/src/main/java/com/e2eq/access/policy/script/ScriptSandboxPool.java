package com.e2eq.access.policy.script;

import com.e2eq.access.config.PolicyEngineConfig;
import com.e2eq.access.model.context.PolicyContext;
import com.e2eq.access.model.decision.AccessDecision;
import com.e2eq.access.model.decision.DenyReason;
import com.e2eq.access.model.policy.ScriptEngineSpec;
import com.e2eq.access.model.policy.ScriptLanguage;
import com.e2eq.access.util.Deadline;
import com.e2eq.access.util.ExceptionLoggingUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for running policy scripts. Picks the engine for the script language,
 * narrows the caller's deadline to the engine timeout and turns every failure into a
 * deny. Nothing thrown by a script escapes this class.
 */
@ApplicationScoped
public class ScriptSandboxPool {

   private static final Logger LOG = Logger.getLogger(ScriptSandboxPool.class);

   private final Map<ScriptLanguage, PolicyScriptEngine> engines = new EnumMap<>(ScriptLanguage.class);

   @Inject
   public ScriptSandboxPool(Instance<PolicyScriptEngine> engines, PolicyEngineConfig config) {
      List<PolicyScriptEngine> enabled = new ArrayList<>();
      for (PolicyScriptEngine engine : engines) {
         if (isEnabled(engine.language(), config.script())) {
            enabled.add(engine);
         } else {
            LOG.infof("Policy scripts in %s are disabled", engine.language().code());
         }
      }
      register(enabled);
   }

   public ScriptSandboxPool(Collection<? extends PolicyScriptEngine> engines) {
      register(engines);
   }

   private void register(Collection<? extends PolicyScriptEngine> list) {
      for (PolicyScriptEngine engine : list) {
         PolicyScriptEngine previous = engines.put(engine.language(), engine);
         if (previous != null) {
            throw new IllegalStateException("Two script engines registered for " + engine.language().code());
         }
      }
   }

   private static boolean isEnabled(ScriptLanguage language, PolicyEngineConfig.ScriptConfig config) {
      return switch (language) {
         case EXPRESSION -> config.expressionEnabled();
         case JAVASCRIPT -> config.javascriptEnabled();
      };
   }

   public Optional<PolicyScriptEngine> engine(ScriptLanguage language) {
      return Optional.ofNullable(engines.get(language));
   }

   public boolean supports(ScriptLanguage language) {
      return engines.containsKey(language);
   }

   /**
    * Runs one policy script.
    *
    * @param deadline overall evaluation deadline; the engine's own timeout applies
    *                 on top of it
    * @return the script's decision, a deny describing the failure, or abstain when
    * no engine handles the language
    */
   public AccessDecision evaluate(ScriptEngineSpec spec, PolicyContext context, Deadline deadline) {
      PolicyScriptEngine engine = engines.get(spec.language());
      if (engine == null) {
         LOG.warnf("No script engine enabled for %s, policy abstains", spec.language().code());
         return AccessDecision.abstain();
      }
      if (StringUtils.isBlank(spec.script())) {
         return AccessDecision.deny(DenyReason.scriptError("Policy script is empty"));
      }

      Deadline effective = deadline.limitedTo(engine.timeout());
      if (effective.isExpired()) {
         return AccessDecision.deny(DenyReason.scriptTimeout(0L));
      }
      try {
         return engine.evaluate(spec.script(), context, effective);
      } catch (ScriptAbortException e) {
         if (LOG.isDebugEnabled()) {
            LOG.debugf("%s script aborted: %s", spec.language().code(), e.getMessage());
         }
         return AccessDecision.deny(e.toDenyReason());
      } catch (RuntimeException | StackOverflowError e) {
         String detail = ExceptionLoggingUtils.describe(e);
         LOG.warnf("%s script engine failed: %s", spec.language().code(), detail);
         return AccessDecision.deny(DenyReason.scriptError(detail));
      }
   }
}
