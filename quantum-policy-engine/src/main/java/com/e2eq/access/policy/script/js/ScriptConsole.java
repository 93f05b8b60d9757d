package com.e2eq.access.policy.script.js;

import org.graalvm.polyglot.HostAccess;
import org.jboss.logging.Logger;

/**
 * The only host object visible to JavaScript policies; backs {@code console.*}.
 */
public final class ScriptConsole {

   static final ScriptConsole INSTANCE = new ScriptConsole();

   private static final Logger SCRIPT_LOG = Logger.getLogger("policy-script");

   private ScriptConsole() {
   }

   @HostAccess.Export
   public void log(String level, String message) {
      switch (level == null ? "info" : level) {
         case "error":
            SCRIPT_LOG.error(message);
            break;
         case "warn":
            SCRIPT_LOG.warn(message);
            break;
         case "debug":
            SCRIPT_LOG.debug(message);
            break;
         default:
            SCRIPT_LOG.info(message);
            break;
      }
   }
}
