package com.e2eq.access.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "quantum.access.policy")
public interface PolicyEngineConfig {

   /** Reject requests whose granted SMART scopes do not cover the operation before any policy runs. */
   @WithDefault("true")
   boolean evaluateScopesFirst();

   /** Policy array loaded into the store at startup ({@code classpath:} or {@code file:}). */
   Optional<String> policiesLocation();

   ScriptConfig script();

   interface ScriptConfig {

      @WithDefault("true")
      boolean expressionEnabled();

      @WithDefault("true")
      boolean javascriptEnabled();

      @WithDefault("PT0.1S")
      Duration expressionTimeout();

      @WithDefault("PT0.5S")
      Duration javascriptTimeout();

      @WithDefault("100000")
      long maxOperations();

      @WithDefault("32")
      int maxCallLevels();

      @WithDefault("64")
      int maxExpressionDepth();

      @WithDefault("10000")
      int maxStringSize();

      @WithDefault("1000")
      int maxArraySize();

      @WithDefault("1000")
      int maxMapSize();

      /** Number of parsed expression scripts kept in memory. */
      @WithDefault("512")
      int parsedScriptCacheSize();

      /** JavaScript slots; defaults to the number of available processors. */
      Optional<Integer> poolSize();

      /** How long a caller waits for a free JavaScript slot. */
      @WithDefault("PT1S")
      Duration checkoutTimeout();

      /**
       * Bytes a single JavaScript execution may allocate on its worker thread, garbage
       * included. Sized so that scripts within the statement limit stay well below it.
       */
      @WithDefault("1073741824")
      long allocationLimitBytes();

      @WithDefault("2097152")
      long stackSizeBytes();

      @WithDefault("1000000")
      long statementLimit();
   }
}
