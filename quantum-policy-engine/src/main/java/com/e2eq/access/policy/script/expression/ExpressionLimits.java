package com.e2eq.access.policy.script.expression;

import com.e2eq.access.config.PolicyEngineConfig;

/**
 * Counted limits applied to every expression script run.
 */
public record ExpressionLimits(long maxOperations,
                               int maxCallLevels,
                               int maxExpressionDepth,
                               int maxStringSize,
                               int maxArraySize,
                               int maxMapSize) {

   public static final ExpressionLimits DEFAULTS = new ExpressionLimits(100_000, 32, 64, 10_000, 1_000, 1_000);

   public static ExpressionLimits from(PolicyEngineConfig.ScriptConfig config) {
      return new ExpressionLimits(config.maxOperations(), config.maxCallLevels(), config.maxExpressionDepth(),
              config.maxStringSize(), config.maxArraySize(), config.maxMapSize());
   }

   public ExpressionLimits withMaxOperations(long operations) {
      return new ExpressionLimits(operations, maxCallLevels, maxExpressionDepth, maxStringSize, maxArraySize, maxMapSize);
   }
}
