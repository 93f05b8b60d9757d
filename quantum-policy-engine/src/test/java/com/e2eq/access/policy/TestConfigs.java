package com.e2eq.access.policy;

import com.e2eq.access.config.PolicyEngineConfig;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.Map;

/**
 * Builds config mappings from literal properties, without a running container.
 */
public final class TestConfigs {

   private TestConfigs() {
   }

   public static <T> T mapping(Class<T> type, Map<String, String> properties) {
      SmallRyeConfig config = new SmallRyeConfigBuilder()
              .withMapping(type)
              .withSources(new PropertiesConfigSource(properties, "test", 100))
              .build();
      return config.getConfigMapping(type);
   }

   public static PolicyEngineConfig policyConfig(Map<String, String> properties) {
      return mapping(PolicyEngineConfig.class, properties);
   }

   public static PolicyEngineConfig policyConfig() {
      return policyConfig(Map.of());
   }
}
