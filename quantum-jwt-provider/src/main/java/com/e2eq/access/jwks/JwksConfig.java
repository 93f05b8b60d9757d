package com.e2eq.access.jwks;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@StaticInitSafe
@ConfigMapping(prefix = "quantum.access.jwks")
public interface JwksConfig {

   /** Cache lifetime when the response carries no {@code Cache-Control: max-age}. */
   @WithDefault("PT1H")
   Duration defaultTtl();

   @WithDefault("PT5M")
   Duration minTtl();

   @WithDefault("PT24H")
   Duration maxTtl();

   /** How long past expiry a cached set may still serve when a refresh fails. */
   @WithDefault("PT5M")
   Duration maxStaleness();

   @WithDefault("PT10S")
   Duration requestTimeout();

   @WithDefault("1048576")
   int maxResponseBytes();

   /** Additional attempts after the first failed fetch. */
   @WithDefault("2")
   int maxRetries();

   @WithDefault("PT0.2S")
   Duration initialBackoff();

   /** Permit plain {@code http} endpoints; for local development only. */
   @WithDefault("false")
   boolean allowHttp();
}
