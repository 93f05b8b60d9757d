package com.e2eq.access.token;

import com.e2eq.access.model.token.JwtAlgorithm;
import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "quantum.access.token")
public interface TokenConfig {

   @WithDefault("quantum-access")
   String issuer();

   @WithDefault("fhir-api")
   List<String> audience();

   @WithDefault("PT1H")
   Duration accessTokenTtl();

   @WithDefault("P30D")
   Duration refreshTokenTtl();

   @WithDefault("PT1H")
   Duration idTokenTtl();

   /** Tolerance applied to {@code exp} when validating. */
   @WithDefault("PT0S")
   Duration clockSkew();

   @WithDefault("RS256")
   JwtAlgorithm algorithm();

   /**
    * How long a retired key keeps verifying. Never shorter than the longest token
    * lifetime configured above.
    */
   @WithDefault("P30D")
   Duration keyRetention();

   /** PEM (PKCS#8) private key, {@code classpath:} or {@code file:} location. */
   Optional<String> privateKeyLocation();

   /** PEM (X.509) public key matching {@link #privateKeyLocation()}. */
   Optional<String> publicKeyLocation();

   /** Generate a key pair when the key store holds no current key. */
   @WithDefault("true")
   boolean generateKeyOnStartup();
}
