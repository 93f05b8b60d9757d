package com.e2eq.access.token;

import com.e2eq.access.exceptions.ConfigurationException;
import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.model.token.JwtAlgorithm;
import com.e2eq.access.model.token.SigningKey;
import com.e2eq.access.util.ExceptionLoggingUtils;
import com.google.common.collect.Ordering;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.lang.JoseException;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the signing key lifecycle: exactly one current key signs, retired keys keep
 * verifying until their retention ends and are pruned on the next rotation.
 */
@ApplicationScoped
public class SigningKeyManager {

   private static final Logger LOG = Logger.getLogger(SigningKeyManager.class);

   private static final Ordering<SigningKey> NEWEST_FIRST =
           Ordering.<Instant>natural().onResultOf(SigningKey::getActivatedAt).reverse();

   private final SigningKeyStore store;
   private final TokenConfig config;
   private final Clock clock;

   @Inject
   public SigningKeyManager(SigningKeyStore store, TokenConfig config) {
      this(store, config, Clock.systemUTC());
   }

   public SigningKeyManager(SigningKeyStore store, TokenConfig config, Clock clock) {
      this.store = store;
      this.config = config;
      this.clock = clock;
   }

   @PostConstruct
   void init() {
      try {
         ensureCurrentKey();
      } catch (StorageUnavailableException e) {
         ExceptionLoggingUtils.logError(LOG, e, "Signing key store unavailable at startup");
      }
   }

   /**
    * Makes sure a current key exists: loads the configured PEM pair or, when none is
    * configured and generation is enabled, generates one.
    *
    * @return the current key, empty when none is configured and generation is off
    */
   public Optional<SigningKey> ensureCurrentKey() throws StorageUnavailableException {
      Optional<SigningKey> current = currentKey();
      if (current.isPresent()) {
         return current;
      }
      SigningKey key;
      if (config.privateKeyLocation().isPresent()) {
         key = loadConfiguredKey();
         LOG.infof("Loaded signing key %s from %s", key.getKid(), config.privateKeyLocation().get());
      } else if (config.generateKeyOnStartup()) {
         key = generateKey(config.algorithm(), clock.instant());
         LOG.infof("Generated signing key %s (%s)", key.getKid(), key.getAlgorithm());
      } else {
         LOG.warn("No signing key configured and key generation is disabled; token issuance will fail");
         return Optional.empty();
      }
      SigningKey stored = store.saveIfNoCurrent(key);
      if (stored != key) {
         LOG.debugf("Another writer installed signing key %s first", stored.getKid());
      }
      return Optional.of(stored);
   }

   public Optional<SigningKey> currentKey() throws StorageUnavailableException {
      return store.findAll().stream()
              .filter(SigningKey::isCurrent)
              .max(Ordering.<Instant>natural().onResultOf(SigningKey::getActivatedAt));
   }

   /**
    * Keys able to verify a signature right now, newest first.
    */
   public List<SigningKey> verificationKeys() throws StorageUnavailableException {
      Instant now = clock.instant();
      return store.findAll().stream()
              .filter(k -> k.canVerifyAt(now))
              .sorted(NEWEST_FIRST)
              .collect(Collectors.toList());
   }

   /**
    * Verification keys ordered so that the key named by {@code kidHint} is tried first.
    */
   public List<SigningKey> verificationKeys(String kidHint) throws StorageUnavailableException {
      List<SigningKey> keys = verificationKeys();
      if (kidHint == null) {
         return keys;
      }
      return Stream.concat(
              keys.stream().filter(k -> kidHint.equals(k.getKid())),
              keys.stream().filter(k -> !kidHint.equals(k.getKid())))
              .collect(Collectors.toList());
   }

   /**
    * Generates a new current key, retires the previous current key and prunes keys
    * whose verification window has closed, in one atomic store write.
    *
    * @return the new current key
    */
   public SigningKey rotate() throws StorageUnavailableException {
      Instant now = clock.instant();
      Instant verifyUntil = now.plus(retention());

      // the new key must sort after the one it replaces, even on a coarse clock
      Instant activatedAt = store.findAll().stream()
              .filter(SigningKey::isCurrent)
              .map(SigningKey::getActivatedAt)
              .filter(at -> !now.isAfter(at))
              .max(Ordering.<Instant>natural())
              .map(at -> at.plusNanos(1))
              .orElse(now);
      SigningKey next = generateKey(config.algorithm(), activatedAt);

      for (SigningKey retired : store.rotate(next, now, verifyUntil)) {
         LOG.infof("Retired signing key %s; verifies until %s", retired.getKid(), retired.getExpiresAt());
      }
      LOG.infof("Rotated signing keys; current key is %s", next.getKid());
      return next;
   }

   /**
    * Keeps {@code key} verifying until {@code tokenExpiry} when a token signed with it
    * outlives the retention window. Tokens within the window need no extra write.
    */
   public void coverToken(SigningKey key, Instant issuedAt, Instant tokenExpiry) throws StorageUnavailableException {
      Instant acceptedUntil = tokenExpiry.plus(config.clockSkew());
      if (!acceptedUntil.isAfter(issuedAt.plus(retention()))) {
         return;
      }
      if (store.coverTokenUntil(key.getKid(), acceptedUntil).isEmpty()) {
         LOG.warnf("Signing key %s vanished while issuing a token", key.getKid());
      }
   }

   /**
    * Retention of retired keys: the configured value, raised to the longest configured
    * token lifetime. Tokens issued with a longer lifetime widen their key's window
    * through {@link #coverToken}.
    */
   public Duration retention() {
      List<Duration> candidates = new ArrayList<>(List.of(config.keyRetention(), config.accessTokenTtl(),
              config.refreshTokenTtl(), config.idTokenTtl()));
      return Ordering.<Duration>natural().max(candidates);
   }

   SigningKey generateKey(JwtAlgorithm algorithm, Instant activatedAt) {
      try {
         PublicJsonWebKey jwk = TokenUtils.generateKeyPair(algorithm);
         return SigningKey.builder()
                 .kid(TokenUtils.keyId(jwk.getPublicKey()))
                 .algorithm(algorithm)
                 .publicKey(jwk.getPublicKey())
                 .privateKey(jwk.getPrivateKey())
                 .activatedAt(activatedAt)
                 .build();
      } catch (JoseException e) {
         throw new ConfigurationException("Unable to generate " + algorithm + " signing key", e);
      }
   }

   private SigningKey loadConfiguredKey() {
      String privateLocation = config.privateKeyLocation().get();
      String publicLocation = config.publicKeyLocation()
              .orElseThrow(() -> new ConfigurationException(
                      "quantum.access.token.public-key-location is required with private-key-location"));
      JwtAlgorithm algorithm = config.algorithm();
      try {
         PrivateKey privateKey = TokenUtils.readPrivateKey(privateLocation, algorithm);
         PublicKey publicKey = TokenUtils.readPublicKey(publicLocation, algorithm);
         return SigningKey.builder()
                 .kid(TokenUtils.keyId(publicKey))
                 .algorithm(algorithm)
                 .publicKey(publicKey)
                 .privateKey(privateKey)
                 .activatedAt(clock.instant())
                 .build();
      } catch (IOException | GeneralSecurityException | JoseException e) {
         throw new ConfigurationException("Unable to load signing key from " + privateLocation, e);
      }
   }
}
