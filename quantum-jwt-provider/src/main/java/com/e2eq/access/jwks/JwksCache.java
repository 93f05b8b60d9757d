package com.e2eq.access.jwks;

import com.e2eq.access.util.ExceptionLoggingUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwk.Use;
import org.jose4j.lang.JoseException;

import java.net.URI;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Cache of remote JWK sets keyed by URI.
 * <p>
 * Reads share a read lock; installing a fetched set takes the write lock. Concurrent
 * refreshes of one URI join a single in-flight fetch and all observe its outcome.
 * When a refresh fails, an expired entry keeps serving for at most
 * {@link JwksConfig#maxStaleness()}; after that lookups fail.
 */
@ApplicationScoped
public class JwksCache {

   private static final Logger LOG = Logger.getLogger(JwksCache.class);

   private final JwksFetcher fetcher;
   private final JwksConfig config;
   private final Clock clock;

   private final ReadWriteLock lock = new ReentrantReadWriteLock();
   private final Map<URI, CachedJwks> entries = new HashMap<>();
   private final Map<URI, CompletableFuture<CachedJwks>> inFlight = new ConcurrentHashMap<>();

   @Inject
   public JwksCache(JwksFetcher fetcher, JwksConfig config) {
      this(fetcher, config, Clock.systemUTC());
   }

   public JwksCache(JwksFetcher fetcher, JwksConfig config, Clock clock) {
      this.fetcher = fetcher;
      this.config = config;
      this.clock = clock;
   }

   /**
    * Verification key {@code kid} of the set at {@code jwksUri}. A cache miss or an
    * unknown kid triggers a refresh.
    */
   public Key getKey(URI jwksUri, String kid) throws JwksException {
      Instant now = clock.instant();
      CachedJwks cached = read(jwksUri);
      if (cached != null && cached.isFreshAt(now)) {
         Optional<PublicJsonWebKey> key = cached.find(kid);
         if (key.isPresent()) {
            return key.get().getPublicKey();
         }
         LOG.debugf("kid %s not in cached JWKS %s; refreshing", kid, jwksUri);
      }

      CachedJwks current;
      try {
         current = refresh(jwksUri, cached, false);
      } catch (JwksException e) {
         if (cached != null && cached.isServableAt(now, config.maxStaleness())) {
            Optional<PublicJsonWebKey> stale = cached.find(kid);
            if (stale.isPresent()) {
               ExceptionLoggingUtils.logWarn(LOG, e, "Serving stale JWKS for %s", jwksUri);
               return stale.get().getPublicKey();
            }
         }
         throw e;
      }
      return current.find(kid)
              .map(PublicJsonWebKey::getPublicKey)
              .orElseThrow(() -> new JwksException(JwksError.KEY_NOT_FOUND,
                      "Key " + kid + " not found in JWKS " + jwksUri));
   }

   /**
    * Signing keys (keys not marked {@code use=enc}) of the set at {@code jwksUri}.
    */
   public List<PublicJsonWebKey> findSigningKeys(URI jwksUri) throws JwksException {
      CachedJwks cached = read(jwksUri);
      if (cached == null || !cached.isFreshAt(clock.instant())) {
         cached = refresh(jwksUri, cached, false);
      }
      return cached.keys();
   }

   /**
    * Fetches the set now. Concurrent callers for the same URI share one fetch.
    */
   public CachedJwks refresh(URI jwksUri) throws JwksException {
      return refresh(jwksUri, null, true);
   }

   /**
    * @param seen  the entry the caller found stale or lacking; when another caller
    *              already replaced it, the replacement is used without fetching
    * @param force fetch even if a fresh entry is present
    */
   private CachedJwks refresh(URI jwksUri, CachedJwks seen, boolean force) throws JwksException {
      HttpJwksFetcher.checkScheme(jwksUri, config.allowHttp());
      CompletableFuture<CachedJwks> mine = new CompletableFuture<>();
      CompletableFuture<CachedJwks> existing = inFlight.putIfAbsent(jwksUri, mine);
      if (existing != null) {
         return await(existing, jwksUri);
      }
      try {
         CachedJwks latest = read(jwksUri);
         if (!force && latest != null && latest != seen && latest.isFreshAt(clock.instant())) {
            mine.complete(latest);
            return latest;
         }
         CachedJwks loaded = load(jwksUri);
         write(jwksUri, loaded);
         mine.complete(loaded);
         return loaded;
      } catch (JwksException e) {
         mine.completeExceptionally(e);
         throw e;
      } catch (RuntimeException e) {
         JwksException failure = new JwksException(JwksError.FETCH_FAILED,
                 "JWKS refresh of " + jwksUri + " failed: " + ExceptionLoggingUtils.describe(e), e);
         mine.completeExceptionally(failure);
         throw failure;
      } finally {
         inFlight.remove(jwksUri, mine);
      }
   }

   public void invalidate(URI jwksUri) {
      lock.writeLock().lock();
      try {
         entries.remove(jwksUri);
      } finally {
         lock.writeLock().unlock();
      }
   }

   public void clear() {
      lock.writeLock().lock();
      try {
         entries.clear();
      } finally {
         lock.writeLock().unlock();
      }
   }

   private CachedJwks load(URI jwksUri) throws JwksException {
      JwksFetcher.FetchedJwks fetched = fetcher.fetch(jwksUri);
      List<PublicJsonWebKey> keys = parseSigningKeys(fetched.body(), jwksUri);
      Duration ttl = clampTtl(fetched.maxAge());
      Instant now = clock.instant();
      LOG.debugf("Fetched %d signing keys from %s; cached for %s", keys.size(), jwksUri, ttl);
      return new CachedJwks(keys, now, now.plus(ttl));
   }

   static List<PublicJsonWebKey> parseSigningKeys(String body, URI jwksUri) throws JwksException {
      JsonWebKeySet set;
      try {
         set = new JsonWebKeySet(body);
      } catch (JoseException | RuntimeException e) {
         throw new JwksException(JwksError.PARSE_ERROR,
                 "Invalid JWKS document from " + jwksUri + ": " + ExceptionLoggingUtils.describe(e), e);
      }
      List<PublicJsonWebKey> keys = new ArrayList<>();
      for (JsonWebKey jwk : set.getJsonWebKeys()) {
         if (Use.ENCRYPTION.equals(jwk.getUse())) {
            continue;
         }
         if (!(jwk instanceof PublicJsonWebKey publicJwk) || publicJwk.getPublicKey() == null) {
            throw new JwksException(JwksError.INVALID_KEY,
                    "JWKS " + jwksUri + " contains a key that is not a public key: " + jwk.getKeyId());
         }
         keys.add(publicJwk);
      }
      if (keys.isEmpty()) {
         throw new JwksException(JwksError.NO_SIGNING_KEYS, "JWKS " + jwksUri + " contains no signing keys");
      }
      return List.copyOf(keys);
   }

   Duration clampTtl(Duration maxAge) {
      Duration ttl = maxAge == null ? config.defaultTtl() : maxAge;
      if (ttl.compareTo(config.minTtl()) < 0) {
         return config.minTtl();
      }
      if (ttl.compareTo(config.maxTtl()) > 0) {
         return config.maxTtl();
      }
      return ttl;
   }

   private CachedJwks read(URI jwksUri) {
      lock.readLock().lock();
      try {
         return entries.get(jwksUri);
      } finally {
         lock.readLock().unlock();
      }
   }

   private void write(URI jwksUri, CachedJwks value) {
      lock.writeLock().lock();
      try {
         entries.put(jwksUri, value);
      } finally {
         lock.writeLock().unlock();
      }
   }

   private static CachedJwks await(CompletableFuture<CachedJwks> future, URI jwksUri) throws JwksException {
      try {
         return future.get();
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new JwksException(JwksError.FETCH_FAILED, "Interrupted waiting for JWKS " + jwksUri, e);
      } catch (ExecutionException e) {
         if (e.getCause() instanceof JwksException jwks) {
            throw jwks;
         }
         throw new JwksException(JwksError.FETCH_FAILED, "JWKS refresh of " + jwksUri + " failed", e.getCause());
      }
   }

   /**
    * One cached key set.
    */
   public record CachedJwks(List<PublicJsonWebKey> keys, Instant fetchedAt, Instant expiresAt) {

      public boolean isFreshAt(Instant now) {
         return now.isBefore(expiresAt);
      }

      boolean isServableAt(Instant now, Duration maxStaleness) {
         return now.isBefore(expiresAt.plus(maxStaleness));
      }

      /**
       * Key by id; with a null kid, the only key of a single key set.
       */
      public Optional<PublicJsonWebKey> find(String kid) {
         if (kid == null) {
            return keys.size() == 1 ? Optional.of(keys.get(0)) : Optional.empty();
         }
         return keys.stream().filter(k -> kid.equals(k.getKeyId())).findFirst();
      }

      public List<String> keyIds() {
         return keys.stream().map(JsonWebKey::getKeyId).collect(Collectors.toList());
      }
   }
}
