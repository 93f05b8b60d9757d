package com.e2eq.access.jwks;

import com.e2eq.access.token.MutableClock;
import com.e2eq.access.token.TestConfigs;
import org.jose4j.jwk.RsaJsonWebKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.security.Key;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class JwksCacheTest {

    static final URI JWKS_URI = URI.create("https://idp.example.org/.well-known/jwks.json");

    JwksConfig config;
    MutableClock clock;
    RsaJsonWebKey key1;

    @BeforeEach
    void init() throws Exception {
        config = TestConfigs.mapping(JwksConfig.class, Map.of());
        clock = MutableClock.startingNow();
        key1 = JwksTestKeys.rsaKey("k1");
    }

    /**
     * Serves a fixed document; can be switched to fail and optionally blocks until released.
     */
    static class StubFetcher implements JwksFetcher {
        final AtomicInteger calls = new AtomicInteger();
        volatile String body;
        volatile Duration maxAge;
        volatile JwksException failure;
        volatile CountDownLatch entered = new CountDownLatch(1);
        volatile CountDownLatch release;

        StubFetcher(String body, Duration maxAge) {
            this.body = body;
            this.maxAge = maxAge;
        }

        @Override
        public FetchedJwks fetch(URI jwksUri) throws JwksException {
            calls.incrementAndGet();
            entered.countDown();
            if (release != null) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (failure != null) {
                throw failure;
            }
            return new FetchedJwks(body, maxAge);
        }
    }

    @Test
    void returns_cached_key_without_refetching() throws Exception {
        StubFetcher fetcher = new StubFetcher(JwksTestKeys.jwksJson(key1), null);
        JwksCache cache = new JwksCache(fetcher, config, clock);

        Key first = cache.getKey(JWKS_URI, "k1");
        Key second = cache.getKey(JWKS_URI, "k1");

        assertEquals(key1.getPublicKey(), first);
        assertSame(first, second);
        assertEquals(1, fetcher.calls.get());
    }

    @Test
    void concurrent_lookups_coalesce_into_one_fetch() throws Exception {
        StubFetcher fetcher = new StubFetcher(JwksTestKeys.jwksJson(key1), null);
        fetcher.release = new CountDownLatch(1);
        JwksCache cache = new JwksCache(fetcher, config, clock);

        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<Key>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> cache.getKey(JWKS_URI, "k1")));
            }
            assertTrue(fetcher.entered.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);
            fetcher.release.countDown();

            for (Future<Key> result : results) {
                assertEquals(key1.getPublicKey(), result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, fetcher.calls.get());
    }

    @Test
    void unknown_kid_refreshes_then_fails_with_key_not_found() throws Exception {
        StubFetcher fetcher = new StubFetcher(JwksTestKeys.jwksJson(key1), null);
        JwksCache cache = new JwksCache(fetcher, config, clock);
        cache.getKey(JWKS_URI, "k1");

        JwksException ex = assertThrows(JwksException.class, () -> cache.getKey(JWKS_URI, "k2"));
        assertEquals(JwksError.KEY_NOT_FOUND, ex.getError());
        assertEquals(2, fetcher.calls.get());

        RsaJsonWebKey key2 = JwksTestKeys.rsaKey("k2");
        fetcher.body = JwksTestKeys.jwksJson(key1, key2);
        assertEquals(key2.getPublicKey(), cache.getKey(JWKS_URI, "k2"));
    }

    @Test
    void stale_entry_serves_only_within_max_staleness() throws Exception {
        StubFetcher fetcher = new StubFetcher(JwksTestKeys.jwksJson(key1), Duration.ofMinutes(10));
        JwksCache cache = new JwksCache(fetcher, config, clock);
        cache.getKey(JWKS_URI, "k1");

        fetcher.failure = new JwksException(JwksError.NETWORK_ERROR, "connection refused");
        clock.advance(Duration.ofMinutes(12));
        assertEquals(key1.getPublicKey(), cache.getKey(JWKS_URI, "k1"));

        clock.advance(Duration.ofMinutes(4));
        JwksException ex = assertThrows(JwksException.class, () -> cache.getKey(JWKS_URI, "k1"));
        assertEquals(JwksError.NETWORK_ERROR, ex.getError());
    }

    @Test
    void ttl_follows_max_age_within_bounds() {
        JwksCache cache = new JwksCache(new StubFetcher("{}", null), config, clock);

        assertEquals(Duration.ofHours(1), cache.clampTtl(null));
        assertEquals(Duration.ofMinutes(5), cache.clampTtl(Duration.ofSeconds(10)));
        assertEquals(Duration.ofMinutes(30), cache.clampTtl(Duration.ofMinutes(30)));
        assertEquals(Duration.ofHours(24), cache.clampTtl(Duration.ofDays(2)));
    }

    @Test
    void rejects_bad_documents_and_schemes() throws Exception {
        JwksCache parseFailure = new JwksCache(new StubFetcher("not json", null), config, clock);
        assertEquals(JwksError.PARSE_ERROR,
                assertThrows(JwksException.class, () -> parseFailure.getKey(JWKS_URI, "k1")).getError());

        RsaJsonWebKey encKey = JwksTestKeys.rsaKey("enc");
        encKey.setUse("enc");
        JwksCache encOnly = new JwksCache(new StubFetcher(JwksTestKeys.jwksJson(encKey), null), config, clock);
        assertEquals(JwksError.NO_SIGNING_KEYS,
                assertThrows(JwksException.class, () -> encOnly.refresh(JWKS_URI)).getError());

        JwksCache cache = new JwksCache(new StubFetcher(JwksTestKeys.jwksJson(key1), null), config, clock);
        assertEquals(JwksError.INVALID_SCHEME, assertThrows(JwksException.class,
                () -> cache.getKey(URI.create("http://idp.example.org/jwks"), "k1")).getError());
    }

    @Test
    void find_signing_keys_skips_encryption_keys_and_invalidate_forces_refetch() throws Exception {
        RsaJsonWebKey encKey = JwksTestKeys.rsaKey("enc");
        encKey.setUse("enc");
        StubFetcher fetcher = new StubFetcher(JwksTestKeys.jwksJson(key1, encKey), null);
        JwksCache cache = new JwksCache(fetcher, config, clock);

        assertEquals(List.of("k1"), cache.refresh(JWKS_URI).keyIds());
        assertEquals(1, cache.findSigningKeys(JWKS_URI).size());
        assertEquals(1, fetcher.calls.get());

        cache.invalidate(JWKS_URI);
        cache.findSigningKeys(JWKS_URI);
        assertEquals(2, fetcher.calls.get());

        cache.clear();
        cache.getKey(JWKS_URI, "k1");
        assertEquals(3, fetcher.calls.get());
    }
}
