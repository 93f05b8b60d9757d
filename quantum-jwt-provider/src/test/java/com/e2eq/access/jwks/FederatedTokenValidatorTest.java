package com.e2eq.access.jwks;

import com.e2eq.access.model.token.TokenError;
import com.e2eq.access.model.token.TokenValidationResult;
import com.e2eq.access.token.MutableClock;
import com.e2eq.access.token.TestConfigs;
import io.smallrye.jwt.build.Jwt;
import org.jose4j.jwk.RsaJsonWebKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FederatedTokenValidatorTest {

    static final URI JWKS_URI = URI.create("https://idp.example.org/jwks");
    static final String ISSUER = "https://idp.example.org";

    RsaJsonWebKey idpKey;
    FederatedTokenValidator validator;

    @BeforeEach
    void init() throws Exception {
        idpKey = JwksTestKeys.rsaKey("idp-1");
        JwksCacheTest.StubFetcher fetcher = new JwksCacheTest.StubFetcher(JwksTestKeys.jwksJson(idpKey), null);
        JwksCache cache = new JwksCache(fetcher, TestConfigs.mapping(JwksConfig.class, Map.of()), MutableClock.startingNow());
        validator = new FederatedTokenValidator(cache, TestConfigs.tokenConfig());
    }

    String sign(String issuer, String kid, Instant expiresAt) {
        return Jwt.issuer(issuer)
                .subject("fed-user")
                .audience("fhir-api")
                .issuedAt(Instant.now().getEpochSecond())
                .expiresAt(expiresAt.getEpochSecond())
                .claim("client_id", "partner-app")
                .jws()
                .keyId(kid)
                .sign(idpKey.getPrivateKey());
    }

    @Test
    void accepts_token_signed_by_the_issuer() {
        String raw = sign(ISSUER, "idp-1", Instant.now().plus(Duration.ofMinutes(5)));

        TokenValidationResult result = validator.validate(raw, JWKS_URI, ISSUER, "fhir-api");
        assertTrue(result.isValid(), result.toString());
        assertEquals("fed-user", result.claims().getSubject());
        assertEquals("partner-app", result.claims().getClientId());
        assertEquals("idp-1", result.claims().getKeyId());
    }

    @Test
    void rejects_wrong_issuer_or_audience() {
        String raw = sign("https://evil.example.org", "idp-1", Instant.now().plus(Duration.ofMinutes(5)));
        assertEquals(TokenError.CLAIMS_INVALID, validator.validate(raw, JWKS_URI, ISSUER, "fhir-api").error());

        String good = sign(ISSUER, "idp-1", Instant.now().plus(Duration.ofMinutes(5)));
        assertEquals(TokenError.CLAIMS_INVALID, validator.validate(good, JWKS_URI, ISSUER, "other-api").error());
        assertTrue(validator.validate(good, JWKS_URI, ISSUER, null).isValid());
    }

    @Test
    void rejects_unknown_key_and_expired_tokens() {
        String unknownKid = sign(ISSUER, "idp-2", Instant.now().plus(Duration.ofMinutes(5)));
        assertEquals(TokenError.SIGNATURE_INVALID, validator.validate(unknownKid, JWKS_URI, ISSUER, "fhir-api").error());

        String expired = sign(ISSUER, "idp-1", Instant.now().minus(Duration.ofMinutes(5)));
        assertEquals(TokenError.TOKEN_EXPIRED, validator.validate(expired, JWKS_URI, ISSUER, "fhir-api").error());

        assertEquals(TokenError.MALFORMED, validator.validate("garbage", JWKS_URI, ISSUER, "fhir-api").error());
    }
}
