package com.e2eq.access.token;

import com.e2eq.access.model.token.Token;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process local token store. Replaced by any other {@link TokenStore} bean.
 */
@ApplicationScoped
@DefaultBean
public class InMemoryTokenStore implements TokenStore {

   private final Map<String, Token> tokens = new ConcurrentHashMap<>();
   // jti -> instant after which the entry may be discarded
   private final Map<String, Instant> revoked = new ConcurrentHashMap<>();

   @Override
   public void persist(Token token) {
      tokens.put(token.getJti(), token.forStorage());
   }

   @Override
   public Optional<Token> findByJti(String jti) {
      return Optional.ofNullable(tokens.get(jti));
   }

   @Override
   public boolean isRevoked(String jti) {
      return revoked.containsKey(jti);
   }

   @Override
   public void revoke(String jti, Instant expiresAt) {
      Instant until = expiresAt == null ? Instant.MAX : expiresAt;
      revoked.merge(jti, until, (a, b) -> a.isAfter(b) ? a : b);
   }

   @Override
   public int cleanupExpired(Instant now) {
      int before = tokens.size() + revoked.size();
      tokens.values().removeIf(t -> t.isExpiredAt(now));
      revoked.values().removeIf(until -> until.isBefore(now));
      return Math.max(0, before - tokens.size() - revoked.size());
   }
}
