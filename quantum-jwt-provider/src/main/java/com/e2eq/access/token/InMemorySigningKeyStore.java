package com.e2eq.access.token;

import com.e2eq.access.model.token.SigningKey;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keys held in a map; every operation is one critical section over it.
 */
@ApplicationScoped
@DefaultBean
public class InMemorySigningKeyStore implements SigningKeyStore {

   private final Map<String, SigningKey> keys = new HashMap<>();

   @Override
   public synchronized List<SigningKey> findAll() {
      return new ArrayList<>(keys.values());
   }

   @Override
   public synchronized SigningKey saveIfNoCurrent(SigningKey key) {
      for (SigningKey existing : keys.values()) {
         if (existing.isCurrent()) {
            return existing;
         }
      }
      keys.put(key.getKid(), key);
      return key;
   }

   @Override
   public synchronized List<SigningKey> rotate(SigningKey next, Instant retiredAt, Instant verifyUntil) {
      List<SigningKey> retired = new ArrayList<>();
      Iterator<Map.Entry<String, SigningKey>> it = keys.entrySet().iterator();
      while (it.hasNext()) {
         Map.Entry<String, SigningKey> entry = it.next();
         SigningKey key = entry.getValue();
         if (key.isCurrent()) {
            SigningKey done = key.retire(retiredAt, verifyUntil);
            entry.setValue(done);
            retired.add(done);
         } else if (!key.canVerifyAt(retiredAt)) {
            it.remove();
         }
      }
      keys.put(next.getKid(), next);
      return retired;
   }

   @Override
   public synchronized Optional<SigningKey> coverTokenUntil(String kid, Instant tokenExpiry) {
      return Optional.ofNullable(keys.computeIfPresent(kid, (k, key) -> key.coverTokenUntil(tokenExpiry)));
   }
}
