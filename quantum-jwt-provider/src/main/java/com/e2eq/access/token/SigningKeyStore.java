package com.e2eq.access.token;

import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.model.token.SigningKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for signing keys, current and retired. Every write that changes which key
 * is current runs as one atomic unit of the backing store, so concurrent writers never
 * leave two current keys behind.
 */
public interface SigningKeyStore {

   List<SigningKey> findAll() throws StorageUnavailableException;

   /**
    * Stores {@code key} as the current key unless a current key already exists.
    *
    * @return the current key after the call, {@code key} itself when it was stored
    */
   SigningKey saveIfNoCurrent(SigningKey key) throws StorageUnavailableException;

   /**
    * Atomically retires every current key at {@code retiredAt} with a verification
    * window ending at {@code verifyUntil} (widened to each key's token horizon), deletes
    * retired keys that no longer verify at {@code retiredAt} and stores {@code next} as
    * the only current key.
    *
    * @return the keys retired by this call
    */
   List<SigningKey> rotate(SigningKey next, Instant retiredAt, Instant verifyUntil)
           throws StorageUnavailableException;

   /**
    * Atomically records that a token signed with {@code kid} expires at
    * {@code tokenExpiry}; see {@link SigningKey#coverTokenUntil(Instant)}.
    *
    * @return the updated key, empty when no key has that kid
    */
   Optional<SigningKey> coverTokenUntil(String kid, Instant tokenExpiry) throws StorageUnavailableException;
}
