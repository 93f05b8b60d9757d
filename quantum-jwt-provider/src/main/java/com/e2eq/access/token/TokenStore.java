package com.e2eq.access.token;

import com.e2eq.access.exceptions.StorageUnavailableException;
import com.e2eq.access.model.token.Token;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable record of issued tokens and of the revocation set. Implementations must make
 * a revocation visible to every subsequent {@link #isRevoked(String)} call as soon as
 * {@link #revoke(String, Instant)} returns.
 */
public interface TokenStore {

   void persist(Token token) throws StorageUnavailableException;

   Optional<Token> findByJti(String jti) throws StorageUnavailableException;

   boolean isRevoked(String jti) throws StorageUnavailableException;

   /**
    * Adds {@code jti} to the revocation set. The entry may be dropped once
    * {@code expiresAt} has passed, since the token no longer validates anyway.
    */
   void revoke(String jti, Instant expiresAt) throws StorageUnavailableException;

   /**
    * Removes tokens and revocation entries that expired before {@code now}.
    *
    * @return the number of records removed
    */
   int cleanupExpired(Instant now) throws StorageUnavailableException;
}
