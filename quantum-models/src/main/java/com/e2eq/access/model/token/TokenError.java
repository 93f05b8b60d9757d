package com.e2eq.access.model.token;

/**
 * Why a presented token was rejected. Callers map these to protocol responses.
 */
public enum TokenError {
   MALFORMED,
   SIGNATURE_INVALID,
   TOKEN_EXPIRED,
   TOKEN_REVOKED,
   /** Issuer or audience of an externally issued token did not match. */
   CLAIMS_INVALID,
   /** Revocation state could not be read; the token is rejected. */
   STORAGE_UNAVAILABLE
}
