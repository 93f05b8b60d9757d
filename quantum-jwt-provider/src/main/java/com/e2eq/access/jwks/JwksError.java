package com.e2eq.access.jwks;

public enum JwksError {
   NETWORK_ERROR,
   /** Non-success HTTP status; see {@link JwksException#getHttpStatus()}. */
   HTTP_ERROR,
   PARSE_ERROR,
   KEY_NOT_FOUND,
   NO_SIGNING_KEYS,
   INVALID_KEY,
   INVALID_SCHEME,
   RESPONSE_TOO_LARGE,
   FETCH_FAILED
}
