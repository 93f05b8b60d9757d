package com.e2eq.access.jwks;

import java.net.URI;
import java.time.Duration;

/**
 * Retrieves a JWK set document.
 */
public interface JwksFetcher {

   FetchedJwks fetch(URI jwksUri) throws JwksException;

   /**
    * @param body   the JSON document
    * @param maxAge {@code Cache-Control: max-age}, null when absent
    */
   record FetchedJwks(String body, Duration maxAge) {
   }
}
