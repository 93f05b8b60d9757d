package com.e2eq.access.oauth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Proof Key for Code Exchange (RFC 7636), S256 only.
 */
public final class Pkce {

   public static final String METHOD_S256 = "S256";
   public static final String METHOD_PLAIN = "plain";

   public static final int MIN_VERIFIER_LENGTH = 43;
   public static final int MAX_VERIFIER_LENGTH = 128;
   /** base64url without padding of a SHA-256 digest */
   public static final int CHALLENGE_LENGTH = 43;

   private static final int VERIFIER_ENTROPY_BYTES = 32;
   private static final SecureRandom RANDOM = new SecureRandom();
   private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

   private Pkce() {
   }

   /**
    * A fresh verifier: 32 random bytes, base64url encoded (43 characters).
    */
   public static String generateVerifier() {
      byte[] bytes = new byte[VERIFIER_ENTROPY_BYTES];
      RANDOM.nextBytes(bytes);
      return ENCODER.encodeToString(bytes);
   }

   public static String challengeFor(String verifier) throws PkceException {
      validateVerifier(verifier);
      return ENCODER.encodeToString(sha256(verifier));
   }

   public static void validateVerifier(String verifier) throws PkceException {
      if (verifier == null || verifier.length() < MIN_VERIFIER_LENGTH || verifier.length() > MAX_VERIFIER_LENGTH) {
         throw new PkceException(PkceException.INVALID_REQUEST,
                 "code_verifier must be " + MIN_VERIFIER_LENGTH + " to " + MAX_VERIFIER_LENGTH + " characters");
      }
      for (int i = 0; i < verifier.length(); i++) {
         if (!isUnreserved(verifier.charAt(i))) {
            throw new PkceException(PkceException.INVALID_REQUEST, "code_verifier contains invalid characters");
         }
      }
   }

   /**
    * Accepts only {@code S256}; a missing method would default to {@code plain} and is
    * rejected as well.
    */
   public static void validateMethod(String method) throws PkceException {
      if (!METHOD_S256.equals(method)) {
         throw new PkceException(PkceException.INVALID_REQUEST,
                 "Unsupported code_challenge_method: " + (method == null ? METHOD_PLAIN : method));
      }
   }

   public static void validateChallenge(String challenge) throws PkceException {
      if (challenge == null || challenge.length() != CHALLENGE_LENGTH) {
         throw new PkceException(PkceException.INVALID_REQUEST, "code_challenge must be " + CHALLENGE_LENGTH + " characters");
      }
      for (int i = 0; i < challenge.length(); i++) {
         char c = challenge.charAt(i);
         if (!(Character.isLetterOrDigit(c) && c < 128) && c != '-' && c != '_') {
            throw new PkceException(PkceException.INVALID_REQUEST, "code_challenge is not base64url");
         }
      }
   }

   /**
    * Checks a token request's verifier against the challenge stored with the
    * authorization code.
    *
    * @throws PkceException {@code invalid_request} for malformed input,
    *                       {@code invalid_grant} when the verifier does not match
    */
   public static void verify(String verifier, String challenge, String method) throws PkceException {
      validateMethod(method);
      validateChallenge(challenge);
      String computed = challengeFor(verifier);
      if (!MessageDigest.isEqual(computed.getBytes(StandardCharsets.US_ASCII), challenge.getBytes(StandardCharsets.US_ASCII))) {
         throw new PkceException(PkceException.INVALID_GRANT, "code_verifier does not match code_challenge");
      }
   }

   private static boolean isUnreserved(char c) {
      return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
              || c == '-' || c == '.' || c == '_' || c == '~';
   }

   private static byte[] sha256(String value) {
      try {
         return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.US_ASCII));
      } catch (NoSuchAlgorithmException e) {
         throw new IllegalStateException("SHA-256 not available", e);
      }
   }
}
