package com.e2eq.access.token;

import com.e2eq.access.model.token.JwtAlgorithm;
import com.e2eq.access.util.ResourceLocations;
import org.jose4j.jwk.EcJwkGenerator;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.jwk.RsaJwkGenerator;
import org.jose4j.keys.EllipticCurves;
import org.jose4j.lang.HashUtil;
import org.jose4j.lang.JoseException;

import java.io.IOException;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Key material helpers for token signing: PEM decoding and encoding, key pair
 * generation and key ids.
 * <p>
 * Key locations accept the {@code classpath:} and {@code file:} prefixes; a location
 * without prefix is a classpath resource name.
 */
public final class TokenUtils {

   public static final int RSA_KEY_SIZE = 2048;

   private static final int PEM_LINE_LENGTH = 64;

   private TokenUtils() {
   }

   public static PrivateKey readPrivateKey(String location, JwtAlgorithm algorithm)
           throws IOException, NoSuchAlgorithmException, InvalidKeySpecException {
      return decodePrivateKey(ResourceLocations.readString(location), algorithm);
   }

   public static PublicKey readPublicKey(String location, JwtAlgorithm algorithm)
           throws IOException, NoSuchAlgorithmException, InvalidKeySpecException {
      return decodePublicKey(ResourceLocations.readString(location), algorithm);
   }

   public static PublicKey decodePublicKey(String pemEncoded, JwtAlgorithm algorithm)
           throws NoSuchAlgorithmException, InvalidKeySpecException {
      X509EncodedKeySpec spec = new X509EncodedKeySpec(toEncodedBytes(pemEncoded));
      return KeyFactory.getInstance(algorithm.keyType()).generatePublic(spec);
   }

   public static PrivateKey decodePrivateKey(String pemEncoded, JwtAlgorithm algorithm)
           throws NoSuchAlgorithmException, InvalidKeySpecException {
      PKCS8EncodedKeySpec keySpec = new PKCS8EncodedKeySpec(toEncodedBytes(pemEncoded));
      return KeyFactory.getInstance(algorithm.keyType()).generatePrivate(keySpec);
   }

   public static byte[] toEncodedBytes(final String pemEncoded) {
      return Base64.getDecoder().decode(removeBeginEnd(pemEncoded));
   }

   public static String removeBeginEnd(String pem) {
      pem = pem.replaceAll("-----BEGIN (.*)-----", "");
      pem = pem.replaceAll("-----END (.*)-----", "");
      pem = pem.replaceAll("\r\n", "");
      pem = pem.replaceAll("\n", "");
      return pem.trim();
   }

   public static String encodePublicKey(PublicKey key) {
      return toPem("PUBLIC KEY", key.getEncoded());
   }

   public static String encodePrivateKey(PrivateKey key) {
      return toPem("PRIVATE KEY", key.getEncoded());
   }

   private static String toPem(String label, byte[] der) {
      String body = Base64.getMimeEncoder(PEM_LINE_LENGTH, new byte[]{'\n'}).encodeToString(der);
      return "-----BEGIN " + label + "-----\n" + body + "\n-----END " + label + "-----\n";
   }

   /**
    * Generates a fresh key pair for {@code algorithm}: RSA 2048 for the RS family, P-384
    * for ES384.
    */
   public static PublicJsonWebKey generateKeyPair(JwtAlgorithm algorithm) throws JoseException {
      return switch (algorithm) {
         case RS256, RS384 -> RsaJwkGenerator.generateJwk(RSA_KEY_SIZE);
         case ES384 -> EcJwkGenerator.generateJwk(EllipticCurves.P384);
      };
   }

   /**
    * Key id derived from the RFC 7638 SHA-256 thumbprint of the public key.
    */
   public static String keyId(PublicKey publicKey) throws JoseException {
      return PublicJsonWebKey.Factory.newPublicJwk(publicKey).calculateBase64urlEncodedThumbprint(HashUtil.SHA_256);
   }

   /**
    * True when {@code raw} has the three dot separated parts of a compact JWS.
    */
   public static boolean isCompactJws(String raw) {
      if (raw == null) {
         return false;
      }
      int dots = 0;
      for (int i = 0; i < raw.length(); i++) {
         if (raw.charAt(i) == '.') {
            dots++;
         }
      }
      return dots == 2;
   }
}
