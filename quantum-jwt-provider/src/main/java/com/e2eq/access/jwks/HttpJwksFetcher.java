package com.e2eq.access.jwks;

import com.e2eq.access.util.ExceptionLoggingUtils;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches JWK sets over HTTPS with a bounded response size, a request timeout and
 * exponential backoff between retries of network and 5xx failures.
 */
@ApplicationScoped
@DefaultBean
public class HttpJwksFetcher implements JwksFetcher {

   private static final Logger LOG = Logger.getLogger(HttpJwksFetcher.class);

   private static final Pattern MAX_AGE = Pattern.compile("max-age\\s*=\\s*(\\d+)");

   private final JwksConfig config;

   @Inject
   public HttpJwksFetcher(JwksConfig config) {
      this.config = config;
   }

   @Override
   public FetchedJwks fetch(URI jwksUri) throws JwksException {
      checkScheme(jwksUri, config.allowHttp());
      long backoffMillis = config.initialBackoff().toMillis();
      JwksException last = null;
      for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
         if (attempt > 0) {
            sleep(backoffMillis);
            backoffMillis *= 2;
         }
         try {
            return fetchOnce(jwksUri);
         } catch (JwksException e) {
            if (!e.isRetryable()) {
               throw e;
            }
            last = e;
            LOG.debugf("JWKS fetch attempt %d for %s failed: %s", attempt + 1, jwksUri, e.getMessage());
         }
      }
      throw new JwksException(JwksError.FETCH_FAILED,
              "JWKS fetch from " + jwksUri + " failed after " + (config.maxRetries() + 1) + " attempts", last);
   }

   static void checkScheme(URI uri, boolean allowHttp) throws JwksException {
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (scheme.equals("https") || (allowHttp && scheme.equals("http"))) {
         return;
      }
      throw new JwksException(JwksError.INVALID_SCHEME, "JWKS URI must use https: " + uri);
   }

   FetchedJwks fetchOnce(URI jwksUri) throws JwksException {
      HttpURLConnection conn = null;
      try {
         conn = (HttpURLConnection) jwksUri.toURL().openConnection();
         int timeout = (int) config.requestTimeout().toMillis();
         conn.setConnectTimeout(timeout);
         conn.setReadTimeout(timeout);
         conn.setInstanceFollowRedirects(false);
         conn.setRequestMethod("GET");
         conn.setRequestProperty("Accept", "application/json, application/jwk-set+json");

         int status = conn.getResponseCode();
         if (status < 200 || status >= 300) {
            throw JwksException.httpError(status, jwksUri.toString());
         }
         long declared = conn.getContentLengthLong();
         if (declared > config.maxResponseBytes()) {
            throw tooLarge(jwksUri);
         }
         String body;
         try (InputStream is = conn.getInputStream()) {
            body = readBounded(is, jwksUri);
         }
         return new FetchedJwks(body, parseMaxAge(conn.getHeaderField("Cache-Control")));
      } catch (IOException e) {
         throw new JwksException(JwksError.NETWORK_ERROR,
                 "JWKS fetch from " + jwksUri + " failed: " + ExceptionLoggingUtils.describe(e), e);
      } finally {
         if (conn != null) {
            conn.disconnect();
         }
      }
   }

   private String readBounded(InputStream is, URI jwksUri) throws IOException, JwksException {
      int limit = config.maxResponseBytes();
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] buffer = new byte[8192];
      int read;
      while ((read = is.read(buffer)) != -1) {
         if (out.size() + read > limit) {
            throw tooLarge(jwksUri);
         }
         out.write(buffer, 0, read);
      }
      return out.toString(StandardCharsets.UTF_8);
   }

   private JwksException tooLarge(URI jwksUri) {
      return new JwksException(JwksError.RESPONSE_TOO_LARGE,
              "JWKS response from " + jwksUri + " exceeds " + config.maxResponseBytes() + " bytes");
   }

   static Duration parseMaxAge(String cacheControl) {
      if (cacheControl == null) {
         return null;
      }
      Matcher m = MAX_AGE.matcher(cacheControl.toLowerCase(Locale.ROOT));
      if (!m.find()) {
         return null;
      }
      try {
         return Duration.ofSeconds(Long.parseLong(m.group(1)));
      } catch (NumberFormatException e) {
         ExceptionLoggingUtils.logIgnoredException(LOG, e, "Cache-Control max-age " + cacheControl);
         return null;
      }
   }

   private static void sleep(long millis) throws JwksException {
      try {
         Thread.sleep(millis);
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new JwksException(JwksError.FETCH_FAILED, "Interrupted while backing off", e);
      }
   }
}
