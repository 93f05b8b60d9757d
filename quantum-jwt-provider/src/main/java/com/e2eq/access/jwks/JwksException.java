package com.e2eq.access.jwks;

import com.e2eq.access.exceptions.AccessControlException;

public class JwksException extends AccessControlException {

   private final JwksError error;
   private final int httpStatus;

   public JwksException(JwksError error, String message) {
      this(error, message, null);
   }

   public JwksException(JwksError error, String message, Throwable cause) {
      super(message, cause);
      this.error = error;
      this.httpStatus = -1;
   }

   public static JwksException httpError(int status, String uri) {
      return new JwksException(status, "JWKS endpoint " + uri + " returned HTTP " + status);
   }

   private JwksException(int httpStatus, String message) {
      super(message);
      this.error = JwksError.HTTP_ERROR;
      this.httpStatus = httpStatus;
   }

   public JwksError getError() {
      return error;
   }

   /** Status of an {@link JwksError#HTTP_ERROR}, -1 otherwise. */
   public int getHttpStatus() {
      return httpStatus;
   }

   /** Server side failures worth retrying. */
   public boolean isRetryable() {
      return error == JwksError.NETWORK_ERROR || (error == JwksError.HTTP_ERROR && httpStatus >= 500);
   }
}
