package com.e2eq.access.oauth;

import com.e2eq.access.exceptions.AccessControlException;

/**
 * PKCE failure carrying the OAuth 2.0 error code to return to the client.
 */
public class PkceException extends AccessControlException {

   public static final String INVALID_REQUEST = "invalid_request";
   public static final String INVALID_GRANT = "invalid_grant";

   private final String errorCode;

   public PkceException(String errorCode, String message) {
      super(message);
      this.errorCode = errorCode;
   }

   public String getErrorCode() {
      return errorCode;
   }
}
