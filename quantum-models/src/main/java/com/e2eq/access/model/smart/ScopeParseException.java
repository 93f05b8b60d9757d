package com.e2eq.access.model.smart;

import com.e2eq.access.exceptions.AccessControlException;

/**
 * A SMART scope string that does not follow {@code context/Type.perms[?param=value]}.
 */
public class ScopeParseException extends AccessControlException {

   public enum Kind {
      INVALID_FORMAT,
      INVALID_CONTEXT,
      INVALID_PERMISSION,
      INVALID_PERMISSION_ORDER,
      EMPTY,
      SCOPE_NOT_PERMITTED
   }

   private final Kind kind;

   public ScopeParseException(Kind kind, String message) {
      super(message);
      this.kind = kind;
   }

   public Kind getKind() {
      return kind;
   }
}
