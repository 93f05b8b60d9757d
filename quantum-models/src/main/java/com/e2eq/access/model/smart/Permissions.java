package com.e2eq.access.model.smart;

import java.util.Objects;

/**
 * The {@code cruds} permission letters of a SMART v2 scope. Letters must appear in
 * strictly ascending order {@code c < r < u < d < s}.
 */
public final class Permissions {

   static final String ORDER = "cruds";

   // one bit per letter, bit index = position in ORDER
   private final int bits;

   private Permissions(int bits) {
      this.bits = bits;
   }

   public static Permissions parse(String letters) throws ScopeParseException {
      if (letters == null || letters.isEmpty()) {
         throw new ScopeParseException(ScopeParseException.Kind.EMPTY, "Empty permission string");
      }
      int bits = 0;
      int last = -1;
      for (int i = 0; i < letters.length(); i++) {
         char c = letters.charAt(i);
         int order = ORDER.indexOf(c);
         if (order < 0) {
            throw new ScopeParseException(ScopeParseException.Kind.INVALID_PERMISSION, "Invalid permission character: " + c);
         }
         if (order <= last) {
            throw new ScopeParseException(ScopeParseException.Kind.INVALID_PERMISSION_ORDER,
                    "Permissions must be in order: c < r < u < d < s");
         }
         bits |= 1 << order;
         last = order;
      }
      return new Permissions(bits);
   }

   public boolean has(char permission) {
      int order = ORDER.indexOf(permission);
      return order >= 0 && (bits & (1 << order)) != 0;
   }

   public boolean canRead() {
      return has('r') || has('s');
   }

   public boolean canWrite() {
      return has('c') || has('u') || has('d');
   }

   public boolean isEmpty() {
      return bits == 0;
   }

   /**
    * True when every letter granted by {@code other} is also granted here.
    */
   public boolean covers(Permissions other) {
      return (other.bits & ~bits) == 0;
   }

   /**
    * Letters granted by both, or null when nothing is shared.
    */
   public Permissions intersect(Permissions other) {
      int shared = bits & other.bits;
      return shared == 0 ? null : new Permissions(shared);
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < ORDER.length(); i++) {
         if ((bits & (1 << i)) != 0) {
            sb.append(ORDER.charAt(i));
         }
      }
      return sb.toString();
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Permissions)) return false;
      return bits == ((Permissions) o).bits;
   }

   @Override
   public int hashCode() {
      return Objects.hash(bits);
   }
}
