package com.e2eq.access.policy.script.expression;

import com.e2eq.access.policy.script.ScriptExecutionException;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Type names, equality, ordering and display of expression language values.
 */
final class ExpressionValues {

   private ExpressionValues() {
   }

   static String typeOf(Object value) {
      if (value == null) {
         return "()";
      }
      if (value instanceof Boolean) {
         return "bool";
      }
      if (value instanceof Long) {
         return "i64";
      }
      if (value instanceof Double) {
         return "f64";
      }
      if (value instanceof String) {
         return "string";
      }
      if (value instanceof List) {
         return "array";
      }
      if (value instanceof Map) {
         return "map";
      }
      if (value instanceof ExpressionClosure) {
         return "Fn";
      }
      return value.getClass().getSimpleName();
   }

   static boolean isNumber(Object value) {
      return value instanceof Long || value instanceof Double;
   }

   static boolean valuesEqual(Object a, Object b) {
      if (isNumber(a) && isNumber(b)) {
         if (a instanceof Long la && b instanceof Long lb) {
            return la.longValue() == lb.longValue();
         }
         return ((Number) a).doubleValue() == ((Number) b).doubleValue();
      }
      if (a instanceof List<?> la && b instanceof List<?> lb) {
         if (la.size() != lb.size()) {
            return false;
         }
         for (int i = 0; i < la.size(); i++) {
            if (!valuesEqual(la.get(i), lb.get(i))) {
               return false;
            }
         }
         return true;
      }
      if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
         if (ma.size() != mb.size()) {
            return false;
         }
         for (Map.Entry<?, ?> e : ma.entrySet()) {
            if (!mb.containsKey(e.getKey()) || !valuesEqual(e.getValue(), mb.get(e.getKey()))) {
               return false;
            }
         }
         return true;
      }
      return Objects.equals(a, b);
   }

   static int compare(Object a, Object b, String op) {
      if (isNumber(a) && isNumber(b)) {
         if (a instanceof Long la && b instanceof Long lb) {
            return Long.compare(la, lb);
         }
         return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
      }
      if (a instanceof String sa && b instanceof String sb) {
         return sa.compareTo(sb);
      }
      throw typeMismatch(op, a, b);
   }

   static boolean requireBoolean(Object value, String where) {
      if (value instanceof Boolean b) {
         return b;
      }
      throw new ScriptExecutionException(where + " expects a bool but found " + typeOf(value));
   }

   static long requireInteger(Object value, String where) {
      if (value instanceof Long l) {
         return l;
      }
      throw new ScriptExecutionException(where + " expects an i64 but found " + typeOf(value));
   }

   static String requireString(Object value, String where) {
      if (value instanceof String s) {
         return s;
      }
      throw new ScriptExecutionException(where + " expects a string but found " + typeOf(value));
   }

   static ScriptExecutionException typeMismatch(String op, Object a, Object b) {
      return new ScriptExecutionException("Operator '" + op + "' is not defined for " + typeOf(a) + " and " + typeOf(b));
   }

   static String display(Object value) {
      if (value == null) {
         return "";
      }
      if (value instanceof String s) {
         return s;
      }
      StringBuilder sb = new StringBuilder();
      appendDebug(sb, value);
      return sb.toString();
   }

   private static void appendDebug(StringBuilder sb, Object value) {
      if (value == null) {
         sb.append("()");
      } else if (value instanceof String s) {
         sb.append('"').append(s).append('"');
      } else if (value instanceof List<?> list) {
         sb.append('[');
         for (Iterator<?> it = list.iterator(); it.hasNext(); ) {
            appendDebug(sb, it.next());
            if (it.hasNext()) {
               sb.append(", ");
            }
         }
         sb.append(']');
      } else if (value instanceof Map<?, ?> map) {
         sb.append("#{");
         for (Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<?, ?> e = it.next();
            sb.append(e.getKey()).append(": ");
            appendDebug(sb, e.getValue());
            if (it.hasNext()) {
               sb.append(", ");
            }
         }
         sb.append('}');
      } else {
         sb.append(value);
      }
   }

   /**
    * Strips the quotes of a string literal and resolves its escapes.
    */
   static String unquote(String literal) {
      String body = literal.substring(1, literal.length() - 1);
      if (body.indexOf('\\') < 0) {
         return body;
      }
      StringBuilder sb = new StringBuilder(body.length());
      for (int i = 0; i < body.length(); i++) {
         char c = body.charAt(i);
         if (c != '\\' || i + 1 >= body.length()) {
            sb.append(c);
            continue;
         }
         char next = body.charAt(++i);
         switch (next) {
            case 'n' -> sb.append('\n');
            case 'r' -> sb.append('\r');
            case 't' -> sb.append('\t');
            case '0' -> sb.append('\0');
            case 'u' -> {
               sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
               i += 4;
            }
            default -> sb.append(next);
         }
      }
      return sb.toString();
   }
}
