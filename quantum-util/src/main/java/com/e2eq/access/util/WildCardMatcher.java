package com.e2eq.access.util;

/**
 * Glob style matching of identifiers such as OAuth client ids.
 * <pre>
 *    wildcardMatch("app-mobile", "app-*")     --&gt; true
 *    wildcardMatch("app-mobile", "*-web")     --&gt; false
 *    wildcardMatch("app-1", "app-?")          --&gt; true
 * </pre>
 * {@code *} matches any run of characters (including none), {@code ?} exactly one.
 */
public final class WildCardMatcher {

   private WildCardMatcher() {
   }

   public static boolean isWildcard(String pattern) {
      return pattern != null && (pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0);
   }

   public static boolean wildcardMatch(final String input, final String pattern) {
      return wildcardMatch(input, pattern, true);
   }

   /**
    * Checks the input string against the wildcard pattern.
    *
    * @param input the string to test
    * @param pattern the wildcard pattern
    * @param caseSensitive whether character comparison honours case
    * @return true when the whole input matches the pattern
    */
   public static boolean wildcardMatch(final String input, final String pattern, boolean caseSensitive) {
      if (input == null && pattern == null) {
         return true;
      }
      if (input == null || pattern == null) {
         return false;
      }

      int textIdx = 0;
      int patIdx = 0;
      // position of the last '*' seen and the text index it was tried against
      int starIdx = -1;
      int starTextIdx = 0;

      while (textIdx < input.length()) {
         if (patIdx < pattern.length()
                && (pattern.charAt(patIdx) == '?' || same(pattern.charAt(patIdx), input.charAt(textIdx), caseSensitive))) {
            textIdx++;
            patIdx++;
         } else if (patIdx < pattern.length() && pattern.charAt(patIdx) == '*') {
            starIdx = patIdx++;
            starTextIdx = textIdx;
         } else if (starIdx >= 0) {
            // backtrack: let the last '*' swallow one more character
            patIdx = starIdx + 1;
            textIdx = ++starTextIdx;
         } else {
            return false;
         }
      }

      while (patIdx < pattern.length() && pattern.charAt(patIdx) == '*') {
         patIdx++;
      }
      return patIdx == pattern.length();
   }

   private static boolean same(char a, char b, boolean caseSensitive) {
      if (a == b) {
         return true;
      }
      return !caseSensitive && Character.toLowerCase(a) == Character.toLowerCase(b);
   }
}
