package com.e2eq.access.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WildCardMatcherTest {

    @Test
    void star_matches_any_run_including_empty() {
        assertTrue(WildCardMatcher.wildcardMatch("app-mobile", "app-*"));
        assertTrue(WildCardMatcher.wildcardMatch("app-", "app-*"));
        assertTrue(WildCardMatcher.wildcardMatch("my-app-web", "*-web"));
        assertTrue(WildCardMatcher.wildcardMatch("a-b-c", "a*b*c"));
        assertFalse(WildCardMatcher.wildcardMatch("app-mobile", "*-web"));
    }

    @Test
    void question_mark_matches_exactly_one_character() {
        assertTrue(WildCardMatcher.wildcardMatch("app-1", "app-?"));
        assertFalse(WildCardMatcher.wildcardMatch("app-12", "app-?"));
        assertFalse(WildCardMatcher.wildcardMatch("app-", "app-?"));
    }

    @Test
    void backtracks_over_repeated_tokens() {
        assertTrue(WildCardMatcher.wildcardMatch("abcabcabd", "*abd"));
        assertTrue(WildCardMatcher.wildcardMatch("xaaab", "x*ab"));
    }

    @Test
    void case_sensitivity_is_honoured() {
        assertFalse(WildCardMatcher.wildcardMatch("APP-1", "app-*"));
        assertTrue(WildCardMatcher.wildcardMatch("APP-1", "app-*", false));
    }

    @Test
    void nulls() {
        assertTrue(WildCardMatcher.wildcardMatch(null, null));
        assertFalse(WildCardMatcher.wildcardMatch("x", null));
        assertFalse(WildCardMatcher.wildcardMatch(null, "*"));
        assertTrue(WildCardMatcher.isWildcard("a*"));
        assertFalse(WildCardMatcher.isWildcard("plain"));
    }
}
