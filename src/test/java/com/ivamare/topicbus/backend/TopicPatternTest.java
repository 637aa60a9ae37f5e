package com.ivamare.topicbus.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TopicPattern")
class TopicPatternTest {

    @Test
    @DisplayName("literal should match only itself")
    void literalShouldMatchOnlyItself() {
        TopicPattern pattern = TopicPattern.compile("orders.created");

        assertTrue(pattern.matches("orders.created"));
        assertFalse(pattern.matches("orders_created"));
        assertFalse(pattern.matches("orders.created.v2"));
        assertFalse(pattern.isWildcard());
    }

    @Test
    @DisplayName("star should match any run of characters")
    void starShouldMatchAnyRunOfCharacters() {
        TopicPattern pattern = TopicPattern.compile("orders.*");

        assertTrue(pattern.matches("orders.created"));
        assertTrue(pattern.matches("orders.created.v2"));
        assertTrue(pattern.matches("orders."));
        assertFalse(pattern.matches("payments.created"));
        assertTrue(pattern.isWildcard());
    }

    @Test
    @DisplayName("question mark should match one character")
    void questionMarkShouldMatchOneCharacter() {
        TopicPattern pattern = TopicPattern.compile("shard.?");

        assertTrue(pattern.matches("shard.1"));
        assertFalse(pattern.matches("shard.12"));
        assertFalse(pattern.matches("shard."));
    }

    @Test
    @DisplayName("regex metacharacters should be literal")
    void regexMetacharactersShouldBeLiteral() {
        TopicPattern pattern = TopicPattern.compile("a+b(c)|*");

        assertTrue(pattern.matches("a+b(c)|x"));
        assertFalse(pattern.matches("aab(c)|x"));
    }
}
