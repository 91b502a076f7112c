package de.bsommerfeld.traderelay.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextBoundsTest {

    @Test
    void truncate_shouldKeepShortText() {
        assertEquals("hello", TextBounds.truncate("hello", 10));
    }

    @Test
    void truncate_shouldCutAtLimit() {
        assertEquals("hel", TextBounds.truncate("hello", 3));
    }

    @Test
    void truncate_shouldNotSplitSurrogatePair() {
        // "🟢" is two UTF-16 units; a cut after the high surrogate drops it
        String text = "ab🟢";
        String cut = TextBounds.truncate(text, 3);

        assertEquals("ab", cut);
        assertFalse(Character.isHighSurrogate(cut.charAt(cut.length() - 1)));
    }

    @Test
    void truncate_shouldMapNullToEmpty() {
        assertEquals("", TextBounds.truncate(null, 10));
    }

    @Test
    void truncate_shouldHandleNonPositiveLimit() {
        assertEquals("", TextBounds.truncate("abc", 0));
    }
}
