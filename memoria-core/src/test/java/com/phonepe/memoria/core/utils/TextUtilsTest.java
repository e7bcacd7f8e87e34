package com.phonepe.memoria.core.utils;

import com.phonepe.memoria.core.model.MemoryType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TextUtilsTest {

    @Test
    void testItemHashIgnoresCaseAndSpacing() {
        final var hash = TextUtils.itemContentHash(MemoryType.PROFILE, "My favorite color is blue");
        assertEquals(16, hash.length());
        assertEquals(hash, TextUtils.itemContentHash(MemoryType.PROFILE, "  my FAVORITE   color is blue "));
        assertNotEquals(hash, TextUtils.itemContentHash(MemoryType.KNOWLEDGE, "My favorite color is blue"));
    }

    @Test
    void testTokens() {
        assertEquals(List.of("what", "color", "do", "they", "like"), TextUtils.tokenize("What color, do they like?"));
        assertEquals(Set.of("color", "like"), TextUtils.contentTokens("What color do they like?"));
        assertEquals(0.5, TextUtils.coverage("color like", "My favorite color is blue"));
    }

    @Test
    void testSentencesAndTruncation() {
        assertEquals(List.of("Hello there.", "My favorite color is blue!"),
                     TextUtils.sentences("Hello there. My favorite color is blue!"));
        assertEquals("abc", TextUtils.truncate("abc", 5));
        assertEquals("ab...", TextUtils.truncate("abcdefgh", 5));
    }
}
