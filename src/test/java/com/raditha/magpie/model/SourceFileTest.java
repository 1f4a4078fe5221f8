package com.raditha.magpie.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileTest {

    @Test
    void testIdentityIgnoresText() {
        SourceFile first = new SourceFile("repo", "a.py", "x = 1", "x = 1");
        SourceFile second = new SourceFile("repo", "a.py", "y = 2", "y = 2");
        SourceFile other = new SourceFile("other", "a.py", "x = 1", "x = 1");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, other);
    }

    @Test
    void testTokens() {
        SourceFile file = new SourceFile("repo", "a.py", null, "def f ( ) :");

        assertEquals(List.of("def", "f", "(", ")", ":"), file.tokens());
        assertEquals(5, file.tokenCount());
        assertEquals("", file.rawText());
    }

    @Test
    void testEmptyTextHasNoTokens() {
        assertEquals(0, new SourceFile("repo", "a.py", "", "").tokenCount());
    }

    @Test
    void testIdentityFieldsRequired() {
        assertThrows(NullPointerException.class, () -> new SourceFile(null, "a.py", "", ""));
        assertThrows(NullPointerException.class, () -> new SourceFile("repo", null, "", ""));
    }
}
