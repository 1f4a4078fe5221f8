package com.raditha.magpie.commit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffLinesTest {

    @Test
    void testChangedLinesOnly() {
        DiffLines diff = DiffLines.between("a\nb\nc\n", "a\nB\nc\nd\n");

        assertEquals(List.of("B", "d"), diff.added());
        assertEquals(List.of("b"), diff.removed());
    }

    @Test
    void testNewFileIsAllAdded() {
        DiffLines diff = DiffLines.between(null, "x = 1\ny = 2\n");

        assertEquals(List.of("x = 1", "y = 2"), diff.added());
        assertTrue(diff.removed().isEmpty());
    }

    @Test
    void testDeletedFileIsAllRemoved() {
        DiffLines diff = DiffLines.between("x = 1\r\ny = 2", null);

        assertEquals(List.of("x = 1", "y = 2"), diff.removed());
        assertTrue(diff.added().isEmpty());
    }

    @Test
    void testUnchangedFileIsEmpty() {
        assertTrue(DiffLines.between("same\n", "same\n").isEmpty());
        assertTrue(DiffLines.empty().isEmpty());
    }

    @Test
    void testPlus() {
        DiffLines combined = DiffLines.between(null, "a").plus(DiffLines.between("b", null));

        assertEquals(List.of("a"), combined.added());
        assertEquals(List.of("b"), combined.removed());
    }
}
