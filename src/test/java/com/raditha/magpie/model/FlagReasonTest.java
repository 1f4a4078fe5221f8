package com.raditha.magpie.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FlagReasonTest {

    @Test
    void testOf() {
        assertEquals(FlagReason.DIFF, FlagReason.of(true, false));
        assertEquals(FlagReason.MESSAGE, FlagReason.of(false, true));
        assertEquals(FlagReason.DIFF_AND_MESSAGE, FlagReason.of(true, true));
        assertThrows(IllegalArgumentException.class, () -> FlagReason.of(false, false));
    }
}
