package com.raditha.fuzzy.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchingBlockTest {

    @Test
    void testAlignedStartIsClamped() {
        assertEquals(2, new MatchingBlock(1, 3, 2).alignedStart());
        assertEquals(0, new MatchingBlock(4, 1, 2).alignedStart());
    }

    @Test
    void testTerminalBlock() {
        MatchingBlock terminal = MatchingBlock.terminal(5, 7);

        assertTrue(terminal.isTerminal());
        assertFalse(new MatchingBlock(0, 0, 1).isTerminal());
        assertEquals("(5, 7, 0)", terminal.toString());
    }

    @Test
    void testAdjacency() {
        MatchingBlock first = new MatchingBlock(0, 2, 3);

        assertTrue(first.isAdjacentTo(new MatchingBlock(3, 5, 1)));
        assertFalse(first.isAdjacentTo(new MatchingBlock(3, 6, 1)));
    }

    @Test
    void testNegativeValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MatchingBlock(-1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new MatchingBlock(0, 0, -2));
    }
}
