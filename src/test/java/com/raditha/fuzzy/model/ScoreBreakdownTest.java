package com.raditha.fuzzy.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreBreakdownTest {

    @Test
    void testWinningHeuristic() {
        assertEquals("base", new ScoreBreakdown(90, 0, 85.5, 85.5, 1.0, false, 90).winningHeuristic());
        assertEquals("token_sort", new ScoreBreakdown(45, 0, 95, 95, 1.0, false, 95).winningHeuristic());
        assertEquals("token_set", new ScoreBreakdown(45, 60, 70, 85.5, 2.0, true, 86).winningHeuristic());
    }

    @Test
    void testThreshold() {
        ScoreBreakdown breakdown = new ScoreBreakdown(80, 0, 0, 0, 1.0, false, 80);

        assertTrue(breakdown.exceedsThreshold(80));
        assertFalse(breakdown.exceedsThreshold(81));
    }

    @Test
    void testInvalid() {
        ScoreBreakdown invalid = ScoreBreakdown.invalid();

        assertEquals(0, invalid.score());
        assertFalse(invalid.partialStrategy());
    }
}
