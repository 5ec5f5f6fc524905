package com.raditha.fuzzy.similarity;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScoresTest {

    @ParameterizedTest
    @CsvSource({
            "0.125, 12",
            "0.375, 38",
            "0.625, 62",
            "0.0, 0",
            "1.0, 100",
            "0.9655172413793104, 97"
    })
    void testRatioRoundsHalfToEven(double ratio, int expected) {
        assertEquals(expected, Scores.fromRatio(ratio));
    }

    @ParameterizedTest
    @CsvSource({
            "85.5, 86",
            "84.5, 84",
            "27.549999999999997, 28",
            "99.5, 100"
    })
    void testScoreRounding(double score, int expected) {
        assertEquals(expected, Scores.round(score));
    }
}
