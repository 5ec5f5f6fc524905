package com.raditha.fuzzy.normalization;

import com.raditha.fuzzy.model.TokenSetParts;
import com.raditha.fuzzy.similarity.RatioEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TokenNormalizer.
 */
class TokenNormalizerTest {

    private TokenNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new TokenNormalizer(new RatioEngine());
    }

    @Test
    void testSortTokens() {
        assertEquals("a bear fuzzy was wuzzy", TokenNormalizer.sortTokens("wuzzy fuzzy was a bear"));
        assertEquals("a b", TokenNormalizer.sortTokens("  b \t a  "));
        assertEquals("", TokenNormalizer.sortTokens("   "));
    }

    @Test
    void testTokenize() {
        assertEquals(List.of("new", "york", "mets"), TokenNormalizer.tokenize(" new  york\tmets "));
        assertTrue(TokenNormalizer.tokenize("").isEmpty());
    }

    @Test
    void testTokenizeSplitsOnUnicodeSpaces() {
        assertEquals("a b", TokenNormalizer.sortTokens("b\u00a0a"));
        assertEquals(List.of("x", "y", "z", "w"), TokenNormalizer.tokenize("x\u2007y\u202fz\u0085w"));
        assertEquals(List.of("left", "right"), TokenNormalizer.tokenize("left\u2028right"));
    }

    @Test
    void testTokenSortWithNoBreakSpace() {
        assertEquals(100, normalizer.tokenSort("b\u00a0a", "a b", false));
        assertEquals(100, normalizer.tokenSet("new\u00a0york", "york new", false));
    }

    @Test
    void testCodePointOrder() {
        List<String> tokens = new ArrayList<>(List.of("ﬁ", "😀", "b", "a"));
        tokens.sort(TokenNormalizer.CODE_POINT_ORDER);

        assertEquals(List.of("a", "b", "ﬁ", "😀"), tokens);
    }

    @Test
    void testTokenSortIgnoresOrder() {
        assertEquals(100, normalizer.tokenSort("fuzzy wuzzy was a bear", "wuzzy fuzzy was a bear", false));
        assertEquals(100, normalizer.tokenSort("new york mets vs atlanta braves",
                "atlanta braves vs new york mets", false));
    }

    @Test
    void testTokenSortScores() {
        assertEquals(75, normalizer.tokenSort("b a", "a b c", false));
        assertEquals(100, normalizer.tokenSort("great hall", "the great hall", true));
        assertEquals(84, normalizer.tokenSort("fuzzy was a bear", "fuzzy fuzzy was a bear", false));
    }

    @Test
    void testDecompose() {
        TokenSetParts parts = TokenNormalizer.decompose("mariners vs angels", "angels vs mariners tonight");

        assertEquals("angels mariners vs", parts.intersection());
        assertEquals("angels mariners vs", parts.combined1());
        assertEquals("angels mariners vs tonight", parts.combined2());
    }

    @Test
    void testDecomposeWithoutSharedTokens() {
        TokenSetParts parts = TokenNormalizer.decompose("red blue", "green");

        assertEquals("", parts.intersection());
        assertEquals("blue red", parts.combined1());
        assertEquals("green", parts.combined2());
    }

    @Test
    void testTokenSetIgnoresDuplicatesAndExtras() {
        assertEquals(100, normalizer.tokenSet("fuzzy was a bear", "fuzzy fuzzy was a bear", false));
        assertEquals(100, normalizer.tokenSet("mariners vs angels", "angels vs mariners tonight", false));
        assertEquals(100, normalizer.tokenSet("b a", "a b c", true));
    }

    @Test
    void testTokenSetShortCircuits() {
        assertEquals(100, normalizer.tokenSet("", "", false));
        assertEquals(0, normalizer.tokenSet("", "abc", false));
        assertEquals(0, normalizer.tokenSet("abc", "", true));
    }

    @Test
    void testTokenSetAtLeastTokenSortWithDuplicates() {
        String s1 = "fuzzy was a bear";
        String s2 = "bear a was fuzzy fuzzy";

        assertTrue(normalizer.tokenSet(s1, s2, false) >= normalizer.tokenSort(s1, s2, false));
    }
}
