package com.raditha.fuzzy.normalization;

import com.raditha.fuzzy.model.TokenSetParts;
import com.raditha.fuzzy.similarity.RatioEngine;
import com.raditha.fuzzy.similarity.Scores;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Token-order-insensitive views of a string pair, scored with {@link RatioEngine}.
 * <p>
 * Tokens are delimited by Unicode whitespace and ordered by code point.
 * <ul>
 * <li>Token sort: sort each string's tokens and compare the rejoined strings.</li>
 * <li>Token set: deduplicate tokens, then compare the shared tokens against each
 * side's shared-plus-extra tokens.</li>
 * </ul>
 */
public class TokenNormalizer {

    /**
     * Orders strings by code point rather than by UTF-16 unit.
     */
    public static final Comparator<String> CODE_POINT_ORDER = TokenNormalizer::compareCodePoints;

    private final RatioEngine ratios;

    public TokenNormalizer(RatioEngine ratios) {
        this.ratios = ratios;
    }

    /**
     * Token sort ratio of two already processed strings.
     *
     * @param partial use the partial ratio on the sorted strings
     */
    public int tokenSort(String s1, String s2, boolean partial) {
        String sorted1 = sortTokens(s1);
        String sorted2 = sortTokens(s2);
        return partial ? ratios.partialRatio(sorted1, sorted2) : ratios.ratio(sorted1, sorted2);
    }

    /**
     * Token set ratio of two already processed strings: the best of
     * intersection vs combined-1, intersection vs combined-2 and
     * combined-1 vs combined-2.
     *
     * @param partial use the partial ratio for the three comparisons
     */
    public int tokenSet(String s1, String s2, boolean partial) {
        if (s1.equals(s2)) {
            return Scores.MAX;
        }
        if (!Preprocessor.isValid(s1) || !Preprocessor.isValid(s2)) {
            return Scores.MIN;
        }

        TokenSetParts parts = decompose(s1, s2);
        int sectVsFirst = compare(parts.intersection(), parts.combined1(), partial);
        int sectVsSecond = compare(parts.intersection(), parts.combined2(), partial);
        int firstVsSecond = compare(parts.combined1(), parts.combined2(), partial);
        return Math.max(sectVsFirst, Math.max(sectVsSecond, firstVsSecond));
    }

    /**
     * Split both strings into token sets and build the intersection and the two
     * combined strings.
     */
    public static TokenSetParts decompose(String s1, String s2) {
        Set<String> tokens1 = new LinkedHashSet<>(tokenize(s1));
        Set<String> tokens2 = new LinkedHashSet<>(tokenize(s2));

        List<String> intersection = new ArrayList<>();
        List<String> onlyFirst = new ArrayList<>();
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersection.add(token);
            } else {
                onlyFirst.add(token);
            }
        }
        List<String> onlySecond = new ArrayList<>();
        for (String token : tokens2) {
            if (!tokens1.contains(token)) {
                onlySecond.add(token);
            }
        }

        String sect = joinSorted(intersection);
        String combined1 = (sect + " " + joinSorted(onlyFirst)).strip();
        String combined2 = (sect + " " + joinSorted(onlySecond)).strip();
        return new TokenSetParts(sect.strip(), combined1, combined2);
    }

    /**
     * Tokens of {@code s} sorted and joined by single spaces.
     */
    public static String sortTokens(String s) {
        return joinSorted(tokenize(s)).strip();
    }

    /**
     * Whitespace-delimited tokens in order of appearance.
     */
    public static List<String> tokenize(String s) {
        List<String> tokens = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < s.length(); i++) {
            if (isSeparator(s.charAt(i))) {
                if (start >= 0) {
                    tokens.add(s.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0) {
            tokens.add(s.substring(start));
        }
        return tokens;
    }

    /**
     * Whitespace in the Unicode sense: also no-break spaces and NEL, which
     * {@link Character#isWhitespace(char)} leaves out.
     */
    static boolean isSeparator(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    private int compare(String a, String b, boolean partial) {
        return partial ? ratios.partialRatio(a, b) : ratios.ratio(a, b);
    }

    private static String joinSorted(Collection<String> tokens) {
        List<String> sorted = new ArrayList<>(tokens);
        sorted.sort(CODE_POINT_ORDER);
        return String.join(" ", sorted);
    }

    private static int compareCodePoints(String left, String right) {
        int i = 0;
        int j = 0;
        while (i < left.length() && j < right.length()) {
            int a = left.codePointAt(i);
            int b = right.codePointAt(j);
            if (a != b) {
                return Integer.compare(a, b);
            }
            i += Character.charCount(a);
            j += Character.charCount(b);
        }
        return Integer.compare(left.length() - i, right.length() - j);
    }
}
