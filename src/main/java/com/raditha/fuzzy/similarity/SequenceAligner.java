package com.raditha.fuzzy.similarity;

import com.raditha.fuzzy.config.AlignerConfig;
import com.raditha.fuzzy.model.MatchingBlock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds matching blocks between two symbol sequences with the Ratcliff-Obershelp
 * method: take the longest common run, then repeat on the pieces to its left and
 * to its right.
 * <p>
 * Ties between runs of equal length go to the one starting earliest in the first
 * sequence, then earliest in the second. The search is driven by an explicit
 * work list so that stack depth does not grow with the input.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public class SequenceAligner {

    private final AlignerConfig config;

    public SequenceAligner() {
        this(AlignerConfig.defaults());
    }

    public SequenceAligner(AlignerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * Similarity of two sequences as {@code 2 * M / T}, where M is the number of
     * matched symbols and T the combined length. Two empty sequences are identical.
     *
     * @return ratio between 0.0 and 1.0
     */
    public double ratio(int[] a, int[] b) {
        return ratio(matchingBlocks(a, b), a.length, b.length);
    }

    /**
     * Ratio over an already computed block list.
     */
    public static double ratio(List<MatchingBlock> blocks, int lengthA, int lengthB) {
        int total = lengthA + lengthB;
        if (total == 0) {
            return 1.0;
        }
        int matches = 0;
        for (MatchingBlock block : blocks) {
            matches += block.size();
        }
        return 2.0 * matches / total;
    }

    /**
     * Compute the matching blocks of {@code a} against {@code b}.
     * <p>
     * Blocks are ordered by position and never overlap. Adjacent blocks are merged,
     * and the list always ends with {@link MatchingBlock#terminal(int, int)}.
     *
     * @param a first sequence (code points)
     * @param b second sequence (code points); the popular-symbol heuristic is applied to this one
     * @return matching blocks followed by the terminal block
     */
    public List<MatchingBlock> matchingBlocks(int[] a, int[] b) {
        Map<Integer, int[]> positions = indexSecond(b);

        List<MatchingBlock> found = new ArrayList<>();
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[] { 0, a.length, 0, b.length });

        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0];
            int ahi = range[1];
            int blo = range[2];
            int bhi = range[3];

            MatchingBlock match = findLongestMatch(a, b, positions, alo, ahi, blo, bhi);
            int i = match.a();
            int j = match.b();
            int k = match.size();
            if (k == 0) {
                continue;
            }
            found.add(match);
            if (alo < i && blo < j) {
                pending.push(new int[] { alo, i, blo, j });
            }
            if (i + k < ahi && j + k < bhi) {
                pending.push(new int[] { i + k, ahi, j + k, bhi });
            }
        }

        found.sort(Comparator.comparingInt(MatchingBlock::a).thenComparingInt(MatchingBlock::b));
        List<MatchingBlock> blocks = mergeAdjacent(found);
        blocks.add(MatchingBlock.terminal(a.length, b.length));
        return blocks;
    }

    /**
     * Find the longest run {@code a[i, i+k) == b[j, j+k)} with
     * {@code alo <= i <= i+k <= ahi} and {@code blo <= j <= j+k <= bhi}.
     * Popular symbols cannot start a run, but the run is extended over equal
     * neighbours afterwards.
     */
    MatchingBlock findLongestMatch(int[] a, int[] b, Map<Integer, int[]> positions,
            int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestSize = 0;

        // runLength.get(j) = length of the run ending at a[i - 1] and b[j]
        Map<Integer, Integer> runLength = new HashMap<>();
        Map<Integer, Integer> nextRunLength = new HashMap<>();

        for (int i = alo; i < ahi; i++) {
            nextRunLength.clear();
            int[] candidates = positions.get(a[i]);
            if (candidates != null) {
                for (int j : candidates) {
                    if (j < blo) {
                        continue;
                    }
                    if (j >= bhi) {
                        break;
                    }
                    int k = runLength.getOrDefault(j - 1, 0) + 1;
                    nextRunLength.put(j, k);
                    if (k > bestSize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            Map<Integer, Integer> swap = runLength;
            runLength = nextRunLength;
            nextRunLength = swap;
        }

        while (besti > alo && bestj > blo && a[besti - 1] == b[bestj - 1]) {
            besti--;
            bestj--;
            bestSize++;
        }
        while (besti + bestSize < ahi && bestj + bestSize < bhi
                && a[besti + bestSize] == b[bestj + bestSize]) {
            bestSize++;
        }

        return new MatchingBlock(besti, bestj, bestSize);
    }

    /**
     * Map each symbol of {@code b} to its ascending positions, leaving out popular
     * symbols when the heuristic applies.
     */
    Map<Integer, int[]> indexSecond(int[] b) {
        Map<Integer, List<Integer>> lists = new HashMap<>();
        for (int j = 0; j < b.length; j++) {
            lists.computeIfAbsent(b[j], key -> new ArrayList<>()).add(j);
        }

        if (config.appliesTo(b.length)) {
            int threshold = config.popularityThreshold(b.length);
            lists.values().removeIf(occurrences -> occurrences.size() > threshold);
        }

        Map<Integer, int[]> positions = new HashMap<>(lists.size() * 2);
        for (Map.Entry<Integer, List<Integer>> entry : lists.entrySet()) {
            positions.put(entry.getKey(), entry.getValue().stream().mapToInt(Integer::intValue).toArray());
        }
        return positions;
    }

    private static List<MatchingBlock> mergeAdjacent(List<MatchingBlock> sorted) {
        List<MatchingBlock> merged = new ArrayList<>(sorted.size() + 1);
        MatchingBlock current = null;
        for (MatchingBlock block : sorted) {
            if (current == null) {
                current = block;
            } else if (current.isAdjacentTo(block)) {
                current = new MatchingBlock(current.a(), current.b(), current.size() + block.size());
            } else {
                merged.add(current);
                current = block;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }

    /**
     * Code points of a string, the symbol sequence every ratio works on.
     */
    public static int[] codePoints(String s) {
        return s.codePoints().toArray();
    }
}
