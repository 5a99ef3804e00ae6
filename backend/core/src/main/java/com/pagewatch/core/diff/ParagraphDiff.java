package com.pagewatch.core.diff;

import com.pagewatch.core.model.TextDelta;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Paragraph-level edit script based on the longest common subsequence. Removed paragraphs carry
 * their index in the previous list, added paragraphs their index in the current list.
 *
 * <p>When the differing middle section would need a table larger than {@link #MAX_TABLE_CELLS},
 * the script degrades to a multiset comparison: paragraphs missing from the other side are
 * reported, removals first, and moved paragraphs are not detected.
 */
public final class ParagraphDiff {
    static final long MAX_TABLE_CELLS = 1_000_000L;

    private ParagraphDiff() {
    }

    public static List<TextDelta> diff(List<String> previous, List<String> current) {
        int start = 0;
        while (start < previous.size() && start < current.size() && previous.get(start).equals(current.get(start))) {
            start++;
        }
        int previousEnd = previous.size();
        int currentEnd = current.size();
        while (previousEnd > start && currentEnd > start
                && previous.get(previousEnd - 1).equals(current.get(currentEnd - 1))) {
            previousEnd--;
            currentEnd--;
        }

        int rows = previousEnd - start;
        int cols = currentEnd - start;
        if ((long) (rows + 1) * (cols + 1) > MAX_TABLE_CELLS) {
            return unmatched(previous.subList(start, previousEnd), current.subList(start, currentEnd), start);
        }
        int[][] lcs = new int[rows + 1][cols + 1];
        for (int i = rows - 1; i >= 0; i--) {
            for (int j = cols - 1; j >= 0; j--) {
                if (previous.get(start + i).equals(current.get(start + j))) {
                    lcs[i][j] = lcs[i + 1][j + 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
        }

        List<TextDelta> deltas = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < rows || j < cols) {
            if (i < rows && j < cols && previous.get(start + i).equals(current.get(start + j))) {
                i++;
                j++;
            } else if (j < cols && (i == rows || lcs[i][j + 1] > lcs[i + 1][j])) {
                deltas.add(TextDelta.added(current.get(start + j), start + j));
                j++;
            } else {
                deltas.add(TextDelta.removed(previous.get(start + i), start + i));
                i++;
            }
        }
        return deltas;
    }

    private static List<TextDelta> unmatched(List<String> previous, List<String> current, int offset) {
        Map<String, Integer> available = new HashMap<>();
        current.forEach(paragraph -> available.merge(paragraph, 1, Integer::sum));
        List<TextDelta> deltas = new ArrayList<>();
        for (int i = 0; i < previous.size(); i++) {
            String paragraph = previous.get(i);
            if (available.getOrDefault(paragraph, 0) > 0) {
                available.merge(paragraph, -1, Integer::sum);
            } else {
                deltas.add(TextDelta.removed(paragraph, offset + i));
            }
        }
        Map<String, Integer> remaining = new HashMap<>();
        previous.forEach(paragraph -> remaining.merge(paragraph, 1, Integer::sum));
        for (int j = 0; j < current.size(); j++) {
            String paragraph = current.get(j);
            if (remaining.getOrDefault(paragraph, 0) > 0) {
                remaining.merge(paragraph, -1, Integer::sum);
            } else {
                deltas.add(TextDelta.added(paragraph, offset + j));
            }
        }
        return deltas;
    }
}
