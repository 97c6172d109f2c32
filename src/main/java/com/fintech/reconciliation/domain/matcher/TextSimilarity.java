package com.fintech.reconciliation.domain.matcher;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Approximate string similarity on a 0-100 scale.
 *
 * {@link #ratio} is the normalized indel similarity
 * {@code 200 * LCS(a, b) / (|a| + |b|)}, i.e. Levenshtein distance with
 * insertions and deletions only. Empty input never matches anything.
 */
public final class TextSimilarity {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextSimilarity() {
    }

    /**
     * Lower-case, strip punctuation, collapse whitespace. Null becomes "".
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static double ratio(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int common = LCS.apply(a, b);
        return 200.0 * common / (a.length() + b.length());
    }

    /**
     * Best {@link #ratio} between the shorter string and any equally long window
     * of the longer one.
     */
    public static double partialRatio(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        if (shorter.isEmpty()) {
            return 0.0;
        }
        if (shorter.length() == longer.length()) {
            return ratio(shorter, longer);
        }
        double best = 0.0;
        for (int start = 0; start + shorter.length() <= longer.length(); start++) {
            best = Math.max(best, ratio(shorter, longer.substring(start, start + shorter.length())));
            if (best == 100.0) {
                break;
            }
        }
        return best;
    }

    /**
     * Word-order insensitive similarity: shared words are compared together with each
     * side's remaining words. 100 when one side's words are a subset of the other's.
     */
    public static double tokenSetRatio(String a, String b) {
        SortedSet<String> tokensA = tokens(a);
        SortedSet<String> tokensB = tokens(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }

        SortedSet<String> shared = new TreeSet<>(tokensA);
        shared.retainAll(tokensB);
        SortedSet<String> onlyA = new TreeSet<>(tokensA);
        onlyA.removeAll(tokensB);
        SortedSet<String> onlyB = new TreeSet<>(tokensB);
        onlyB.removeAll(tokensA);

        if (!shared.isEmpty() && (onlyA.isEmpty() || onlyB.isEmpty())) {
            return 100.0;
        }

        String sharedText = String.join(" ", shared);
        String combinedA = join(sharedText, String.join(" ", onlyA));
        String combinedB = join(sharedText, String.join(" ", onlyB));

        double best = ratio(combinedA, combinedB);
        if (!sharedText.isEmpty()) {
            best = Math.max(best, ratio(sharedText, combinedA));
            best = Math.max(best, ratio(sharedText, combinedB));
        }
        return best;
    }

    /**
     * Similarity used by the matchers: the better of {@link #ratio} and
     * {@link #tokenSetRatio} on normalized text.
     */
    public static double similarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        return Math.max(ratio(left, right), tokenSetRatio(left, right));
    }

    private static SortedSet<String> tokens(String text) {
        SortedSet<String> tokens = new TreeSet<>();
        for (String token : WHITESPACE.split(text.trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String join(String left, String right) {
        if (left.isEmpty()) {
            return right;
        }
        return right.isEmpty() ? left : left + " " + right;
    }
}
