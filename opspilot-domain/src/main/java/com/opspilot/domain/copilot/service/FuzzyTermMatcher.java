package com.opspilot.domain.copilot.service;

import java.util.Collection;
import java.util.Set;

/**
 * 词元级近似匹配，用于识别拼写变形的注入指令词。
 * <p>
 * 相似度为 Ratcliff/Obershelp 比值 2*M/(|a|+|b|)，M 为递归最长公共子串的匹配字符数。
 * 只有两侧长度都不小于 5 且长度差不超过 2 时才做近似比较，否则要求完全相等。
 * </p>
 */
public final class FuzzyTermMatcher {

    public static final double DEFAULT_MIN_RATIO = 0.82;

    private static final int MIN_FUZZY_LENGTH = 5;
    private static final int MAX_LENGTH_DELTA = 2;

    private FuzzyTermMatcher() {
    }

    public static boolean hasTermLike(Collection<String> tokens, Set<String> terms) {
        return hasTermLike(tokens, terms, DEFAULT_MIN_RATIO);
    }

    public static boolean hasTermLike(Collection<String> tokens, Set<String> terms, double minRatio) {
        if (tokens == null || terms == null) {
            return false;
        }
        for (String token : tokens) {
            for (String term : terms) {
                if (token.equals(term)) {
                    return true;
                }
                if (token.length() < MIN_FUZZY_LENGTH || term.length() < MIN_FUZZY_LENGTH) {
                    continue;
                }
                if (Math.abs(token.length() - term.length()) > MAX_LENGTH_DELTA) {
                    continue;
                }
                if (similarity(token, term) >= minRatio) {
                    return true;
                }
            }
        }
        return false;
    }

    public static double similarity(String left, String right) {
        int total = left.length() + right.length();
        if (total == 0) {
            return 1.0D;
        }
        int matches = matchingCharacters(left, 0, left.length(), right, 0, right.length());
        return 2.0D * matches / total;
    }

    private static int matchingCharacters(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        if (aLow >= aHigh || bLow >= bHigh) {
            return 0;
        }
        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        int width = bHigh - bLow + 1;
        int[] previous = new int[width];
        for (int i = aLow; i < aHigh; i++) {
            int[] current = new int[width];
            for (int j = bLow; j < bHigh; j++) {
                if (a.charAt(i) != b.charAt(j)) {
                    continue;
                }
                int size = previous[j - bLow] + 1;
                current[j - bLow + 1] = size;
                // 同长度时保留 a 中最靠前、其次 b 中最靠前的匹配块
                if (size > bestSize) {
                    bestI = i - size + 1;
                    bestJ = j - size + 1;
                    bestSize = size;
                }
            }
            previous = current;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
                + matchingCharacters(a, aLow, bestI, b, bLow, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHigh, b, bestJ + bestSize, bHigh);
    }
}
