package com.trendsentinel.core.stats;

import com.trendsentinel.core.model.CensorKind;

/**
 * Orders two possibly censored observations.
 *
 * <p>
 * Each observation is read as an interval: an exact value {@code v} is
 * {@code [v, v]}, a left-censored {@code <v} is {@code (-inf, v)} and a
 * right-censored {@code >v} is {@code (v, +inf)}. One observation is greater
 * than another only when its interval lies entirely above the other's;
 * overlapping intervals are ambiguous and compare as 0.
 * </p>
 */
final class CensoredComparison {

    private CensoredComparison() {
    }

    /**
     * @return {@code +1} if b is certainly greater than a, {@code -1} if
     *         certainly smaller, {@code 0} if tied or ambiguous
     */
    static int compare(double a, CensorKind kindA, double b, CensorKind kindB) {
        if (isCertainlyGreater(b, kindB, a, kindA)) {
            return 1;
        }
        if (isCertainlyGreater(a, kindA, b, kindB)) {
            return -1;
        }
        return 0;
    }

    private static boolean isCertainlyGreater(double x, CensorKind kindX, double y, CensorKind kindY) {
        // lower bound of x against upper bound of y
        double lowerX = kindX == CensorKind.LEFT ? Double.NEGATIVE_INFINITY : x;
        double upperY = kindY == CensorKind.RIGHT ? Double.POSITIVE_INFINITY : y;
        if (lowerX > upperY) {
            return true;
        }
        boolean openBound = kindX == CensorKind.RIGHT || kindY == CensorKind.LEFT;
        return lowerX == upperY && openBound && Double.isFinite(lowerX);
    }
}
