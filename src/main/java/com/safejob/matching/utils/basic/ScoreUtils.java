package com.safejob.matching.utils.basic;

public final class ScoreUtils {
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    private ScoreUtils() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static double clamp(double score) {
        if (Double.isNaN(score)) return MIN_SCORE;
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }

    public static double round2(double score) {
        return Math.round(score * 100.0) / 100.0;
    }
}
