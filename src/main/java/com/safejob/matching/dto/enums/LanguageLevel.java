package com.safejob.matching.dto.enums;

/**
 * Ordinal language proficiency, each level carrying its score on the 0-100 scale.
 */
public enum LanguageLevel {
    NONE(0),
    BASIC(25),
    INTERMEDIATE(50),
    ADVANCED(75),
    NATIVE(100);

    private final int score;

    LanguageLevel(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }
}
