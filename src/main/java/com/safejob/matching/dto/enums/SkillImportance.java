package com.safejob.matching.dto.enums;

public enum SkillImportance {
    REQUIRED(3.0),
    PREFERRED(2.0),
    NICE_TO_HAVE(1.0);

    private final double defaultWeight;

    SkillImportance(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }
}
