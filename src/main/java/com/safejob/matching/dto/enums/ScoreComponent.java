package com.safejob.matching.dto.enums;

public enum ScoreComponent {
    SKILLS("skills"),
    LOCATION("location"),
    EXPERIENCE("experience"),
    LANGUAGE("language"),
    AVAILABILITY("availability"),
    PREFERENCES("preferences");

    private final String key;

    ScoreComponent(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
