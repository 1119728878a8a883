package com.raketman.resumeanalyzer.model;

public enum ScoreCategory {
    CONTACT("Contact Information"),
    SKILLS("Skills"),
    EXPERIENCE_QUALITY("Experience Quality"),
    QUANTIFIED_ACHIEVEMENTS("Quantified Achievements"),
    CONTENT_OPTIMIZATION("Content Optimization");

    private final String displayName;

    ScoreCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
