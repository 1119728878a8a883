package com.raketman.resumeanalyzer.model;

public enum SeniorityFit {
    BELOW,
    MEETS,
    ABOVE,
    UNKNOWN;

    public static SeniorityFit compare(ExperienceLevel actual, ExperienceLevel expected) {
        if (actual == ExperienceLevel.UNKNOWN || expected == null || expected == ExperienceLevel.UNKNOWN) {
            return UNKNOWN;
        }
        int diff = actual.compareTo(expected);
        if (diff == 0) {
            return MEETS;
        }
        return diff < 0 ? BELOW : ABOVE;
    }
}
