package com.raketman.resumeanalyzer.model;

public enum ExperienceLevel {
    ENTRY,
    MID,
    SENIOR,
    UNKNOWN;

    private static final int MID_LEVEL_MONTHS = 24;
    private static final int SENIOR_LEVEL_MONTHS = 60;

    public static ExperienceLevel fromMonths(int months, boolean dated) {
        if (!dated) {
            return UNKNOWN;
        }
        if (months >= SENIOR_LEVEL_MONTHS) {
            return SENIOR;
        }
        return months >= MID_LEVEL_MONTHS ? MID : ENTRY;
    }
}
