package com.raketman.resumeanalyzer.model;

public enum FitLevel {
    STRONG(80),
    GOOD(60),
    FAIR(40),
    POOR(0);

    private final int minCompatibility;

    FitLevel(int minCompatibility) {
        this.minCompatibility = minCompatibility;
    }

    public static FitLevel of(int compatibility) {
        for (FitLevel level : values()) {
            if (compatibility >= level.minCompatibility) {
                return level;
            }
        }
        return POOR;
    }
}
