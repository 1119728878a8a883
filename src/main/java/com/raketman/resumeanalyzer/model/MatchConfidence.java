package com.raketman.resumeanalyzer.model;

public enum MatchConfidence {
    EXACT,
    FUZZY
}
