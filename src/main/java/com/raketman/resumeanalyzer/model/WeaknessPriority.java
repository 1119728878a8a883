package com.raketman.resumeanalyzer.model;

public enum WeaknessPriority {
    CRITICAL,
    HIGH
}
