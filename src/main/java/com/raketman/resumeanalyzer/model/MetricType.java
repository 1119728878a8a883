package com.raketman.resumeanalyzer.model;

/**
 * Kinds of measurable impact, declared in detection priority order.
 */
public enum MetricType {
    PERCENT,
    CURRENCY,
    COUNT,
    DURATION
}
