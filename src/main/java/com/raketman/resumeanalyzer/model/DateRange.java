package com.raketman.resumeanalyzer.model;

import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.time.temporal.ChronoUnit;

@Value
@Builder
public class DateRange {

    YearMonth start;
    YearMonth end;
    boolean current;

    /**
     * Inclusive month span, resolving an open end against {@code now}.
     */
    public int months(YearMonth now) {
        YearMonth effectiveEnd = current ? now : end;
        if (effectiveEnd.isBefore(start)) {
            return 0;
        }
        return (int) ChronoUnit.MONTHS.between(start, effectiveEnd) + 1;
    }
}
