package com.platform.schedulerjob.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Fixed-interval retry policy. Absence of a retry block means the job is never retried.
 *
 * <p>The interval is an opaque duration string ({@code hh:mm:ss}). It is passed through
 * unchecked: the scheduler service silently misbehaves on malformed values, and stricter
 * local parsing would reject configurations that were previously accepted.
 */
public record RetrySpec(
    String interval,
    
    @Min(1) @Max(20)
    Integer count
) {
    
    public static final String DEFAULT_INTERVAL = "00:00:30";
    public static final int DEFAULT_COUNT = 4;
    
    public static RetrySpec defaults() {
        return new RetrySpec(DEFAULT_INTERVAL, DEFAULT_COUNT);
    }
}
