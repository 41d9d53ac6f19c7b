package com.platform.schedulerjob.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;

import java.time.OffsetDateTime;

/**
 * When and how often a job runs.
 *
 * <p>At least one of {@code count} or {@code endTime} has to be set before the job is
 * written; that rule lives in the pre-reconciliation validator, not here. The upper bound
 * of {@code interval} depends on {@code frequency} and the job collection quota, and is
 * left to the scheduler service.
 *
 * @param frequency case-insensitive; the case given is preserved when sent
 * @param schedule  {@code null} when no schedule block was declared
 */
@Builder(toBuilder = true)
public record RecurrenceSpec(
    @NotBlank
    @Pattern(regexp = "(?i)minute|hour|day|week|month", message = "must be one of Minute, Hour, Day, Week or Month")
    String frequency,
    
    @Min(1)
    Integer interval,
    
    @Min(1)
    Integer count,
    
    OffsetDateTime endTime,
    
    @Valid
    ScheduleSpec schedule
) {
    
    public static final int DEFAULT_INTERVAL = 1;
    
    public boolean hasEndCondition() {
        return count != null || endTime != null;
    }
}
