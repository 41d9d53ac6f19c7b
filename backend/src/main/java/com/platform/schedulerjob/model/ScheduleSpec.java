package com.platform.schedulerjob.model;

import com.platform.schedulerjob.mapping.KeyedSet;
import com.platform.schedulerjob.mapping.SetKeys;
import lombok.Builder;

/**
 * Specific minutes, hours and days a recurring job runs on.
 * Every collection is order-independent; {@code null} collections are normalised to empty.
 *
 * <p>{@code weekDays}, {@code monthDays} and {@code monthlyOccurrences} are mutually exclusive.
 */
@Builder(toBuilder = true)
public record ScheduleSpec(
    KeyedSet<Integer> minutes,
    KeyedSet<Integer> hours,
    KeyedSet<String> weekDays,
    KeyedSet<Integer> monthDays,
    KeyedSet<MonthlyOccurrenceSpec> monthlyOccurrences
) {
    
    public ScheduleSpec {
        minutes = minutes == null ? SetKeys.intSet() : minutes;
        hours = hours == null ? SetKeys.intSet() : hours;
        weekDays = weekDays == null ? SetKeys.stringSetIgnoreCase() : weekDays;
        monthDays = monthDays == null ? SetKeys.intSet() : monthDays;
        monthlyOccurrences = monthlyOccurrences == null ? SetKeys.monthlyOccurrenceSet() : monthlyOccurrences;
    }
    
    /**
     * True when no collection holds a value. Such a schedule must never be sent.
     */
    public boolean isEmpty() {
        return minutes.isEmpty()
            && hours.isEmpty()
            && weekDays.isEmpty()
            && monthDays.isEmpty()
            && monthlyOccurrences.isEmpty();
    }
}
