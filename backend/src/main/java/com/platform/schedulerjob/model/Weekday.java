package com.platform.schedulerjob.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Day names accepted by the scheduler service for week days and monthly occurrences.
 * Configuration values are matched case-insensitively.
 */
public enum Weekday {
    SUNDAY("Sunday"),
    MONDAY("Monday"),
    TUESDAY("Tuesday"),
    WEDNESDAY("Wednesday"),
    THURSDAY("Thursday"),
    FRIDAY("Friday"),
    SATURDAY("Saturday");
    
    private final String wireValue;
    
    Weekday(String wireValue) {
        this.wireValue = wireValue;
    }
    
    public String wireValue() {
        return wireValue;
    }
    
    public static Optional<Weekday> fromValue(String value) {
        return Arrays.stream(values())
            .filter(day -> day.wireValue.equalsIgnoreCase(value))
            .findFirst();
    }
}
