package com.platform.schedulerjob.remote;

import java.util.Arrays;
import java.util.Optional;

/**
 * Retry policy discriminator.
 */
public enum RetryType {
    NONE("None"),
    FIXED("Fixed");
    
    private final String wireValue;
    
    RetryType(String wireValue) {
        this.wireValue = wireValue;
    }
    
    public String wireValue() {
        return wireValue;
    }
    
    public static Optional<RetryType> fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.wireValue.equalsIgnoreCase(value))
            .findFirst();
    }
}
