package com.platform.schedulerjob.document;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * RFC3339 timestamps as written in configuration documents. Output has second precision.
 */
public final class Rfc3339 {
    
    private static final DateTimeFormatter OUTPUT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");
    
    private Rfc3339() {
    }
    
    /**
     * @throws DateTimeParseException when the value is not an RFC3339 date-time with offset
     */
    public static OffsetDateTime parse(String value) {
        return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
    
    public static String format(OffsetDateTime value) {
        return value == null ? null : OUTPUT.format(value);
    }
}
