package com.platform.schedulerjob.model;

/**
 * The n-th weekday of a month, e.g. the second Monday ({@code occurrence = 2}) or the
 * last Friday ({@code occurrence = -1}).
 */
public record MonthlyOccurrenceSpec(String day, Integer occurrence) {
}
