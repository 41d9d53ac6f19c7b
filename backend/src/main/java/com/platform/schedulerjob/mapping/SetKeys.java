package com.platform.schedulerjob.mapping;

import com.platform.schedulerjob.model.MonthlyOccurrenceSpec;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Identity keys and conversions for the order-independent schedule collections.
 *
 * <p>The scheduler service returns day names in a different case than the configuration
 * accepts them, so string keys are always case-folded before hashing.
 */
public final class SetKeys {
    
    private SetKeys() {
    }
    
    public static int ofInt(Integer value) {
        return value;
    }
    
    public static int ofStringIgnoreCase(String value) {
        return hashString(value.toLowerCase(Locale.ROOT));
    }
    
    public static int ofMonthlyOccurrence(MonthlyOccurrenceSpec occurrence) {
        String day = occurrence.day() == null ? "" : occurrence.day().toLowerCase(Locale.ROOT);
        return hashString(day + "-" + occurrence.occurrence() + "-");
    }
    
    /**
     * Non-negative CRC32 of the UTF-8 bytes.
     */
    public static int hashString(String value) {
        CRC32 crc = new CRC32();
        crc.update(value.getBytes(StandardCharsets.UTF_8));
        int hash = (int) crc.getValue();
        if (hash >= 0) {
            return hash;
        }
        return hash == Integer.MIN_VALUE ? 0 : -hash;
    }
    
    // ==================== Sequence <-> set ====================
    
    public static KeyedSet<Integer> intSet() {
        return KeyedSet.empty(SetKeys::ofInt);
    }
    
    public static KeyedSet<Integer> intSet(Collection<Integer> values) {
        return KeyedSet.of(SetKeys::ofInt, values);
    }
    
    public static KeyedSet<String> stringSetIgnoreCase() {
        return KeyedSet.empty(SetKeys::ofStringIgnoreCase);
    }
    
    public static KeyedSet<String> stringSetIgnoreCase(Collection<String> values) {
        return KeyedSet.of(SetKeys::ofStringIgnoreCase, values);
    }
    
    public static KeyedSet<MonthlyOccurrenceSpec> monthlyOccurrenceSet() {
        return KeyedSet.empty(SetKeys::ofMonthlyOccurrence);
    }
    
    public static KeyedSet<MonthlyOccurrenceSpec> monthlyOccurrenceSet(Collection<MonthlyOccurrenceSpec> values) {
        return KeyedSet.of(SetKeys::ofMonthlyOccurrence, values);
    }
    
    /**
     * Plain sequence for the wire, or {@code null} when the set is empty so the field is omitted.
     */
    public static <T> List<T> toListOrNull(KeyedSet<T> set) {
        return set == null || set.isEmpty() ? null : set.toList();
    }
}
