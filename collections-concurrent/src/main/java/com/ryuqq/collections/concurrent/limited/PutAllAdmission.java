package com.ryuqq.collections.concurrent.limited;

import java.util.Locale;

/**
 * How {@link LimitedDictionary#putAll(java.util.Map)} admits a batch of entries.
 *
 * @author Collections Team
 * @since 1.0.0
 */
public enum PutAllAdmission {

    /**
     * Up to {@code capacity} entries of the batch are written (updates refresh recency),
     * then the oldest keys are evicted until the dictionary fits its capacity again.
     */
    TOTAL_CAPACITY,

    /**
     * Updates of existing keys are always written and refresh recency. New keys are
     * written only while free slots remain; the rest of the batch is dropped.
     * Nothing is evicted.
     */
    REMAINING_CAPACITY;

    /**
     * Parses a configuration value.
     *
     * <p>Matching ignores case and surrounding blanks, and treats {@code -} as {@code _}.
     * A null or blank value selects {@link #TOTAL_CAPACITY}.</p>
     *
     * @param value configuration value
     * @return parsed admission mode
     * @throws IllegalArgumentException if the value names no admission mode
     */
    public static PutAllAdmission fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return TOTAL_CAPACITY;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PutAllAdmission admission : values()) {
            if (admission.name().equals(normalized)) {
                return admission;
            }
        }
        throw new IllegalArgumentException("Unknown putAll admission: " + value);
    }
}
