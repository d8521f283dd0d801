package com.ryuqq.collections.concurrent.limited;

/**
 * LimitedDictionary settings (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>capacity: maximum number of keys held at once</li>
 *   <li>putAllAdmission: how putAll admits a batch (default {@link PutAllAdmission#TOTAL_CAPACITY})</li>
 * </ul>
 *
 * @author Collections Team
 * @since 1.0.0
 * @param capacity maximum number of keys (must be positive)
 * @param putAllAdmission putAll admission mode (not null)
 */
public record LimitedDictionaryConfig(int capacity, PutAllAdmission putAllAdmission) {

    /**
     * Creates a config with the default admission mode.
     *
     * @param capacity maximum number of keys
     */
    public LimitedDictionaryConfig(int capacity) {
        this(capacity, PutAllAdmission.TOTAL_CAPACITY);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if a field is invalid
     */
    public LimitedDictionaryConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                "capacity must be positive (current: " + capacity + ")"
            );
        }
        if (putAllAdmission == null) {
            throw new IllegalArgumentException("putAllAdmission cannot be null");
        }
    }

    /**
     * @param capacity new capacity
     * @return new LimitedDictionaryConfig
     */
    public LimitedDictionaryConfig withCapacity(int capacity) {
        return new LimitedDictionaryConfig(capacity, this.putAllAdmission);
    }

    /**
     * @param putAllAdmission new admission mode
     * @return new LimitedDictionaryConfig
     */
    public LimitedDictionaryConfig withPutAllAdmission(PutAllAdmission putAllAdmission) {
        return new LimitedDictionaryConfig(this.capacity, putAllAdmission);
    }
}
