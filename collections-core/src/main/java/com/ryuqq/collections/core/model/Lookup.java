package com.ryuqq.collections.core.model;

import java.util.Optional;

/**
 * Result of a keyed or indexed lookup.
 *
 * <p>Every operation that may or may not find something (get, put, remove, shift, ...)
 * returns a Lookup instead of throwing or returning a bare null.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>{@code found} is authoritative</li>
 *   <li>A found lookup may carry a null value (the stored value really was null)</li>
 *   <li>An absent lookup always carries a null value</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Lookup&lt;Integer&gt; previous = dictionary.put("a", 1);
 * if (previous.isFound()) {
 *     // "a" existed before, previous.value() is its old value
 * }
 * </pre>
 *
 * @param <V> value type
 * @param value the value found, null when absent
 * @param found whether a value was found
 *
 * @author Collections Team
 * @since 1.0.0
 */
public record Lookup<V>(V value, boolean found) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if a non-null value is marked as not found
     */
    public Lookup {
        if (!found && value != null) {
            throw new IllegalArgumentException("absent lookup cannot carry a value");
        }
    }

    /**
     * Creates a found lookup.
     *
     * @param value the value found (null allowed)
     * @param <V> value type
     * @return found Lookup
     */
    public static <V> Lookup<V> of(V value) {
        return new Lookup<>(value, true);
    }

    /**
     * Creates an absent lookup.
     *
     * @param <V> value type
     * @return absent Lookup
     */
    public static <V> Lookup<V> absent() {
        return new Lookup<>(null, false);
    }

    /**
     * @return true if a value was found
     */
    public boolean isFound() {
        return found;
    }

    /**
     * @return true if nothing was found
     */
    public boolean isAbsent() {
        return !found;
    }

    /**
     * Returns the value if found, otherwise the fallback.
     *
     * @param fallback value returned when absent
     * @return value or fallback
     */
    public V orElse(V fallback) {
        return found ? value : fallback;
    }

    /**
     * Converts to {@link Optional}.
     *
     * <p>A found null value becomes {@link Optional#empty()}; use {@link #isFound()}
     * when null values are meaningful.</p>
     *
     * @return Optional of the value
     */
    public Optional<V> toOptional() {
        return found ? Optional.ofNullable(value) : Optional.empty();
    }
}
