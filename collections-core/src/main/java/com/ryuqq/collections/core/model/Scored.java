package com.ryuqq.collections.core.model;

/**
 * Result of a max/min scan.
 *
 * <p>Carries the winning item together with the score the caller's scorer gave it.
 * Scanning an empty collection yields {@link #empty()}: no item, score 0, not found.</p>
 *
 * <p>When several items share the extremal score, which one is returned is unspecified.
 * Only {@link #score()} is guaranteed to be the true maximum or minimum.</p>
 *
 * @param <T> item type (element for vectors, {@link Pair} for dictionaries)
 * @param item the winning item, null when not found
 * @param score the winning score, 0 when not found
 * @param found false only when the scanned collection was empty
 *
 * @author Collections Team
 * @since 1.0.0
 */
public record Scored<T>(T item, int score, boolean found) {

    /**
     * Creates a found result.
     *
     * @param item the winning item
     * @param score its score
     * @param <T> item type
     * @return found Scored
     */
    public static <T> Scored<T> of(T item, int score) {
        return new Scored<>(item, score, true);
    }

    /**
     * Returns the result of scanning an empty collection.
     *
     * @param <T> item type
     * @return empty Scored
     */
    public static <T> Scored<T> empty() {
        return new Scored<>(null, 0, false);
    }
}
