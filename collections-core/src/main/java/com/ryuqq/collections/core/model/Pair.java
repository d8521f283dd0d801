package com.ryuqq.collections.core.model;

/**
 * Immutable key/value pair.
 *
 * <p>Returned by {@code Dictionary.pairs()} and as the item of
 * {@code Dictionary.max()} / {@code Dictionary.min()}. Both components may be null;
 * an empty {@link Scored} carries a pair whose key and value are null.</p>
 *
 * @param <K> key type
 * @param <V> value type
 * @param key the key
 * @param value the value
 *
 * @author Collections Team
 * @since 1.0.0
 */
public record Pair<K, V>(K key, V value) {

    /**
     * Creates a pair.
     *
     * @param key the key
     * @param value the value
     * @param <K> key type
     * @param <V> value type
     * @return Pair instance
     */
    public static <K, V> Pair<K, V> of(K key, V value) {
        return new Pair<>(key, value);
    }
}
