package com.ryuqq.collections.core.dictionary;

import java.util.Map;

/**
 * Builds a {@link Dictionary} implementation from a map of entries.
 *
 * <p>Lets the mapping helpers in {@link Dictionaries} produce any implementation. The
 * produced type cannot be inferred from a generic factory reference, so name it at the call:</p>
 * <pre>
 * HashDictionary&lt;String, Integer&gt; lengths =
 *     Dictionaries.&lt;String, String, Integer, HashDictionary&lt;String, Integer&gt;&gt;map(
 *         words, (key, word) -&gt; word.length(), HashDictionary::fromMap);
 * </pre>
 *
 * @param <K> key type
 * @param <V> value type
 * @param <D> produced dictionary type
 *
 * @author Collections Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DictionaryConstructor<K, V, D extends Dictionary<K, V>> {

    /**
     * @param items entries of the new dictionary
     * @return new dictionary
     */
    D create(Map<K, V> items);
}
