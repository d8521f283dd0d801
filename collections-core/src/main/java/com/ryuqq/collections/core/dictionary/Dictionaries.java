package com.ryuqq.collections.core.dictionary;

import com.ryuqq.collections.core.model.Pair;
import com.ryuqq.collections.core.vector.Vector;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Static helpers that build dictionaries of a new value type.
 *
 * <p><strong>Two families:</strong></p>
 * <ul>
 *   <li><strong>map:</strong> same keys, values transformed by {@code mapper(key, value)}</li>
 *   <li><strong>fromVector / fromList:</strong> each element becomes one entry through {@code mapper(element) -> Pair}</li>
 * </ul>
 *
 * <p>Each helper has an overload taking a {@link DictionaryConstructor} to choose the
 * result implementation; the short form builds a {@link HashDictionary}. When several
 * elements produce the same key, the last one wins.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class Dictionaries {

    private Dictionaries() {
    }

    public static <K, V, E> HashDictionary<K, E> map(Dictionary<K, V> source,
                                                     BiFunction<? super K, ? super V, ? extends E> mapper) {
        return Dictionaries.<K, V, E, HashDictionary<K, E>>map(source, mapper, HashDictionary::fromMap);
    }

    public static <K, V, E, D extends Dictionary<K, E>> D map(Dictionary<K, V> source,
                                                              BiFunction<? super K, ? super V, ? extends E> mapper,
                                                              DictionaryConstructor<K, E, D> constructor) {
        requireNonNull(source, "source");
        return map(source.collect(), mapper, constructor);
    }

    public static <K, V, E> HashDictionary<K, E> map(Map<K, V> source,
                                                     BiFunction<? super K, ? super V, ? extends E> mapper) {
        return Dictionaries.<K, V, E, HashDictionary<K, E>>map(source, mapper, HashDictionary::fromMap);
    }

    /**
     * Transforms every value of a map into a new dictionary.
     *
     * @param source source entries (left untouched)
     * @param mapper receives (key, value), returns the new value
     * @param constructor builds the result implementation
     * @param <K> key type
     * @param <V> source value type
     * @param <E> result value type
     * @param <D> result dictionary type
     * @return new dictionary with the same keys
     */
    public static <K, V, E, D extends Dictionary<K, E>> D map(Map<K, V> source,
                                                              BiFunction<? super K, ? super V, ? extends E> mapper,
                                                              DictionaryConstructor<K, E, D> constructor) {
        requireNonNull(source, "source");
        requireNonNull(mapper, "mapper");
        requireNonNull(constructor, "constructor");

        Map<K, E> mapped = new HashMap<>(source.size());
        for (Map.Entry<K, V> entry : source.entrySet()) {
            mapped.put(entry.getKey(), mapper.apply(entry.getKey(), entry.getValue()));
        }
        return constructor.create(mapped);
    }

    public static <I, K, V> HashDictionary<K, V> fromVector(Vector<I> source,
                                                            Function<? super I, Pair<K, V>> mapper) {
        return Dictionaries.<I, K, V, HashDictionary<K, V>>fromVector(source, mapper, HashDictionary::fromMap);
    }

    public static <I, K, V, D extends Dictionary<K, V>> D fromVector(Vector<I> source,
                                                                     Function<? super I, Pair<K, V>> mapper,
                                                                     DictionaryConstructor<K, V, D> constructor) {
        requireNonNull(source, "source");
        return fromList(source.collect(), mapper, constructor);
    }

    public static <I, K, V> HashDictionary<K, V> fromList(List<I> source,
                                                          Function<? super I, Pair<K, V>> mapper) {
        return Dictionaries.<I, K, V, HashDictionary<K, V>>fromList(source, mapper, HashDictionary::fromMap);
    }

    /**
     * Turns every list element into one entry of a new dictionary.
     *
     * @param source source elements
     * @param mapper returns the (key, value) entry of an element
     * @param constructor builds the result implementation
     * @param <I> element type
     * @param <K> key type
     * @param <V> value type
     * @param <D> result dictionary type
     * @return new dictionary
     */
    public static <I, K, V, D extends Dictionary<K, V>> D fromList(List<I> source,
                                                                   Function<? super I, Pair<K, V>> mapper,
                                                                   DictionaryConstructor<K, V, D> constructor) {
        requireNonNull(source, "source");
        requireNonNull(mapper, "mapper");
        requireNonNull(constructor, "constructor");

        Map<K, V> entries = new HashMap<>();
        for (I item : source) {
            Pair<K, V> pair = mapper.apply(item);
            entries.put(pair.key(), pair.value());
        }
        return constructor.create(entries);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
