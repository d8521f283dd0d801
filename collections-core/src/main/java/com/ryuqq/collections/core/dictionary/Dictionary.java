package com.ryuqq.collections.core.dictionary;

import com.ryuqq.collections.core.model.Lookup;
import com.ryuqq.collections.core.model.Pair;
import com.ryuqq.collections.core.model.Scored;
import com.ryuqq.collections.core.vector.Vector;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.ToIntBiFunction;

/**
 * Key/value mapping contract.
 *
 * <p>This interface is implemented by the plain {@link HashDictionary} in this module and by
 * the thread-safe and bounded dictionaries in {@code collections-concurrent}. Every
 * implementation must pass the contract tests in {@code collections-testkit}.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Keyed reads and writes with (value, found) results</li>
 *   <li>Predicate search (all matches, one match)</li>
 *   <li>Copying and in-place transformations (filter, map, clean)</li>
 *   <li>Max/min folding with a caller-supplied integer scorer</li>
 *   <li>Unordered snapshots of keys, values and pairs</li>
 * </ul>
 *
 * <p><strong>Ordering:</strong> The backing store is a hash table. Iteration order of
 * {@link #forEach}, {@link #find}, {@link #findOne}, {@link #keys()} and friends is
 * unspecified; callers must not depend on it.</p>
 *
 * <p><strong>Error Model:</strong></p>
 * <ul>
 *   <li>Absence is reported through {@link Lookup#found()}, never an exception</li>
 *   <li>Null keys and null function arguments are contract violations ({@link IllegalArgumentException})</li>
 *   <li>Null values are allowed and distinguishable from absence</li>
 *   <li>Exceptions thrown by caller functions propagate unchanged</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 *
 * @author Collections Team
 * @since 1.0.0
 */
public interface Dictionary<K, V> {

    /**
     * @return number of entries
     */
    int size();

    /**
     * @param key key to test
     * @return true if the key is present
     */
    boolean exists(K key);

    /**
     * Collects the values of every matching entry.
     *
     * @param predicate receives (key, value)
     * @return matching values, unordered
     */
    List<V> find(BiPredicate<? super K, ? super V> predicate);

    /**
     * Finds the value of one matching entry.
     *
     * <p>If several entries match, which one is returned is unspecified.</p>
     *
     * @param predicate receives (key, value)
     * @return a matching value, or absent
     */
    Lookup<V> findOne(BiPredicate<? super K, ? super V> predicate);

    /**
     * @param key key to read
     * @return stored value, or absent
     */
    Lookup<V> get(K key);

    /**
     * Inserts or overwrites an entry.
     *
     * @param key entry key
     * @param value new value
     * @return value stored before the write, or absent if the key was new
     */
    Lookup<V> put(K key, V value);

    /**
     * Inserts an entry only when the key is absent.
     *
     * @param key entry key
     * @param value value to insert
     * @return existing value (dictionary untouched), or absent if the value was inserted
     */
    Lookup<V> putIfAbsent(K key, V value);

    /**
     * Writes every entry of the given map.
     *
     * @param items entries to write
     * @return this dictionary
     */
    Dictionary<K, V> putAll(Map<? extends K, ? extends V> items);

    /**
     * Writes every entry of another dictionary ({@code putAll(other.collect())}).
     *
     * @param other source dictionary (left untouched)
     * @return this dictionary
     */
    Dictionary<K, V> merge(Dictionary<? extends K, ? extends V> other);

    /**
     * Returns a new dictionary of the same family holding the matching entries.
     *
     * @param predicate receives (key, value)
     * @return new dictionary, this one untouched
     */
    Dictionary<K, V> filter(BiPredicate<? super K, ? super V> predicate);

    /**
     * Retains only the matching entries.
     *
     * @param predicate receives (key, value)
     * @return this dictionary
     */
    Dictionary<K, V> filterSelf(BiPredicate<? super K, ? super V> predicate);

    /**
     * @param key key to delete
     * @return removed value, or absent
     */
    Lookup<V> remove(K key);

    /**
     * Visits every entry.
     *
     * @param action receives (key, value)
     * @return this dictionary
     */
    Dictionary<K, V> forEach(BiConsumer<? super K, ? super V> action);

    /**
     * Replaces every value with {@code mapper(key, value)}.
     *
     * @param mapper receives (key, value)
     * @return this dictionary
     */
    Dictionary<K, V> map(BiFunction<? super K, ? super V, ? extends V> mapper);

    /**
     * Removes every entry.
     *
     * @return this dictionary
     */
    Dictionary<K, V> clean();

    /**
     * @return independent copy (new backing map, same value references)
     */
    Dictionary<K, V> copy();

    /**
     * Finds the entry with the highest score.
     *
     * @param scorer receives (key, value)
     * @return winning pair, or {@link Scored#empty()} when empty
     */
    Scored<Pair<K, V>> max(ToIntBiFunction<? super K, ? super V> scorer);

    /**
     * Finds the entry with the lowest score.
     *
     * @param scorer receives (key, value)
     * @return winning pair, or {@link Scored#empty()} when empty
     */
    Scored<Pair<K, V>> min(ToIntBiFunction<? super K, ? super V> scorer);

    /**
     * @return snapshot of the keys, unordered
     */
    List<K> keys();

    /**
     * @return snapshot of the keys as a vector, unordered
     */
    Vector<K> keysVector();

    /**
     * @return snapshot of the values, unordered
     */
    List<V> values();

    /**
     * @return snapshot of the values as a vector, unordered
     */
    Vector<V> valuesVector();

    /**
     * @return snapshot of the entries, unordered
     */
    List<Pair<K, V>> pairs();

    /**
     * @return mutable copy of the entries; changing it does not affect the dictionary
     */
    Map<K, V> collect();
}
