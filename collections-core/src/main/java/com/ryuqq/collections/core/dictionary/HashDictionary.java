package com.ryuqq.collections.core.dictionary;

import com.ryuqq.collections.core.model.Lookup;
import com.ryuqq.collections.core.model.Pair;
import com.ryuqq.collections.core.model.Scored;
import com.ryuqq.collections.core.vector.ArrayVector;
import com.ryuqq.collections.core.vector.Vector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.ToIntBiFunction;

/**
 * Unsynchronized {@link Dictionary} backed by a {@link HashMap}.
 *
 * <p>This is the reference implementation of the Dictionary contract. The thread-safe
 * dictionaries in {@code collections-concurrent} delegate to a HashDictionary while
 * holding their lock.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>get / put / remove / exists:</strong> O(1)</li>
 *   <li><strong>find / filter / map / max / min:</strong> O(N) linear scan</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Not thread-safe</li>
 *   <li>Iteration order unspecified</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 *
 * @author Collections Team
 * @since 1.0.0
 */
public class HashDictionary<K, V> implements Dictionary<K, V> {

    private final Map<K, V> items;

    private HashDictionary(Map<K, V> items) {
        this.items = items;
    }

    /**
     * Creates an empty dictionary.
     *
     * @param <K> key type
     * @param <V> value type
     * @return new HashDictionary
     */
    public static <K, V> HashDictionary<K, V> empty() {
        return new HashDictionary<>(new HashMap<>());
    }

    /**
     * Creates a dictionary holding a copy of the given entries.
     *
     * @param items initial entries (copied)
     * @param <K> key type
     * @param <V> value type
     * @return new HashDictionary
     * @throws IllegalArgumentException if items is null or contains a null key
     */
    public static <K, V> HashDictionary<K, V> fromMap(Map<? extends K, ? extends V> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        HashDictionary<K, V> dictionary = empty();
        dictionary.putAll(items);
        return dictionary;
    }

    /**
     * Creates a dictionary keyed by {@code keyExtractor(value)} for every vector element.
     *
     * <p>Later elements overwrite earlier ones with the same key.</p>
     *
     * @param values source elements
     * @param keyExtractor derives the key of an element
     * @param <K> key type
     * @param <V> value type
     * @return new HashDictionary
     */
    public static <K, V> HashDictionary<K, V> fromVector(Vector<V> values, Function<? super V, ? extends K> keyExtractor) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return fromList(values.collect(), keyExtractor);
    }

    /**
     * Creates a dictionary keyed by {@code keyExtractor(value)} for every list element.
     *
     * <p>Later elements overwrite earlier ones with the same key.</p>
     *
     * @param values source elements
     * @param keyExtractor derives the key of an element
     * @param <K> key type
     * @param <V> value type
     * @return new HashDictionary
     */
    public static <K, V> HashDictionary<K, V> fromList(Collection<? extends V> values, Function<? super V, ? extends K> keyExtractor) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (keyExtractor == null) {
            throw new IllegalArgumentException("keyExtractor cannot be null");
        }
        HashDictionary<K, V> dictionary = empty();
        for (V value : values) {
            dictionary.put(keyExtractor.apply(value), value);
        }
        return dictionary;
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public boolean exists(K key) {
        requireKey(key);
        return items.containsKey(key);
    }

    @Override
    public List<V> find(BiPredicate<? super K, ? super V> predicate) {
        requireNonNull(predicate, "predicate");
        List<V> matches = new ArrayList<>();
        for (Map.Entry<K, V> entry : items.entrySet()) {
            if (predicate.test(entry.getKey(), entry.getValue())) {
                matches.add(entry.getValue());
            }
        }
        return matches;
    }

    @Override
    public Lookup<V> findOne(BiPredicate<? super K, ? super V> predicate) {
        requireNonNull(predicate, "predicate");
        for (Map.Entry<K, V> entry : items.entrySet()) {
            if (predicate.test(entry.getKey(), entry.getValue())) {
                return Lookup.of(entry.getValue());
            }
        }
        return Lookup.absent();
    }

    @Override
    public Lookup<V> get(K key) {
        requireKey(key);
        // containsKey keeps a stored null distinguishable from absence
        if (!items.containsKey(key)) {
            return Lookup.absent();
        }
        return Lookup.of(items.get(key));
    }

    @Override
    public Lookup<V> put(K key, V value) {
        requireKey(key);
        boolean existed = items.containsKey(key);
        V old = items.put(key, value);
        return existed ? Lookup.of(old) : Lookup.absent();
    }

    @Override
    public Lookup<V> putIfAbsent(K key, V value) {
        requireKey(key);
        if (items.containsKey(key)) {
            return Lookup.of(items.get(key));
        }
        items.put(key, value);
        return Lookup.absent();
    }

    @Override
    public HashDictionary<K, V> putAll(Map<? extends K, ? extends V> items) {
        requireNonNull(items, "items");
        for (Map.Entry<? extends K, ? extends V> entry : items.entrySet()) {
            requireKey(entry.getKey());
        }
        this.items.putAll(items);
        return this;
    }

    @Override
    public HashDictionary<K, V> merge(Dictionary<? extends K, ? extends V> other) {
        requireNonNull(other, "other");
        return putAll(other.collect());
    }

    @Override
    public HashDictionary<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
        requireNonNull(predicate, "predicate");
        Map<K, V> matches = new HashMap<>();
        for (Map.Entry<K, V> entry : items.entrySet()) {
            if (predicate.test(entry.getKey(), entry.getValue())) {
                matches.put(entry.getKey(), entry.getValue());
            }
        }
        return new HashDictionary<>(matches);
    }

    @Override
    public HashDictionary<K, V> filterSelf(BiPredicate<? super K, ? super V> predicate) {
        requireNonNull(predicate, "predicate");
        items.entrySet().removeIf(entry -> !predicate.test(entry.getKey(), entry.getValue()));
        return this;
    }

    @Override
    public Lookup<V> remove(K key) {
        requireKey(key);
        if (!items.containsKey(key)) {
            return Lookup.absent();
        }
        return Lookup.of(items.remove(key));
    }

    @Override
    public HashDictionary<K, V> forEach(BiConsumer<? super K, ? super V> action) {
        requireNonNull(action, "action");
        items.forEach(action);
        return this;
    }

    @Override
    public HashDictionary<K, V> map(BiFunction<? super K, ? super V, ? extends V> mapper) {
        requireNonNull(mapper, "mapper");
        for (Map.Entry<K, V> entry : items.entrySet()) {
            entry.setValue(mapper.apply(entry.getKey(), entry.getValue()));
        }
        return this;
    }

    @Override
    public HashDictionary<K, V> clean() {
        items.clear();
        return this;
    }

    @Override
    public HashDictionary<K, V> copy() {
        return new HashDictionary<>(new HashMap<>(items));
    }

    @Override
    public Scored<Pair<K, V>> max(ToIntBiFunction<? super K, ? super V> scorer) {
        requireNonNull(scorer, "scorer");
        Pair<K, V> best = null;
        int bestScore = 0;
        for (Map.Entry<K, V> entry : items.entrySet()) {
            int score = scorer.applyAsInt(entry.getKey(), entry.getValue());
            if (best == null || score >= bestScore) {
                best = Pair.of(entry.getKey(), entry.getValue());
                bestScore = score;
            }
        }
        return best == null ? Scored.empty() : Scored.of(best, bestScore);
    }

    @Override
    public Scored<Pair<K, V>> min(ToIntBiFunction<? super K, ? super V> scorer) {
        requireNonNull(scorer, "scorer");
        Pair<K, V> best = null;
        int bestScore = 0;
        for (Map.Entry<K, V> entry : items.entrySet()) {
            int score = scorer.applyAsInt(entry.getKey(), entry.getValue());
            if (best == null || score <= bestScore) {
                best = Pair.of(entry.getKey(), entry.getValue());
                bestScore = score;
            }
        }
        return best == null ? Scored.empty() : Scored.of(best, bestScore);
    }

    @Override
    public List<K> keys() {
        return new ArrayList<>(items.keySet());
    }

    @Override
    public Vector<K> keysVector() {
        return ArrayVector.fromList(items.keySet());
    }

    @Override
    public List<V> values() {
        return new ArrayList<>(items.values());
    }

    @Override
    public Vector<V> valuesVector() {
        return ArrayVector.fromList(items.values());
    }

    @Override
    public List<Pair<K, V>> pairs() {
        List<Pair<K, V>> pairs = new ArrayList<>(items.size());
        for (Map.Entry<K, V> entry : items.entrySet()) {
            pairs.add(Pair.of(entry.getKey(), entry.getValue()));
        }
        return pairs;
    }

    @Override
    public Map<K, V> collect() {
        return new HashMap<>(items);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HashDictionary<?, ?> that = (HashDictionary<?, ?>) o;
        return items.equals(that.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "HashDictionary" + items;
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
