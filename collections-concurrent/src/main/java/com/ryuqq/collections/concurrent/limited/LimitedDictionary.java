package com.ryuqq.collections.concurrent.limited;

import com.ryuqq.collections.concurrent.sync.SyncDictionary;
import com.ryuqq.collections.core.dictionary.Dictionary;
import com.ryuqq.collections.core.dictionary.HashDictionary;
import com.ryuqq.collections.core.model.Lookup;
import com.ryuqq.collections.core.model.Pair;
import com.ryuqq.collections.core.vector.ArrayVector;
import com.ryuqq.collections.core.vector.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Thread-safe dictionary holding at most {@code capacity} keys.
 *
 * <p>Keys are evicted in the order they were last written: the key whose most recent
 * {@code put} is the oldest goes first. Reads never change that order.</p>
 *
 * <p><strong>Timeline:</strong></p>
 * <ul>
 *   <li>Holds every key of the dictionary exactly once</li>
 *   <li>Front = least recently written = next eviction candidate</li>
 *   <li>{@code put} on an existing key moves it to the back</li>
 *   <li>{@code putIfAbsent} on an existing key leaves it where it is</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> the store write, the timeline update and the eviction of a
 * mutating call all happen under one write lock acquisition. Other threads never observe the
 * dictionary above capacity, nor a timeline that disagrees with the keys.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>put on a new key / putIfAbsent:</strong> O(1) amortized, plus one front removal when full</li>
 *   <li><strong>put on an existing key / remove:</strong> O(capacity), linear timeline scan</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * LimitedDictionary&lt;String, Session&gt; sessions = LimitedDictionary.empty(3);
 *
 * sessions.put("a", a);
 * sessions.put("b", b);
 * sessions.put("c", c);
 * sessions.put("a", a2);   // refreshes "a"
 * sessions.put("d", d);    // evicts "b"
 * </pre>
 *
 * @param <K> key type
 * @param <V> value type
 *
 * @author Collections Team
 * @since 1.0.0
 * @see LimitedDictionaryConfig
 */
public class LimitedDictionary<K, V> extends SyncDictionary<K, V> {

    private static final Logger log = LoggerFactory.getLogger(LimitedDictionary.class);

    private final LimitedDictionaryConfig config;

    /**
     * Keys in write-recency order. Guarded by the inherited lock.
     */
    private final ArrayVector<K> timeline = ArrayVector.empty();

    private LimitedDictionary(LimitedDictionaryConfig config) {
        super(HashDictionary.empty());
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * Creates an empty dictionary.
     *
     * @param capacity maximum number of keys (positive)
     * @param <K> key type
     * @param <V> value type
     * @return new LimitedDictionary
     * @throws IllegalArgumentException if capacity is not positive
     */
    public static <K, V> LimitedDictionary<K, V> empty(int capacity) {
        return empty(new LimitedDictionaryConfig(capacity));
    }

    /**
     * Creates an empty dictionary.
     *
     * @param config dictionary settings
     * @param <K> key type
     * @param <V> value type
     * @return new LimitedDictionary
     */
    public static <K, V> LimitedDictionary<K, V> empty(LimitedDictionaryConfig config) {
        return new LimitedDictionary<>(config);
    }

    /**
     * Creates a dictionary seeded from a map.
     *
     * <p>Entries are taken in the map's iteration order until {@code capacity} keys are held;
     * the remaining entries are dropped.</p>
     *
     * @param capacity maximum number of keys (positive)
     * @param items seed entries
     * @param <K> key type
     * @param <V> value type
     * @return new LimitedDictionary
     */
    public static <K, V> LimitedDictionary<K, V> fromMap(int capacity, Map<? extends K, ? extends V> items) {
        return fromMap(new LimitedDictionaryConfig(capacity), items);
    }

    /**
     * Creates a dictionary seeded from a map.
     *
     * @param config dictionary settings
     * @param items seed entries
     * @param <K> key type
     * @param <V> value type
     * @return new LimitedDictionary
     * @see #fromMap(int, Map)
     */
    public static <K, V> LimitedDictionary<K, V> fromMap(LimitedDictionaryConfig config, Map<? extends K, ? extends V> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        List<Pair<K, V>> entries = new ArrayList<>(items.size());
        for (Map.Entry<? extends K, ? extends V> entry : items.entrySet()) {
            entries.add(Pair.of(entry.getKey(), entry.getValue()));
        }
        LimitedDictionary<K, V> dictionary = new LimitedDictionary<>(config);
        dictionary.seed(entries);
        return dictionary;
    }

    /**
     * Creates a dictionary keyed by {@code keyExtractor(value)} for the vector elements.
     *
     * @param capacity maximum number of keys (positive)
     * @param values seed elements, taken front to back
     * @param keyExtractor derives the key of an element
     * @param <K> key type
     * @param <V> value type
     * @return new LimitedDictionary
     * @see #fromList(LimitedDictionaryConfig, Collection, Function)
     */
    public static <K, V> LimitedDictionary<K, V> fromVector(int capacity, Vector<V> values,
                                                            Function<? super V, ? extends K> keyExtractor) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return fromList(new LimitedDictionaryConfig(capacity), values.collect(), keyExtractor);
    }

    /**
     * Creates a dictionary keyed by {@code keyExtractor(value)} for the list elements.
     *
     * @param capacity maximum number of keys (positive)
     * @param values seed elements, taken in order
     * @param keyExtractor derives the key of an element
     * @param <K> key type
     * @param <V> value type
     * @return new LimitedDictionary
     * @see #fromList(LimitedDictionaryConfig, Collection, Function)
     */
    public static <K, V> LimitedDictionary<K, V> fromList(int capacity, Collection<? extends V> values,
                                                          Function<? super V, ? extends K> keyExtractor) {
        return fromList(new LimitedDictionaryConfig(capacity), values, keyExtractor);
    }

    /**
     * Creates a dictionary keyed by {@code keyExtractor(value)} for the list elements.
     *
     * <p><strong>Seeding:</strong></p>
     * <ul>
     *   <li>Elements are taken in order until {@code capacity} keys are held</li>
     *   <li>Later elements are dropped; earlier keys are never evicted by seeding</li>
     *   <li>A repeated key overwrites its value and moves to the back of the timeline</li>
     * </ul>
     *
     * @param config dictionary settings
     * @param values seed elements, taken in order
     * @param keyExtractor derives the key of an element
     * @param <K> key type
     * @param <V> value type
     * @return new LimitedDictionary
     */
    public static <K, V> LimitedDictionary<K, V> fromList(LimitedDictionaryConfig config, Collection<? extends V> values,
                                                          Function<? super V, ? extends K> keyExtractor) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (keyExtractor == null) {
            throw new IllegalArgumentException("keyExtractor cannot be null");
        }
        List<Pair<K, V>> entries = new ArrayList<>(values.size());
        for (V value : values) {
            entries.add(Pair.of(keyExtractor.apply(value), value));
        }
        LimitedDictionary<K, V> dictionary = new LimitedDictionary<>(config);
        dictionary.seed(entries);
        return dictionary;
    }

    /**
     * @return maximum number of keys
     */
    public int capacity() {
        return config.capacity();
    }

    /**
     * @return settings this dictionary was created with
     */
    public LimitedDictionaryConfig config() {
        return config;
    }

    /**
     * Snapshot of the keys in eviction order.
     *
     * @return keys, next eviction candidate first
     */
    public List<K> evictionOrder() {
        return read(store -> timeline.collect());
    }

    /**
     * {@inheritDoc}
     *
     * <p>The key moves to the back of the eviction order. When a new key pushes the
     * dictionary over capacity, the least recently written key is evicted.</p>
     */
    @Override
    public Lookup<V> put(K key, V value) {
        return write(store -> {
            Lookup<V> previous = store.put(key, value);
            if (previous.isFound()) {
                refresh(key);
            } else {
                timeline.append(key);
            }
            evictOverflow(store);
            return previous;
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>An existing key keeps its place in the eviction order.</p>
     */
    @Override
    public Lookup<V> putIfAbsent(K key, V value) {
        return write(store -> {
            Lookup<V> existing = store.putIfAbsent(key, value);
            if (existing.isAbsent()) {
                timeline.append(key);
                evictOverflow(store);
            }
            return existing;
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>Admission follows {@link LimitedDictionaryConfig#putAllAdmission()}.</p>
     *
     * @see PutAllAdmission
     */
    @Override
    public LimitedDictionary<K, V> putAll(Map<? extends K, ? extends V> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        for (K key : items.keySet()) {
            if (key == null) {
                throw new IllegalArgumentException("key cannot be null");
            }
        }
        write(store -> {
            if (config.putAllAdmission() == PutAllAdmission.REMAINING_CAPACITY) {
                admitRemaining(store, items);
            } else {
                admitTotal(store, items);
            }
            return null;
        });
        return this;
    }

    @Override
    public LimitedDictionary<K, V> merge(Dictionary<? extends K, ? extends V> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return putAll(other.collect());
    }

    @Override
    public Lookup<V> remove(K key) {
        return write(store -> {
            Lookup<V> removed = store.remove(key);
            if (removed.isFound()) {
                timeline.remove(timeline.indexOf(key::equals));
            }
            return removed;
        });
    }

    @Override
    public LimitedDictionary<K, V> filterSelf(BiPredicate<? super K, ? super V> predicate) {
        write(store -> {
            store.filterSelf(predicate);
            return timeline.filterSelf(store::exists);
        });
        return this;
    }

    @Override
    public LimitedDictionary<K, V> clean() {
        write(store -> {
            store.clean();
            return timeline.clean();
        });
        return this;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The result has the same settings and keeps the eviction order of the retained keys.</p>
     */
    @Override
    public LimitedDictionary<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
        return read(store -> restore(store.filter(predicate)));
    }

    /**
     * {@inheritDoc}
     *
     * <p>The copy has the same settings and the same eviction order.</p>
     */
    @Override
    public LimitedDictionary<K, V> copy() {
        return read(store -> restore(store.copy()));
    }

    /**
     * Builds a dictionary with this one's settings from retained entries, in timeline order.
     * Caller holds the lock.
     */
    private LimitedDictionary<K, V> restore(HashDictionary<K, V> retained) {
        List<K> order = timeline.find(retained::exists);
        LimitedDictionary<K, V> result = new LimitedDictionary<>(config);
        result.write(target -> {
            for (K key : order) {
                target.put(key, retained.get(key).value());
            }
            return result.timeline.appendAll(order);
        });
        return result;
    }

    private void seed(List<Pair<K, V>> entries) {
        write(store -> {
            int accepted = 0;
            for (Pair<K, V> entry : entries) {
                if (store.size() == config.capacity()) {
                    break;
                }
                Lookup<V> previous = store.put(entry.key(), entry.value());
                if (previous.isFound()) {
                    refresh(entry.key());
                } else {
                    timeline.append(entry.key());
                }
                accepted++;
            }
            int dropped = entries.size() - accepted;
            if (dropped > 0) {
                log.debug("Dropped {} seed entries beyond capacity {}", dropped, config.capacity());
            }
            return null;
        });
    }

    private void admitTotal(HashDictionary<K, V> store, Map<? extends K, ? extends V> items) {
        int accepted = 0;
        for (Map.Entry<? extends K, ? extends V> entry : items.entrySet()) {
            if (accepted == config.capacity()) {
                break;
            }
            Lookup<V> previous = store.put(entry.getKey(), entry.getValue());
            if (previous.isFound()) {
                refresh(entry.getKey());
            } else {
                timeline.append(entry.getKey());
            }
            accepted++;
        }
        if (accepted < items.size()) {
            log.debug("putAll accepted {} of {} entries (capacity {})", accepted, items.size(), config.capacity());
        }
        evictOverflow(store);
    }

    private void admitRemaining(HashDictionary<K, V> store, Map<? extends K, ? extends V> items) {
        int dropped = 0;
        for (Map.Entry<? extends K, ? extends V> entry : items.entrySet()) {
            K key = entry.getKey();
            if (store.exists(key)) {
                store.put(key, entry.getValue());
                refresh(key);
            } else if (store.size() < config.capacity()) {
                store.put(key, entry.getValue());
                timeline.append(key);
            } else {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("putAll dropped {} new keys, no free capacity (capacity {})", dropped, config.capacity());
        }
    }

    /**
     * Moves an existing key to the back of the timeline. Caller holds the write lock.
     */
    private void refresh(K key) {
        int index = timeline.indexOf(key::equals);
        if (index != -1) {
            timeline.remove(index);
        }
        timeline.append(key);
    }

    /**
     * Evicts from the front until the dictionary fits its capacity. Caller holds the write lock.
     */
    private void evictOverflow(HashDictionary<K, V> store) {
        while (timeline.size() > config.capacity()) {
            Lookup<K> oldest = timeline.shift();
            store.remove(oldest.value());
            log.debug("Evicted key {} (capacity {})", oldest.value(), config.capacity());
        }
    }
}
