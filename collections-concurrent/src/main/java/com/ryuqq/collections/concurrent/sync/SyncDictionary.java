package com.ryuqq.collections.concurrent.sync;

import com.ryuqq.collections.core.dictionary.Dictionaries;
import com.ryuqq.collections.core.dictionary.Dictionary;
import com.ryuqq.collections.core.dictionary.HashDictionary;
import com.ryuqq.collections.core.model.Lookup;
import com.ryuqq.collections.core.model.Pair;
import com.ryuqq.collections.core.model.Scored;
import com.ryuqq.collections.core.vector.Vector;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.ToIntBiFunction;

/**
 * Thread-safe {@link Dictionary} guarded by a reader/writer lock.
 *
 * <p>The backing {@link HashDictionary} and the {@link ReentrantReadWriteLock} are owned by
 * the instance and never handed out. Every public operation holds the lock for its whole
 * body, so each call is atomic with respect to every other call.</p>
 *
 * <p><strong>Lock Classes:</strong></p>
 * <ul>
 *   <li><strong>Read lock (shared):</strong> get, size, exists, find, findOne, forEach, keys, values,
 *       pairs, collect, copy, max, min, filter</li>
 *   <li><strong>Write lock (exclusive):</strong> put, putIfAbsent, putAll, remove, map, filterSelf, clean</li>
 * </ul>
 *
 * <p><strong>Callbacks:</strong> predicates, mappers and scorers run while the lock is held.
 * They must not call back into a mutating operation of the same instance: a read lock cannot
 * be upgraded, so such a call blocks forever.</p>
 *
 * <p><strong>Subclassing:</strong> subclasses reach the backing store only through
 * {@link #read(Function)} and {@link #write(Function)}, which run the given action under
 * the corresponding lock.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * SyncDictionary&lt;String, Integer&gt; counters = SyncDictionary.empty();
 *
 * // safe from any thread
 * counters.put("requests", 1);
 * counters.map((key, value) -&gt; value + 1);
 *
 * Lookup&lt;Integer&gt; requests = counters.get("requests"); // found, value 2
 * </pre>
 *
 * @param <K> key type
 * @param <V> value type
 *
 * @author Collections Team
 * @since 1.0.0
 */
public class SyncDictionary<K, V> implements Dictionary<K, V> {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Backing store. Only touched while {@link #lock} is held.
     */
    private final HashDictionary<K, V> items;

    /**
     * Creates a dictionary owning the given store.
     *
     * @param items backing store, must not be shared with anyone else
     */
    protected SyncDictionary(HashDictionary<K, V> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        this.items = items;
    }

    /**
     * Creates an empty dictionary.
     *
     * @param <K> key type
     * @param <V> value type
     * @return new SyncDictionary
     */
    public static <K, V> SyncDictionary<K, V> empty() {
        return new SyncDictionary<>(HashDictionary.empty());
    }

    /**
     * Creates a dictionary holding a copy of the given entries.
     *
     * @param items initial entries (copied)
     * @param <K> key type
     * @param <V> value type
     * @return new SyncDictionary
     */
    public static <K, V> SyncDictionary<K, V> fromMap(Map<? extends K, ? extends V> items) {
        return new SyncDictionary<>(HashDictionary.fromMap(items));
    }

    /**
     * Creates a dictionary keyed by {@code keyExtractor(value)} for every vector element.
     *
     * @param values source elements
     * @param keyExtractor derives the key of an element
     * @param <K> key type
     * @param <V> value type
     * @return new SyncDictionary
     */
    public static <K, V> SyncDictionary<K, V> fromVector(Vector<V> values, Function<? super V, ? extends K> keyExtractor) {
        return new SyncDictionary<>(HashDictionary.fromVector(values, keyExtractor));
    }

    /**
     * Creates a dictionary keyed by {@code keyExtractor(value)} for every list element.
     *
     * @param values source elements
     * @param keyExtractor derives the key of an element
     * @param <K> key type
     * @param <V> value type
     * @return new SyncDictionary
     */
    public static <K, V> SyncDictionary<K, V> fromList(Collection<? extends V> values, Function<? super V, ? extends K> keyExtractor) {
        return new SyncDictionary<>(HashDictionary.fromList(values, keyExtractor));
    }

    /**
     * Transforms every value of a dictionary into a new SyncDictionary.
     *
     * @param source source dictionary (left untouched)
     * @param mapper receives (key, value), returns the new value
     * @param <K> key type
     * @param <V> source value type
     * @param <E> result value type
     * @return new SyncDictionary with the same keys
     */
    public static <K, V, E> SyncDictionary<K, E> mapValues(Dictionary<K, V> source,
                                                           BiFunction<? super K, ? super V, ? extends E> mapper) {
        return Dictionaries.<K, V, E, SyncDictionary<K, E>>map(source, mapper, SyncDictionary::fromMap);
    }

    /**
     * Turns every element into one entry of a new SyncDictionary.
     *
     * @param source source elements
     * @param mapper returns the (key, value) entry of an element
     * @param <I> element type
     * @param <K> key type
     * @param <V> value type
     * @return new SyncDictionary
     */
    public static <I, K, V> SyncDictionary<K, V> fromPairs(List<I> source, Function<? super I, Pair<K, V>> mapper) {
        return Dictionaries.<I, K, V, SyncDictionary<K, V>>fromList(source, mapper, SyncDictionary::fromMap);
    }

    @Override
    public int size() {
        return read(HashDictionary::size);
    }

    @Override
    public boolean exists(K key) {
        return read(store -> store.exists(key));
    }

    @Override
    public List<V> find(BiPredicate<? super K, ? super V> predicate) {
        return read(store -> store.find(predicate));
    }

    @Override
    public Lookup<V> findOne(BiPredicate<? super K, ? super V> predicate) {
        return read(store -> store.findOne(predicate));
    }

    @Override
    public Lookup<V> get(K key) {
        return read(store -> store.get(key));
    }

    @Override
    public Lookup<V> put(K key, V value) {
        return write(store -> store.put(key, value));
    }

    @Override
    public Lookup<V> putIfAbsent(K key, V value) {
        return write(store -> store.putIfAbsent(key, value));
    }

    @Override
    public SyncDictionary<K, V> putAll(Map<? extends K, ? extends V> items) {
        write(store -> store.putAll(items));
        return this;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The other dictionary is read before this one is locked, so merging two
     * synchronized dictionaries into each other from different threads cannot deadlock.</p>
     */
    @Override
    public SyncDictionary<K, V> merge(Dictionary<? extends K, ? extends V> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return putAll(other.collect());
    }

    @Override
    public SyncDictionary<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
        return new SyncDictionary<>(read(store -> store.filter(predicate)));
    }

    @Override
    public SyncDictionary<K, V> filterSelf(BiPredicate<? super K, ? super V> predicate) {
        write(store -> store.filterSelf(predicate));
        return this;
    }

    @Override
    public Lookup<V> remove(K key) {
        return write(store -> store.remove(key));
    }

    @Override
    public SyncDictionary<K, V> forEach(BiConsumer<? super K, ? super V> action) {
        read(store -> store.forEach(action));
        return this;
    }

    @Override
    public SyncDictionary<K, V> map(BiFunction<? super K, ? super V, ? extends V> mapper) {
        write(store -> store.map(mapper));
        return this;
    }

    @Override
    public SyncDictionary<K, V> clean() {
        write(HashDictionary::clean);
        return this;
    }

    @Override
    public SyncDictionary<K, V> copy() {
        return new SyncDictionary<>(read(HashDictionary::copy));
    }

    @Override
    public Scored<Pair<K, V>> max(ToIntBiFunction<? super K, ? super V> scorer) {
        return read(store -> store.max(scorer));
    }

    @Override
    public Scored<Pair<K, V>> min(ToIntBiFunction<? super K, ? super V> scorer) {
        return read(store -> store.min(scorer));
    }

    @Override
    public List<K> keys() {
        return read(HashDictionary::keys);
    }

    @Override
    public Vector<K> keysVector() {
        return read(HashDictionary::keysVector);
    }

    @Override
    public List<V> values() {
        return read(HashDictionary::values);
    }

    @Override
    public Vector<V> valuesVector() {
        return read(HashDictionary::valuesVector);
    }

    @Override
    public List<Pair<K, V>> pairs() {
        return read(HashDictionary::pairs);
    }

    @Override
    public Map<K, V> collect() {
        return read(HashDictionary::collect);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + collect();
    }

    /**
     * Runs an action against the backing store under the shared read lock.
     *
     * <p>The action must not mutate the store.</p>
     *
     * @param action read-only action
     * @param <R> result type
     * @return action result
     */
    protected final <R> R read(Function<HashDictionary<K, V>, R> action) {
        return locked(lock.readLock(), action);
    }

    /**
     * Runs an action against the backing store under the exclusive write lock.
     *
     * <p>Everything the action does (store update, bookkeeping, eviction) appears
     * atomic to other callers.</p>
     *
     * @param action mutating action
     * @param <R> result type
     * @return action result
     */
    protected final <R> R write(Function<HashDictionary<K, V>, R> action) {
        return locked(lock.writeLock(), action);
    }

    private <R> R locked(Lock held, Function<HashDictionary<K, V>, R> action) {
        held.lock();
        try {
            return action.apply(items);
        } finally {
            held.unlock();
        }
    }
}
