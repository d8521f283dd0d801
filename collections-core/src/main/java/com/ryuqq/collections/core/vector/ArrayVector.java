package com.ryuqq.collections.core.vector;

import com.ryuqq.collections.core.model.Lookup;
import com.ryuqq.collections.core.model.Scored;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * {@link Vector} backed by an {@link ArrayList}.
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>get / set / append / size:</strong> O(1) (append amortized)</li>
 *   <li><strong>shift / unshift / remove:</strong> O(N) - elements are moved</li>
 *   <li><strong>indexOf / find / contains:</strong> O(N) linear scan</li>
 * </ul>
 *
 * <p>Not thread-safe.</p>
 *
 * @param <I> element type
 *
 * @author Collections Team
 * @since 1.0.0
 */
public class ArrayVector<I> implements Vector<I> {

    private List<I> items;

    private ArrayVector(List<I> items) {
        this.items = items;
    }

    /**
     * Creates an empty vector.
     *
     * @param <I> element type
     * @return new ArrayVector
     */
    public static <I> ArrayVector<I> empty() {
        return new ArrayVector<>(new ArrayList<>());
    }

    /**
     * Creates a vector holding the given elements.
     *
     * @param items initial elements
     * @param <I> element type
     * @return new ArrayVector
     */
    @SafeVarargs
    public static <I> ArrayVector<I> of(I... items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        return new ArrayVector<>(new ArrayList<>(Arrays.asList(items)));
    }

    /**
     * Creates a vector holding a copy of the given elements.
     *
     * @param items initial elements (copied)
     * @param <I> element type
     * @return new ArrayVector
     */
    public static <I> ArrayVector<I> fromList(Collection<? extends I> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        return new ArrayVector<>(new ArrayList<>(items));
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public boolean contains(Predicate<? super I> predicate) {
        return findOne(predicate).isFound();
    }

    @Override
    public int indexOf(Predicate<? super I> predicate) {
        requireNonNull(predicate, "predicate");
        for (int i = 0; i < items.size(); i++) {
            if (predicate.test(items.get(i))) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public List<I> find(Predicate<? super I> predicate) {
        requireNonNull(predicate, "predicate");
        List<I> matches = new ArrayList<>();
        for (I item : items) {
            if (predicate.test(item)) {
                matches.add(item);
            }
        }
        return matches;
    }

    @Override
    public Lookup<I> findOne(Predicate<? super I> predicate) {
        requireNonNull(predicate, "predicate");
        for (I item : items) {
            if (predicate.test(item)) {
                return Lookup.of(item);
            }
        }
        return Lookup.absent();
    }

    @Override
    public Lookup<I> get(int index) {
        if (!inRange(index)) {
            return Lookup.absent();
        }
        return Lookup.of(items.get(index));
    }

    @Override
    public Lookup<I> first() {
        return get(0);
    }

    @Override
    public Lookup<I> last() {
        return get(items.size() - 1);
    }

    @Override
    public ArrayVector<I> append(I item) {
        items.add(item);
        return this;
    }

    @Override
    public ArrayVector<I> appendAll(Collection<? extends I> items) {
        requireNonNull(items, "items");
        this.items.addAll(items);
        return this;
    }

    @Override
    public ArrayVector<I> appendIfAbsent(BiPredicate<? super I, ? super I> equality, Collection<? extends I> items) {
        requireNonNull(equality, "equality");
        requireNonNull(items, "items");
        for (I candidate : items) {
            if (!contains(existing -> equality.test(existing, candidate))) {
                this.items.add(candidate);
            }
        }
        return this;
    }

    @Override
    public Lookup<I> set(int index, I item) {
        if (!inRange(index)) {
            return Lookup.absent();
        }
        return Lookup.of(items.set(index, item));
    }

    @Override
    public ArrayVector<I> merge(Vector<? extends I> other) {
        requireNonNull(other, "other");
        items.addAll(other.collect());
        return this;
    }

    @Override
    public ArrayVector<I> filter(Predicate<? super I> predicate) {
        return new ArrayVector<>(find(predicate));
    }

    @Override
    public ArrayVector<I> filterSelf(Predicate<? super I> predicate) {
        requireNonNull(predicate, "predicate");
        items.removeIf(predicate.negate());
        return this;
    }

    @Override
    public Lookup<I> remove(int index) {
        if (!inRange(index)) {
            return Lookup.absent();
        }
        return Lookup.of(items.remove(index));
    }

    @Override
    public ArrayVector<I> slice(int start, int end) {
        int from = clampStart(start);
        return new ArrayVector<>(new ArrayList<>(items.subList(from, clampEnd(from, end))));
    }

    @Override
    public ArrayVector<I> sliceSelf(int start, int end) {
        int from = clampStart(start);
        items = new ArrayList<>(items.subList(from, clampEnd(from, end)));
        return this;
    }

    @Override
    public ArrayVector<I> unshift(I item) {
        items.add(0, item);
        return this;
    }

    @Override
    public ArrayVector<I> unshiftAll(Collection<? extends I> items) {
        requireNonNull(items, "items");
        this.items.addAll(0, items);
        return this;
    }

    @Override
    public Lookup<I> shift() {
        if (items.isEmpty()) {
            return Lookup.absent();
        }
        return Lookup.of(items.remove(0));
    }

    @Override
    public ArrayVector<I> joinBy(Function<? super I, String> indexer, BinaryOperator<I> merger) {
        requireNonNull(indexer, "indexer");
        requireNonNull(merger, "merger");

        // LinkedHashMap keeps first-appearance order per key
        Map<String, I> grouped = new LinkedHashMap<>();
        for (I item : items) {
            String key = indexer.apply(item);
            if (grouped.containsKey(key)) {
                grouped.put(key, merger.apply(grouped.get(key), item));
            } else {
                grouped.put(key, item);
            }
        }
        items = new ArrayList<>(grouped.values());
        return this;
    }

    @Override
    public ArrayVector<I> forEach(BiConsumer<Integer, ? super I> action) {
        requireNonNull(action, "action");
        for (int i = 0; i < items.size(); i++) {
            action.accept(i, items.get(i));
        }
        return this;
    }

    @Override
    public ArrayVector<I> map(BiFunction<Integer, ? super I, ? extends I> mapper) {
        requireNonNull(mapper, "mapper");
        for (int i = 0; i < items.size(); i++) {
            items.set(i, mapper.apply(i, items.get(i)));
        }
        return this;
    }

    @Override
    public ArrayVector<I> clean() {
        items = new ArrayList<>();
        return this;
    }

    @Override
    public ArrayVector<I> copy() {
        return new ArrayVector<>(new ArrayList<>(items));
    }

    @Override
    public ArrayVector<I> sort(Comparator<? super I> comparator) {
        requireNonNull(comparator, "comparator");
        items.sort(comparator);
        return this;
    }

    @Override
    public Scored<I> max(ToIntFunction<? super I> scorer) {
        requireNonNull(scorer, "scorer");
        if (items.isEmpty()) {
            return Scored.empty();
        }
        I best = items.get(0);
        int bestScore = scorer.applyAsInt(best);
        for (int i = 1; i < items.size(); i++) {
            I item = items.get(i);
            int score = scorer.applyAsInt(item);
            if (score >= bestScore) {
                best = item;
                bestScore = score;
            }
        }
        return Scored.of(best, bestScore);
    }

    @Override
    public Scored<I> min(ToIntFunction<? super I> scorer) {
        requireNonNull(scorer, "scorer");
        if (items.isEmpty()) {
            return Scored.empty();
        }
        I best = items.get(0);
        int bestScore = scorer.applyAsInt(best);
        for (int i = 1; i < items.size(); i++) {
            I item = items.get(i);
            int score = scorer.applyAsInt(item);
            if (score <= bestScore) {
                best = item;
                bestScore = score;
            }
        }
        return Scored.of(best, bestScore);
    }

    @Override
    public List<I> collect() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public String join(String separator) {
        requireNonNull(separator, "separator");
        return items.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(separator));
    }

    @Override
    public int pages(int size) {
        requirePositive(size, "size");
        int count = items.size();
        return count / size + (count % size == 0 ? 0 : 1);
    }

    @Override
    public ArrayVector<I> page(int page, int size) {
        requirePositive(size, "size");
        int number = page == 0 ? 1 : page;
        long start = (long) (number - 1) * size;
        long end = (long) number * size;
        return slice(toIndex(start), toIndex(end));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArrayVector<?> that = (ArrayVector<?>) o;
        return items.equals(that.items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "ArrayVector" + items;
    }

    private boolean inRange(int index) {
        return index >= 0 && index < items.size();
    }

    private int clampStart(int start) {
        if (start < 0) {
            return 0;
        }
        return Math.min(start, items.size());
    }

    private int clampEnd(int from, int end) {
        return Math.max(from, Math.min(end, items.size()));
    }

    private static int toIndex(long value) {
        if (value > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (value < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) value;
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }
}
