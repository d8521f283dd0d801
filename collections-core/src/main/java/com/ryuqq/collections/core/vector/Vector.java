package com.ryuqq.collections.core.vector;

import com.ryuqq.collections.core.model.Lookup;
import com.ryuqq.collections.core.model.Scored;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Resizable, indexable ordered sequence.
 *
 * <p>This interface is the generic workhorse of the SDK: dictionaries expose their
 * keys and values as vectors, and the bounded dictionary keeps its eviction timeline
 * in one.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Append, prepend, insert by index, pop-front</li>
 *   <li>Search by predicate (first match, index, all matches)</li>
 *   <li>In-place and copying transformations (filter, slice, map, sort)</li>
 *   <li>Folding helpers (max, min, join, pagination)</li>
 * </ul>
 *
 * <p><strong>Error Model:</strong></p>
 * <ul>
 *   <li>Out-of-range indexes are reported through {@link Lookup#absent()} or {@code -1}, never thrown</li>
 *   <li>Null function arguments are contract violations ({@link IllegalArgumentException})</li>
 *   <li>Exceptions thrown by caller functions propagate unchanged</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Implementations are not required to be thread-safe.
 * Callers sharing a vector across threads must provide their own locking.</p>
 *
 * <p>Mutating methods return {@code this} so calls can be chained.</p>
 *
 * @param <I> element type
 *
 * @author Collections Team
 * @since 1.0.0
 */
public interface Vector<I> {

    /**
     * @return number of elements
     */
    int size();

    /**
     * @return true if the vector has no elements
     */
    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Checks whether any element matches.
     *
     * @param predicate element matcher
     * @return true if at least one element matches
     */
    boolean contains(Predicate<? super I> predicate);

    /**
     * Finds the index of the first matching element.
     *
     * @param predicate element matcher
     * @return index of the first match, or -1
     */
    int indexOf(Predicate<? super I> predicate);

    /**
     * Collects every matching element, in order.
     *
     * @param predicate element matcher
     * @return matching elements (never null)
     */
    List<I> find(Predicate<? super I> predicate);

    /**
     * Finds the first matching element.
     *
     * @param predicate element matcher
     * @return first match, or absent
     */
    Lookup<I> findOne(Predicate<? super I> predicate);

    /**
     * Reads an element by index.
     *
     * @param index zero-based index
     * @return element, or absent if the index is out of range
     */
    Lookup<I> get(int index);

    /**
     * @return first element, or absent when empty
     */
    Lookup<I> first();

    /**
     * @return last element, or absent when empty
     */
    Lookup<I> last();

    /**
     * Appends one element to the back.
     *
     * @param item element to append
     * @return this vector
     */
    Vector<I> append(I item);

    /**
     * Appends elements to the back, preserving their order.
     *
     * @param items elements to append
     * @return this vector
     */
    Vector<I> appendAll(Collection<? extends I> items);

    /**
     * Appends each candidate only when no element already present matches it.
     *
     * <p>{@code equality} receives (existing element, candidate). Candidates appended
     * earlier in the same call take part in the check for later candidates.</p>
     *
     * @param equality equality test between an existing element and a candidate
     * @param items candidates
     * @return this vector
     */
    Vector<I> appendIfAbsent(BiPredicate<? super I, ? super I> equality, Collection<? extends I> items);

    /**
     * Replaces the element at an index.
     *
     * @param index zero-based index
     * @param item new element
     * @return previous element, or absent (and no change) if the index is out of range
     */
    Lookup<I> set(int index, I item);

    /**
     * Appends every element of another vector.
     *
     * @param other source vector (left untouched)
     * @return this vector
     */
    Vector<I> merge(Vector<? extends I> other);

    /**
     * Returns a new vector holding the matching elements.
     *
     * @param predicate element matcher
     * @return new vector
     */
    Vector<I> filter(Predicate<? super I> predicate);

    /**
     * Retains only the matching elements.
     *
     * @param predicate element matcher
     * @return this vector
     */
    Vector<I> filterSelf(Predicate<? super I> predicate);

    /**
     * Removes the element at an index.
     *
     * @param index zero-based index
     * @return removed element, or absent if the index is out of range
     */
    Lookup<I> remove(int index);

    /**
     * Returns a new vector with the elements in {@code [start, end)}.
     *
     * <p><strong>Bounds:</strong></p>
     * <ul>
     *   <li>{@code start < 0} is treated as 0</li>
     *   <li>{@code start >= size} gives an empty result</li>
     *   <li>{@code end > size} is treated as size</li>
     *   <li>{@code end < start} gives an empty result</li>
     * </ul>
     *
     * @param start inclusive start index
     * @param end exclusive end index
     * @return new vector
     */
    Vector<I> slice(int start, int end);

    /**
     * Same bounds as {@link #slice(int, int)}, applied in place.
     *
     * @param start inclusive start index
     * @param end exclusive end index
     * @return this vector
     */
    Vector<I> sliceSelf(int start, int end);

    /**
     * Prepends one element.
     *
     * @param item element to prepend
     * @return this vector
     */
    Vector<I> unshift(I item);

    /**
     * Prepends elements; they keep their relative order at the front.
     *
     * @param items elements to prepend
     * @return this vector
     */
    Vector<I> unshiftAll(Collection<? extends I> items);

    /**
     * Removes and returns the front element.
     *
     * @return front element, or absent when empty
     */
    Lookup<I> shift();

    /**
     * Collapses elements sharing the same index key.
     *
     * <p>Elements are grouped by {@code indexer}; when a key repeats, the element
     * already kept and the new one are combined with {@code merger(kept, item)}.
     * The result holds one element per key, in order of first appearance.</p>
     *
     * @param indexer grouping key
     * @param merger combines the kept element with a colliding one
     * @return this vector
     */
    Vector<I> joinBy(Function<? super I, String> indexer, BinaryOperator<I> merger);

    /**
     * Visits each element with its index.
     *
     * @param action receives (index, element)
     * @return this vector
     */
    Vector<I> forEach(BiConsumer<Integer, ? super I> action);

    /**
     * Replaces each element with {@code mapper(index, element)}.
     *
     * @param mapper receives (index, element)
     * @return this vector
     */
    Vector<I> map(BiFunction<Integer, ? super I, ? extends I> mapper);

    /**
     * Removes every element.
     *
     * @return this vector
     */
    Vector<I> clean();

    /**
     * @return an independent copy holding the same element references
     */
    Vector<I> copy();

    /**
     * Sorts in place (stable).
     *
     * @param comparator element order
     * @return this vector
     */
    Vector<I> sort(Comparator<? super I> comparator);

    /**
     * Finds the element with the highest score.
     *
     * <p>On equal scores the later element wins.</p>
     *
     * @param scorer element score
     * @return winner, or {@link Scored#empty()} when empty
     */
    Scored<I> max(ToIntFunction<? super I> scorer);

    /**
     * Finds the element with the lowest score.
     *
     * <p>On equal scores the later element wins.</p>
     *
     * @param scorer element score
     * @return winner, or {@link Scored#empty()} when empty
     */
    Scored<I> min(ToIntFunction<? super I> scorer);

    /**
     * @return unmodifiable snapshot of the elements, in order
     */
    List<I> collect();

    /**
     * Joins the string form of every element.
     *
     * @param separator separator placed between elements
     * @return joined string
     */
    String join(String separator);

    /**
     * Counts the pages needed to show every element.
     *
     * @param size elements per page (positive)
     * @return number of pages
     * @throws IllegalArgumentException if size is not positive
     */
    int pages(int size);

    /**
     * Returns one page as a new vector.
     *
     * <p>Pages are 1-based; page 0 is treated as page 1.</p>
     *
     * @param page page number
     * @param size elements per page (positive)
     * @return new vector with the page's elements (empty past the last page)
     * @throws IllegalArgumentException if size is not positive
     */
    Vector<I> page(int page, int size);
}
