package com.ryuqq.collections.core.vector;

import java.util.List;

/**
 * Builds a {@link Vector} implementation from a list of elements.
 *
 * <p>Used by the mapping helpers in {@link Vectors} to let callers choose the
 * implementation of the result. The produced type is named at the call:</p>
 * <pre>
 * ArrayVector&lt;Integer&gt; lengths =
 *     Vectors.&lt;String, Integer, ArrayVector&lt;Integer&gt;&gt;map(words, String::length, ArrayVector::fromList);
 * </pre>
 *
 * @param <I> element type
 * @param <V> produced vector type
 *
 * @author Collections Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface VectorConstructor<I, V extends Vector<I>> {

    /**
     * @param items elements of the new vector
     * @return new vector
     */
    V create(List<I> items);
}
