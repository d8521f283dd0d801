package com.ryuqq.collections.core.vector;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Static helpers that transform vectors into vectors of another element type.
 *
 * <p>{@link Vector#map} keeps the element type; these helpers change it.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
public final class Vectors {

    private Vectors() {
    }

    /**
     * Maps every element into a new {@link ArrayVector}.
     *
     * @param source source vector (left untouched)
     * @param mapper element transformation
     * @param <I> source element type
     * @param <R> result element type
     * @return new vector, same order
     */
    public static <I, R> ArrayVector<R> map(Vector<I> source, Function<? super I, ? extends R> mapper) {
        return Vectors.<I, R, ArrayVector<R>>map(source, mapper, ArrayVector::fromList);
    }

    /**
     * Maps every element into a vector built by the given constructor.
     *
     * @param source source vector (left untouched)
     * @param mapper element transformation
     * @param constructor builds the result implementation
     * @param <I> source element type
     * @param <R> result element type
     * @param <V> result vector type
     * @return new vector, same order
     */
    public static <I, R, V extends Vector<R>> V map(Vector<I> source,
                                                    Function<? super I, ? extends R> mapper,
                                                    VectorConstructor<R, V> constructor) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return map(source.collect(), mapper, constructor);
    }

    /**
     * Maps every list element into a new {@link ArrayVector}.
     *
     * @param source source list
     * @param mapper element transformation
     * @param <I> source element type
     * @param <R> result element type
     * @return new vector, same order
     */
    public static <I, R> ArrayVector<R> map(List<I> source, Function<? super I, ? extends R> mapper) {
        return Vectors.<I, R, ArrayVector<R>>map(source, mapper, ArrayVector::fromList);
    }

    /**
     * Maps every list element into a vector built by the given constructor.
     *
     * @param source source list
     * @param mapper element transformation
     * @param constructor builds the result implementation
     * @param <I> source element type
     * @param <R> result element type
     * @param <V> result vector type
     * @return new vector, same order
     */
    public static <I, R, V extends Vector<R>> V map(List<I> source,
                                                    Function<? super I, ? extends R> mapper,
                                                    VectorConstructor<R, V> constructor) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (constructor == null) {
            throw new IllegalArgumentException("constructor cannot be null");
        }

        List<R> mapped = new ArrayList<>(source.size());
        for (I item : source) {
            mapped.add(mapper.apply(item));
        }
        return constructor.create(mapped);
    }
}
