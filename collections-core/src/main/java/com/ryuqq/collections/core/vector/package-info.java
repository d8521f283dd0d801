/**
 * Ordered sequence package.
 *
 * <p>{@link com.ryuqq.collections.core.vector.Vector} is the sequence contract,
 * {@link com.ryuqq.collections.core.vector.ArrayVector} its array-backed implementation,
 * and {@link com.ryuqq.collections.core.vector.Vectors} holds element-type changing helpers.</p>
 *
 * <p>Vectors are not thread-safe. The bounded dictionary in {@code collections-concurrent}
 * uses an ArrayVector as its eviction timeline and guards it with its own lock.</p>
 *
 * @since 1.0.0
 * @author Collections Team
 */
package com.ryuqq.collections.core.vector;
