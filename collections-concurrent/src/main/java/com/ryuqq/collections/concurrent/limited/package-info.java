/**
 * Bounded dictionary evicting the least recently written key.
 *
 * <p>{@link com.ryuqq.collections.concurrent.limited.LimitedDictionary} is configured through
 * {@link com.ryuqq.collections.concurrent.limited.LimitedDictionaryConfig}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.collections.concurrent.limited;
