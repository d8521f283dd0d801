/**
 * Key/value mapping package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.collections.core.dictionary.Dictionary} - Mapping contract shared by every implementation</li>
 *   <li>{@link com.ryuqq.collections.core.dictionary.HashDictionary} - Unsynchronized reference implementation</li>
 *   <li>{@link com.ryuqq.collections.core.dictionary.Dictionaries} - Value-type changing helpers</li>
 *   <li>{@link com.ryuqq.collections.core.dictionary.DictionaryConstructor} - Chooses the implementation built by the helpers</li>
 * </ul>
 *
 * <h2>Implementations elsewhere</h2>
 * <p>{@code collections-concurrent} provides a reader/writer-locked dictionary and a
 * size-bounded dictionary that evicts the least recently written key.</p>
 *
 * @since 1.0.0
 * @author Collections Team
 */
package com.ryuqq.collections.core.dictionary;
