/**
 * Contract test bases for {@link com.ryuqq.collections.core.dictionary.Dictionary} implementations.
 *
 * <p>An implementation module extends
 * {@link com.ryuqq.collections.testkit.contract.AbstractDictionaryContractTest} (or its concurrent
 * variant) in its own test sources and supplies a factory.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.collections.testkit.contract;
