package com.ryuqq.collections.concurrent.sync;

import com.ryuqq.collections.core.dictionary.Dictionary;
import com.ryuqq.collections.testkit.contract.AbstractConcurrentDictionaryContractTest;

import java.util.Map;

/**
 * Dictionary contract test for SyncDictionary, including the multi-threaded scenarios.
 *
 * @author Collections Team
 * @since 1.0.0
 */
class SyncDictionaryContractTest extends AbstractConcurrentDictionaryContractTest {

    @Override
    protected Dictionary<String, Integer> create(Map<String, Integer> items) {
        return SyncDictionary.fromMap(items);
    }
}
