package com.ryuqq.collections.testkit.contract;

import com.ryuqq.collections.core.dictionary.Dictionary;
import com.ryuqq.collections.core.dictionary.HashDictionary;

import java.util.Map;

/**
 * Dictionary contract test for the unsynchronized HashDictionary.
 *
 * @author Collections Team
 * @since 1.0.0
 */
class HashDictionaryContractTest extends AbstractDictionaryContractTest {

    @Override
    protected Dictionary<String, Integer> create(Map<String, Integer> items) {
        return HashDictionary.fromMap(items);
    }
}
