package com.ryuqq.collections.core.dictionary;

import com.ryuqq.collections.core.model.Lookup;
import com.ryuqq.collections.core.vector.ArrayVector;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HashDictionary factory and identity test.
 *
 * <p>The Dictionary contract itself is covered by {@code HashDictionaryContractTest}
 * in collections-testkit.</p>
 *
 * @author Collections Team
 * @since 1.0.0
 */
class HashDictionaryTest {

    @Test
    void fromMap_CopiesSource() {
        Map<String, Integer> source = new HashMap<>(Map.of("a", 1));

        HashDictionary<String, Integer> dictionary = HashDictionary.fromMap(source);
        source.put("b", 2);

        assertThat(dictionary.keys()).containsExactly("a");
    }

    @Test
    void fromList_LaterElementOverwritesSameKey() {
        List<String> words = List.of("apple", "banana", "avocado");

        HashDictionary<Character, String> dictionary = HashDictionary.fromList(words, word -> word.charAt(0));

        assertThat(dictionary.size()).isEqualTo(2);
        assertThat(dictionary.get('a')).isEqualTo(Lookup.of("avocado"));
        assertThat(dictionary.get('b')).isEqualTo(Lookup.of("banana"));
    }

    @Test
    void fromVector_KeysEveryElement() {
        ArrayVector<String> words = ArrayVector.of("one", "three");

        HashDictionary<Integer, String> dictionary = HashDictionary.fromVector(words, String::length);

        assertThat(dictionary.collect()).isEqualTo(Map.of(3, "one", 5, "three"));
    }

    @Test
    void fromList_NullExtractor_ThrowsException() {
        assertThatThrownBy(() -> HashDictionary.fromList(List.of("a"), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("keyExtractor cannot be null");
    }

    @Test
    void putAll_WithNullKey_LeavesDictionaryUntouched() {
        HashDictionary<String, Integer> dictionary = HashDictionary.fromMap(Map.of("a", 1));
        Map<String, Integer> items = new HashMap<>();
        items.put("b", 2);
        items.put(null, 3);

        assertThatThrownBy(() -> dictionary.putAll(items))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("key cannot be null");
        assertThat(dictionary.collect()).isEqualTo(Map.of("a", 1));
    }

    @Test
    void equals_ComparesEntries() {
        HashDictionary<String, Integer> first = HashDictionary.fromMap(Map.of("a", 1));
        HashDictionary<String, Integer> second = HashDictionary.<String, Integer>empty();
        second.put("a", 1);

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first.copy()).isEqualTo(first).isNotSameAs(first);
    }
}
