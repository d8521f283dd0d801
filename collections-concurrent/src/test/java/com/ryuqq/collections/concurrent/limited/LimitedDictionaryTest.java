package com.ryuqq.collections.concurrent.limited;

import com.ryuqq.collections.core.model.Lookup;
import com.ryuqq.collections.core.vector.ArrayVector;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LimitedDictionary eviction and seeding test.
 *
 * @author Collections Team
 * @since 1.0.0
 */
class LimitedDictionaryTest {

    private static LimitedDictionary<String, Integer> abc(int capacity) {
        LimitedDictionary<String, Integer> dictionary = LimitedDictionary.empty(capacity);
        dictionary.put("A", 1);
        dictionary.put("B", 2);
        dictionary.put("C", 3);
        return dictionary;
    }

    private static List<String> numbered(int from, int to) {
        List<String> values = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            values.add(String.valueOf(i));
        }
        return values;
    }

    @Nested
    class Put {

        @Test
        void newKeyOnFullDictionary_EvictsLeastRecentlyWritten() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            dictionary.put("D", 4);

            assertThat(dictionary.keys()).containsExactlyInAnyOrder("B", "C", "D");
            assertThat(dictionary.evictionOrder()).containsExactly("B", "C", "D");
        }

        @Test
        void existingKey_MovesToBackOfEvictionOrder() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            assertThat(dictionary.put("A", 10)).isEqualTo(Lookup.of(1));
            dictionary.put("D", 4);

            assertThat(dictionary.exists("A")).isTrue();
            assertThat(dictionary.exists("B")).isFalse();
            assertThat(dictionary.evictionOrder()).containsExactly("C", "A", "D");
        }

        @Test
        void get_DoesNotRefreshRecency() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            dictionary.get("A");
            dictionary.put("D", 4);

            assertThat(dictionary.exists("A")).isFalse();
        }

        @Test
        void capacityOne_KeepsOnlyLastKey() {
            LimitedDictionary<String, Integer> dictionary = LimitedDictionary.empty(1);

            dictionary.put("A", 1);
            dictionary.put("B", 2);

            assertThat(dictionary.collect()).isEqualTo(Map.of("B", 2));
        }

        @Test
        void nullKey_LeavesTimelineUntouched() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            assertThatThrownBy(() -> dictionary.put(null, 1)).isInstanceOf(IllegalArgumentException.class);

            assertThat(dictionary.evictionOrder()).containsExactly("A", "B", "C");
        }
    }

    @Nested
    class PutIfAbsent {

        @Test
        void existingKey_KeepsValueAndPosition() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            assertThat(dictionary.putIfAbsent("A", 10)).isEqualTo(Lookup.of(1));
            dictionary.put("D", 4);

            assertThat(dictionary.exists("A")).isFalse();
            assertThat(dictionary.keys()).containsExactlyInAnyOrder("B", "C", "D");
        }

        @Test
        void newKeyOnFullDictionary_IsKept() {
            LimitedDictionary<Integer, String> dictionary = LimitedDictionary.fromList(10, numbered(1, 11), Integer::parseInt);

            assertThat(dictionary.putIfAbsent(12, "12").isAbsent()).isTrue();

            assertThat(dictionary.size()).isEqualTo(10);
            assertThat(dictionary.exists(12)).isTrue();
            assertThat(dictionary.exists(1)).isFalse();
        }
    }

    @Nested
    class Seeding {

        @Test
        void fromList_DropsEntriesBeyondCapacity() {
            LimitedDictionary<Integer, String> dictionary = LimitedDictionary.fromList(10, numbered(1, 11), Integer::parseInt);

            assertThat(dictionary.size()).isEqualTo(10);
            assertThat(dictionary.exists(11)).isFalse();
            assertThat(dictionary.evictionOrder()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        }

        @Test
        void fromList_ThenPut_StaysAtCapacity() {
            LimitedDictionary<Integer, String> dictionary = LimitedDictionary.fromList(10, numbered(1, 11), Integer::parseInt);

            dictionary.put(12, "12");

            assertThat(dictionary.size()).isEqualTo(10);
            assertThat(dictionary.exists(12)).isTrue();
            assertThat(dictionary.exists(1)).isFalse();
        }

        @Test
        void fromList_RepeatedKey_OverwritesAndRefreshes() {
            List<String> words = List.of("apple", "banana", "avocado");

            LimitedDictionary<Character, String> dictionary =
                    LimitedDictionary.fromList(5, words, word -> word.charAt(0));

            assertThat(dictionary.get('a')).isEqualTo(Lookup.of("avocado"));
            assertThat(dictionary.evictionOrder()).containsExactly('b', 'a');
        }

        @Test
        void fromMap_KeepsSourceOrderUpToCapacity() {
            Map<String, Integer> source = new LinkedHashMap<>();
            source.put("x", 1);
            source.put("y", 2);
            source.put("z", 3);

            LimitedDictionary<String, Integer> dictionary = LimitedDictionary.fromMap(2, source);

            assertThat(dictionary.evictionOrder()).containsExactly("x", "y");
            assertThat(dictionary.exists("z")).isFalse();
        }

        @Test
        void fromVector_SeedsFrontToBack() {
            LimitedDictionary<Integer, String> dictionary =
                    LimitedDictionary.fromVector(2, ArrayVector.of("a", "bb", "ccc"), String::length);

            assertThat(dictionary.evictionOrder()).containsExactly(1, 2);
        }

        @Test
        void nonPositiveCapacity_IsRejected() {
            assertThatThrownBy(() -> LimitedDictionary.empty(0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("capacity must be positive (current: 0)");
        }
    }

    @Nested
    class PutAll {

        @Test
        void totalCapacity_KeepsEveryEntryOfBatch_WhenBatchFits() {
            LimitedDictionary<Integer, String> dictionary = LimitedDictionary.fromList(10, numbered(1, 11), Integer::parseInt);
            Map<Integer, String> batch = new LinkedHashMap<>();
            batch.put(12, "12");
            batch.put(13, "13");
            batch.put(14, "14");

            dictionary.putAll(batch);

            assertThat(dictionary.size()).isEqualTo(10);
            assertThat(dictionary.keys()).contains(12, 13, 14).doesNotContain(1, 2, 3);
            assertThat(dictionary.evictionOrder()).containsExactly(4, 5, 6, 7, 8, 9, 10, 12, 13, 14);
        }

        @Test
        void totalCapacity_RefreshesUpdatedKeys() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            dictionary.putAll(Map.of("A", 10));
            dictionary.put("D", 4);

            assertThat(dictionary.get("A")).isEqualTo(Lookup.of(10));
            assertThat(dictionary.exists("B")).isFalse();
        }

        @Test
        void totalCapacity_AcceptsAtMostCapacityEntriesOfBatch() {
            LimitedDictionary<String, Integer> dictionary = LimitedDictionary.empty(2);
            Map<String, Integer> batch = new LinkedHashMap<>();
            batch.put("x", 1);
            batch.put("y", 2);
            batch.put("z", 3);

            dictionary.putAll(batch);

            assertThat(dictionary.evictionOrder()).containsExactly("x", "y");
        }

        @Test
        void remainingCapacity_FillsFreeSlotsOnly_AndNeverEvicts() {
            LimitedDictionaryConfig config = new LimitedDictionaryConfig(4, PutAllAdmission.REMAINING_CAPACITY);
            LimitedDictionary<String, Integer> dictionary = LimitedDictionary.fromMap(config, Map.of("A", 1, "B", 2, "C", 3));
            Map<String, Integer> batch = new LinkedHashMap<>();
            batch.put("D", 4);
            batch.put("E", 5);

            dictionary.putAll(batch);

            assertThat(dictionary.keys()).containsExactlyInAnyOrder("A", "B", "C", "D");
        }

        @Test
        void remainingCapacity_AlwaysAcceptsUpdates() {
            LimitedDictionaryConfig config = new LimitedDictionaryConfig(3, PutAllAdmission.REMAINING_CAPACITY);
            LimitedDictionary<String, Integer> dictionary = LimitedDictionary.empty(config);
            dictionary.put("A", 1);
            dictionary.put("B", 2);
            dictionary.put("C", 3);
            Map<String, Integer> batch = new HashMap<>();
            batch.put("A", 10);
            batch.put("Z", 26);

            dictionary.putAll(batch);

            assertThat(dictionary.collect()).isEqualTo(Map.of("A", 10, "B", 2, "C", 3));
            assertThat(dictionary.evictionOrder()).containsExactly("B", "C", "A");
        }

        @Test
        void merge_FollowsPutAllAdmission() {
            LimitedDictionary<String, Integer> dictionary = abc(3);
            LimitedDictionary<String, Integer> other = LimitedDictionary.fromMap(3, Map.of("D", 4));

            dictionary.merge(other);

            assertThat(dictionary.keys()).containsExactlyInAnyOrder("B", "C", "D");
        }
    }

    @Nested
    class Removal {

        @Test
        void remove_AlsoLeavesEvictionOrder() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            assertThat(dictionary.remove("A")).isEqualTo(Lookup.of(1));
            dictionary.put("D", 4);
            dictionary.put("E", 5);

            assertThat(dictionary.keys()).containsExactlyInAnyOrder("C", "D", "E");
            assertThat(dictionary.evictionOrder()).containsExactly("C", "D", "E");
        }

        @Test
        void remove_UnknownKey_ChangesNothing() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            assertThat(dictionary.remove("Z").isAbsent()).isTrue();

            assertThat(dictionary.evictionOrder()).containsExactly("A", "B", "C");
        }

        @Test
        void filterSelf_KeepsTimelineInStep() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            dictionary.filterSelf((key, value) -> value != 2);
            dictionary.put("D", 4);

            assertThat(dictionary.evictionOrder()).containsExactly("A", "C", "D");
            assertThat(dictionary.size()).isEqualTo(3);
        }

        @Test
        void clean_EmptiesTimeline() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            dictionary.clean();
            dictionary.put("D", 4);

            assertThat(dictionary.evictionOrder()).containsExactly("D");
        }
    }

    @Nested
    class Derived {

        @Test
        void map_ChangesValuesOnly() {
            LimitedDictionary<String, Integer> dictionary = abc(3);

            dictionary.map((key, value) -> value * 100);

            assertThat(dictionary.get("B")).isEqualTo(Lookup.of(200));
            assertThat(dictionary.evictionOrder()).containsExactly("A", "B", "C");
        }

        @Test
        void filter_ReturnsLimitedDictionaryInSameOrder() {
            LimitedDictionary<String, Integer> dictionary = abc(3);
            dictionary.put("A", 1);

            LimitedDictionary<String, Integer> filtered = dictionary.filter((key, value) -> !key.equals("B"));

            assertThat(filtered.capacity()).isEqualTo(3);
            assertThat(filtered.evictionOrder()).containsExactly("C", "A");
            assertThat(dictionary.size()).isEqualTo(3);
        }

        @Test
        void copy_IsIndependent_AndKeepsConfig() {
            LimitedDictionaryConfig config = new LimitedDictionaryConfig(3, PutAllAdmission.REMAINING_CAPACITY);
            LimitedDictionary<String, Integer> dictionary = LimitedDictionary.empty(config);
            dictionary.put("A", 1);
            dictionary.put("B", 2);

            LimitedDictionary<String, Integer> copy = dictionary.copy();
            copy.put("C", 3);
            copy.put("D", 4);

            assertThat(copy.config()).isEqualTo(config);
            assertThat(copy.evictionOrder()).containsExactly("B", "C", "D");
            assertThat(dictionary.evictionOrder()).containsExactly("A", "B");
        }
    }
}
