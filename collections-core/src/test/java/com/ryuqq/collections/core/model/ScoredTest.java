package com.ryuqq.collections.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scored and Pair value object test.
 *
 * @author Collections Team
 * @since 1.0.0
 */
class ScoredTest {

    @Test
    void of_ItemAndScore_IsFound() {
        // When
        Scored<Pair<String, Integer>> scored = Scored.of(Pair.of("a", 1), 7);

        // Then
        assertTrue(scored.found());
        assertEquals(7, scored.score());
        assertEquals("a", scored.item().key());
        assertEquals(1, scored.item().value());
    }

    @Test
    void empty_HasZeroScoreAndNoItem() {
        // When
        Scored<String> scored = Scored.empty();

        // Then
        assertFalse(scored.found());
        assertEquals(0, scored.score());
        assertNull(scored.item());
    }

    @Test
    void empty_EqualsEveryOtherEmptyResult() {
        // Then
        assertEquals(Scored.<String>empty(), Scored.<Integer>empty());
        assertEquals(new Scored<>(null, 0, false), Scored.empty());
    }
}
