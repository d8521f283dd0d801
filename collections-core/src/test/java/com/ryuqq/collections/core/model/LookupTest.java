package com.ryuqq.collections.core.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lookup value object test.
 *
 * @author Collections Team
 * @since 1.0.0
 */
class LookupTest {

    @Test
    void of_Value_IsFound() {
        // When
        Lookup<String> lookup = Lookup.of("value");

        // Then
        assertTrue(lookup.found());
        assertTrue(lookup.isFound());
        assertFalse(lookup.isAbsent());
        assertEquals("value", lookup.value());
    }

    @Test
    void of_NullValue_IsFoundAndDiffersFromAbsent() {
        // When
        Lookup<String> lookup = Lookup.of(null);

        // Then
        assertTrue(lookup.found());
        assertNull(lookup.value());
        assertNotEquals(Lookup.absent(), lookup);
    }

    @Test
    void absent_HasNoValue() {
        // When
        Lookup<String> lookup = Lookup.absent();

        // Then
        assertFalse(lookup.found());
        assertTrue(lookup.isAbsent());
        assertNull(lookup.value());
    }

    @Test
    void absent_EqualsEveryOtherAbsentLookup() {
        // When
        Lookup<String> first = Lookup.absent();
        Lookup<Integer> second = Lookup.absent();

        // Then
        assertEquals(first, second);
        assertEquals(new Lookup<>(null, false), first);
    }

    @Test
    void constructor_AbsentWithValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Lookup<>("value", false)
        );
        assertTrue(exception.getMessage().contains("absent"));
    }

    @Test
    void orElse_ReturnsFallbackOnlyWhenAbsent() {
        // Then
        assertEquals("fallback", Lookup.<String>absent().orElse("fallback"));
        assertEquals("value", Lookup.of("value").orElse("fallback"));
        assertNull(Lookup.<String>of(null).orElse("fallback"));
    }

    @Test
    void toOptional_MapsFoundNonNullValue() {
        // Then
        assertEquals(Optional.of("value"), Lookup.of("value").toOptional());
        assertEquals(Optional.empty(), Lookup.absent().toOptional());
        assertEquals(Optional.empty(), Lookup.of(null).toOptional());
    }
}
