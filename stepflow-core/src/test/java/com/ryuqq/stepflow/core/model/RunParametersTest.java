package com.ryuqq.stepflow.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunParameters 테스트.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class RunParametersTest {

    @Test
    void builder_TypedAccessors_ConvertValues() {
        // Given
        RunParameters parameters = RunParameters.builder()
            .put("epochs", 50)
            .put("batch_size", "32")
            .put("accuracy_threshold", 0.7)
            .put("production", "true")
            .build();

        // When & Then
        assertEquals(50, parameters.getInt("epochs"));
        assertEquals(32, parameters.getInt("batch_size"));
        assertEquals(0.7, parameters.getDouble("accuracy_threshold"));
        assertTrue(parameters.getBoolean("production"));
        assertEquals("50", parameters.getString("epochs"));
    }

    @Test
    void of_DefensiveCopy_IgnoresLaterChanges() {
        // Given
        Map<String, Object> source = new HashMap<>();
        source.put("epochs", 10);

        // When
        RunParameters parameters = RunParameters.of(source);
        source.put("epochs", 99);

        // Then
        assertEquals(10, parameters.getInt("epochs"));
        assertThrows(UnsupportedOperationException.class, () -> parameters.asMap().put("x", 1));
    }

    @Test
    void require_Missing_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> RunParameters.empty().require("epochs")
        );
        assertTrue(exception.getMessage().contains("Run parameter not defined: epochs"));
    }

    @Test
    void builder_NullValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RunParameters.builder().put("epochs", null));
    }
}
