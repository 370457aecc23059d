package com.ryuqq.stepflow.core.artifact;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Artifacts 테스트.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class ArtifactsTest {

    private static final ArtifactKey<Double> TEST_ACCURACY = ArtifactKey.of("test_accuracy", Double.class);

    @Test
    void with_ReturnsNewInstance_OriginalUnchanged() {
        // Given
        Artifacts original = Artifacts.of("mode", "development");

        // When
        Artifacts extended = original.with("fold", 1);

        // Then
        assertEquals(Set.of("mode"), original.names());
        assertEquals(Set.of("mode", "fold"), extended.names());
    }

    @Test
    void overlay_TopWins() {
        // Given
        Artifacts inherited = Artifacts.of("mode", "development").with("score", 0.1);
        Artifacts produced = Artifacts.of("score", 0.9);

        // When
        Artifacts visible = inherited.overlay(produced);

        // Then
        assertEquals(0.9, visible.getDouble("score"));
        assertEquals("development", visible.get("mode", String.class));
        assertSame(inherited, inherited.overlay(Artifacts.empty()));
    }

    @Test
    void retain_KeepsOnlyListedNames() {
        Artifacts artifacts = Artifacts.of("a", 1).with("b", 2).with("c", 3);

        Artifacts retained = artifacts.retain(Set.of("a", "c", "missing"));

        assertEquals(Set.of("a", "c"), retained.names());
    }

    @Test
    void get_TypedKey_ReturnsValue() {
        Artifacts artifacts = Artifacts.empty().with(TEST_ACCURACY, 0.82);

        assertEquals(0.82, artifacts.get(TEST_ACCURACY));
        assertEquals("test_accuracy:Double", TEST_ACCURACY.toString());
    }

    @Test
    void get_WrongType_ThrowsException() {
        Artifacts artifacts = Artifacts.of("model", "weights.bin");

        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> artifacts.get("model", Integer.class)
        );
        assertTrue(exception.getMessage().contains("expected java.lang.Integer"));
    }

    @Test
    void require_Missing_ListsAvailableNames() {
        Artifacts artifacts = Artifacts.of("mode", "production");

        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> artifacts.require("model")
        );
        assertTrue(exception.getMessage().contains("available: [mode]"));
        assertTrue(artifacts.find("model").isEmpty());
    }

    @Test
    void of_Map_DefensiveCopyAndImmutable() {
        // Given
        Map<String, Object> source = new HashMap<>();
        source.put("folds", List.of(1, 2));

        // When
        Artifacts artifacts = Artifacts.of(source);
        source.put("extra", 1);

        // Then
        assertEquals(1, artifacts.size());
        assertThrows(UnsupportedOperationException.class, () -> artifacts.asMap().put("x", 1));
    }

    @Test
    void with_NullValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Artifacts.of("model", null));
    }

    @Test
    void equals_SameContent_AreEqual() {
        assertEquals(Artifacts.of("a", 1).with("b", 2), Artifacts.of(Map.of("a", 1, "b", 2)));
    }
}
