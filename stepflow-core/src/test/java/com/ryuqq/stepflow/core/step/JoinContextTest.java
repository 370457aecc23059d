package com.ryuqq.stepflow.core.step;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.error.ErrorKind;
import com.ryuqq.stepflow.core.error.MergeConflictException;
import com.ryuqq.stepflow.core.merge.MergePolicies;
import com.ryuqq.stepflow.core.merge.MetricSummary;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JoinContext 테스트.
 *
 * <p>join은 branch Artifact를 명시적으로 선택/집계해야 하며, 서로 다른 값을 가진 이름을
 * 해소 없이 병합하면 MergeConflictException이 발생합니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class JoinContextTest {

    private static final RunId RUN_ID = RunId.of("run-1");

    @Test
    void of_InputsSortedByBranchIndex() {
        // Given
        List<BranchInput> inputs = new ArrayList<>(List.of(
            input(3, Artifacts.of("score", 0.3)),
            input(1, Artifacts.of("score", 0.1)),
            input(2, Artifacts.of("score", 0.2))
        ));

        // When
        JoinContext context = context(inputs);

        // Then
        assertEquals(List.of(0.1, 0.2, 0.3), context.collect("score", Double.class));
    }

    @Test
    void select_SameValueInAllBranches_ReturnsIt() {
        JoinContext context = context(List.of(
            input(1, Artifacts.of("mode", "production").with("score", 0.1)),
            input(2, Artifacts.of("mode", "production").with("score", 0.2))
        ));

        assertEquals("production", context.select("mode", String.class));
    }

    @Test
    void select_DifferentValues_ThrowsMergeConflict() {
        // Given
        JoinContext context = context(List.of(
            input(1, Artifacts.of("model", "model-1")),
            input(2, Artifacts.of("model", "model-2"))
        ));

        // When
        MergeConflictException exception = assertThrows(
            MergeConflictException.class,
            () -> context.select("model", String.class)
        );

        // Then
        assertEquals(ErrorKind.MERGE_CONFLICT, exception.getKind());
        assertEquals("join", exception.getStepNameOrNull());
        assertEquals(List.of("model"), exception.getArtifactNames());
    }

    @Test
    void selectFrom_ResolvesConflictExplicitly() {
        JoinContext context = context(List.of(
            input(1, Artifacts.of("model", "model-1")),
            input(2, Artifacts.of("model", "model-2"))
        ));

        assertEquals("model-2", context.selectFrom(2, "model"));
        assertThrows(IllegalArgumentException.class, () -> context.selectFrom(5, "model"));
    }

    @Test
    void mergeArtifacts_DeepEqualArrays_MergeSilently() {
        // Given: 배열은 deep equality로 비교
        JoinContext context = context(List.of(
            input(1, Artifacts.of("classes", new String[]{"Adelie", "Gentoo"})),
            input(2, Artifacts.of("classes", new String[]{"Adelie", "Gentoo"}))
        ));

        // When
        Artifacts merged = context.mergeArtifacts();

        // Then
        assertArrayEquals(new String[]{"Adelie", "Gentoo"}, merged.get("classes", String[].class));
    }

    @Test
    void mergeArtifacts_ReportsEveryConflictingName() {
        JoinContext context = context(List.of(
            input(1, Artifacts.of("model", "m1").with("history", "h1").with("mode", "development")),
            input(2, Artifacts.of("model", "m2").with("history", "h2").with("mode", "development"))
        ));

        MergeConflictException exception = assertThrows(MergeConflictException.class, context::mergeArtifacts);

        assertEquals(List.of("model", "history"), exception.getArtifactNames());
    }

    @Test
    void mergeArtifactsExcept_SkipsExcludedConflicts() {
        // Given
        JoinContext context = context(List.of(
            input(1, Artifacts.of("model", "m1").with("mode", "development")),
            input(2, Artifacts.of("model", "m2").with("mode", "development"))
        ));

        // When
        Artifacts merged = context.mergeArtifactsExcept(Set.of("model"));

        // Then
        assertEquals(Artifacts.of("mode", "development"), merged);
    }

    @Test
    void mergeArtifacts_IncludeMissingName_ThrowsException() {
        JoinContext context = context(List.of(input(1, Artifacts.of("mode", "development"))));

        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> context.mergeArtifacts(Set.of("tracking_run_id"))
        );
        assertTrue(exception.getMessage().contains("not found in any branch"));
    }

    @Test
    void aggregate_DefaultPolicy_MeanAndPopulationStd() {
        // Given
        JoinContext context = context(List.of(
            input(1, Artifacts.of("test_accuracy", 0.6)),
            input(2, Artifacts.of("test_accuracy", 0.7)),
            input(3, Artifacts.of("test_accuracy", 0.8))
        ));

        // When
        MetricSummary summary = context.aggregate("test_accuracy");

        // Then
        assertEquals(0.7, summary.value(), 1e-9);
        assertEquals(0.0816, summary.spread(), 1e-4);
        assertEquals(3, summary.count());
    }

    @Test
    void aggregate_CustomPolicy_AcceptsIntegers() {
        JoinContext context = context(List.of(
            input(1, Artifacts.of("epochs_run", 10)),
            input(2, Artifacts.of("epochs_run", 30))
        ));

        assertEquals(30.0, context.aggregate("epochs_run", MergePolicies.max()).value());
    }

    @Test
    void aggregate_EmptyInputs_ReturnsEmptySummary() {
        JoinContext context = context(List.of());

        MetricSummary summary = context.aggregate("test_accuracy");

        assertTrue(summary.isEmpty());
        assertTrue(Double.isNaN(summary.value()));
        assertTrue(context.mergeArtifacts().isEmpty());
    }

    @Test
    void getInherited_DefaultFactory_IsEmpty() {
        JoinContext context = context(List.of(input(1, Artifacts.of("score", 0.1))));

        assertTrue(context.getInherited().isEmpty());
    }

    @Test
    void getInherited_EmptyInputs_StillAvailable() {
        // Given
        Artifacts inherited = Artifacts.of("tracking_run_id", "parent-run").with("mode", "development");

        // When
        JoinContext context = JoinContext.of(RUN_ID, "join", BranchPath.root(), RunParameters.empty(),
            inherited, List.of());

        // Then
        assertEquals(inherited, context.getInherited());
        assertTrue(context.getInputs().isEmpty());
        assertEquals("parent-run", context.getInherited().get("tracking_run_id", String.class));
    }

    @Test
    void of_NullInherited_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> JoinContext.of(RUN_ID, "join", BranchPath.root(), RunParameters.empty(), null, List.of())
        );
        assertEquals("inherited cannot be null", exception.getMessage());
    }

    @Test
    void of_NullInput_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> context(Arrays.asList(input(1, Artifacts.empty()), null)));
    }

    private static JoinContext context(List<BranchInput> inputs) {
        return JoinContext.of(RUN_ID, "join", BranchPath.root(), RunParameters.empty(), inputs);
    }

    private static BranchInput input(int index, Artifacts artifacts) {
        return new BranchInput(index, BranchPath.root().enter("split", index, 3), "work", artifacts);
    }
}
