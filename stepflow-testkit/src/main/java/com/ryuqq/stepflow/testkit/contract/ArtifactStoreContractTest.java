package com.ryuqq.stepflow.testkit.contract;

import com.ryuqq.stepflow.core.artifact.ArtifactScope;
import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.spi.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link ArtifactStore} implementations.
 *
 * <p>Adapter modules subclass this and provide a fresh store.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Written artifacts are readable from the same scope only</li>
 *   <li>A name is written at most once per scope (IllegalStateException)</li>
 *   <li>Rejected writes leave the scope unchanged</li>
 *   <li>Sibling branches write concurrently without interference</li>
 * </ul>
 *
 * <pre>
 * class InMemoryArtifactStoreContractTest extends ArtifactStoreContractTest {
 *     {@literal @}Override
 *     protected ArtifactStore createStore() {
 *         return new InMemoryArtifactStore();
 *     }
 * }
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public abstract class ArtifactStoreContractTest {

    protected ArtifactStore store;

    protected abstract ArtifactStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @Test
    void testWrite_ThenRead_ReturnsSameArtifacts() {
        // Given
        ArtifactScope scope = scope(RunId.generate(), BranchPath.root(), "start");
        Artifacts produced = Artifacts.of("mode", "development").with("folds", 5);

        // When
        store.write(scope, produced);

        // Then
        assertEquals(produced, store.read(scope));
        assertEquals("development", store.find(scope, "mode").orElseThrow());
        assertTrue(store.find(scope, "missing").isEmpty());
    }

    @Test
    void testRead_UnknownScope_ReturnsEmpty() {
        ArtifactScope scope = scope(RunId.generate(), BranchPath.root(), "nothing");

        assertTrue(store.read(scope).isEmpty());
    }

    @Test
    void testWrite_SameNameTwice_ThrowsAndKeepsFirstValue() {
        // Given
        ArtifactScope scope = scope(RunId.generate(), BranchPath.root(), "train");
        store.write(scope, Artifacts.of("model", "first"));

        // When/Then
        assertThrows(IllegalStateException.class,
            () -> store.write(scope, Artifacts.of("model", "second").with("extra", 1)));
        assertEquals(Artifacts.of("model", "first"), store.read(scope));
    }

    @Test
    void testWrite_DifferentNamesSameScope_Accumulates() {
        ArtifactScope scope = scope(RunId.generate(), BranchPath.root(), "train");

        store.write(scope, Artifacts.of("a", 1));
        store.write(scope, Artifacts.of("b", 2));

        assertEquals(Artifacts.of("a", 1).with("b", 2), store.read(scope));
    }

    @Test
    void testWrite_SameNameDifferentBranches_AreIsolated() {
        // Given
        RunId runId = RunId.generate();
        ArtifactScope first = scope(runId, BranchPath.root().enter("cv", 1, 2), "train_fold");
        ArtifactScope second = scope(runId, BranchPath.root().enter("cv", 2, 2), "train_fold");

        // When
        store.write(first, Artifacts.of("test_accuracy", 0.6));
        store.write(second, Artifacts.of("test_accuracy", 0.8));

        // Then
        assertEquals(0.6, store.read(first).getDouble("test_accuracy"));
        assertEquals(0.8, store.read(second).getDouble("test_accuracy"));
        assertEquals(List.of(first, second), store.scopes(runId));
    }

    @Test
    void testWrite_EmptyArtifacts_IsNoOp() {
        RunId runId = RunId.generate();

        store.write(scope(runId, BranchPath.root(), "start"), Artifacts.empty());

        assertTrue(store.scopes(runId).isEmpty());
    }

    @Test
    void testWrite_ConcurrentBranches_AllVisible() throws InterruptedException {
        // Given
        RunId runId = RunId.generate();
        int branches = 16;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch ready = new CountDownLatch(1);
        List<ArtifactScope> scopes = new ArrayList<>();
        for (int i = 1; i <= branches; i++) {
            scopes.add(scope(runId, BranchPath.root().enter("cv", i, branches), "evaluate_fold"));
        }

        // When
        try {
            for (int i = 0; i < branches; i++) {
                ArtifactScope scope = scopes.get(i);
                double accuracy = i;
                executor.submit(() -> {
                    ready.await();
                    store.write(scope, Artifacts.of("test_accuracy", accuracy));
                    return null;
                });
            }
            ready.countDown();
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }

        // Then
        assertEquals(branches, store.scopes(runId).size());
        for (int i = 0; i < branches; i++) {
            assertEquals(i, store.read(scopes.get(i)).getDouble("test_accuracy"));
        }
    }

    @Test
    void testWrite_NullScope_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> store.write(null, Artifacts.of("a", 1)));
    }

    private static ArtifactScope scope(RunId runId, BranchPath path, String step) {
        return ArtifactScope.of(runId, path, step);
    }
}
