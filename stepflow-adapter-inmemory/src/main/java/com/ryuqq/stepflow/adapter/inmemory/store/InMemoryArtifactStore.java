package com.ryuqq.stepflow.adapter.inmemory.store;

import com.ryuqq.stepflow.core.artifact.ArtifactScope;
import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.spi.ArtifactStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ArtifactStore} SPI for testing and single-process runs.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>artifacts:</strong> ConcurrentHashMap&lt;ArtifactScope, Artifacts&gt; - immutable snapshot per scope</li>
 *   <li><strong>scopesByRun:</strong> ConcurrentHashMap&lt;RunId, List&lt;ArtifactScope&gt;&gt; - scopes in first-write order</li>
 * </ul>
 *
 * <p><strong>Write-once:</strong> writes to one scope are merged with {@link ConcurrentHashMap#compute},
 * so a name that already exists in the scope is rejected atomically and the scope is left unchanged.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Artifacts are held by reference; values should be immutable</li>
 *   <li>Nothing is evicted automatically; a long-lived runner should call {@link #remove(RunId)}
 *       once a finished run's artifacts are no longer needed for diagnostics</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final ConcurrentHashMap<ArtifactScope, Artifacts> artifacts;
    private final ConcurrentHashMap<RunId, List<ArtifactScope>> scopesByRun;

    public InMemoryArtifactStore() {
        this.artifacts = new ConcurrentHashMap<>();
        this.scopesByRun = new ConcurrentHashMap<>();
    }

    @Override
    public void write(ArtifactScope scope, Artifacts produced) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (produced == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }
        if (produced.isEmpty()) {
            return;
        }

        boolean[] created = new boolean[1];
        artifacts.compute(scope, (key, existing) -> {
            if (existing == null) {
                created[0] = true;
                return produced;
            }
            List<String> duplicates = new ArrayList<>();
            for (String name : produced.names()) {
                if (existing.contains(name)) {
                    duplicates.add(name);
                }
            }
            if (!duplicates.isEmpty()) {
                throw new IllegalStateException(
                    String.format("Artifacts %s already written in scope %s", duplicates, scope));
            }
            return existing.overlay(produced);
        });
        if (created[0]) {
            scopesByRun.computeIfAbsent(scope.runId(), runId -> new CopyOnWriteArrayList<>()).add(scope);
        }
    }

    @Override
    public Artifacts read(ArtifactScope scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        return artifacts.getOrDefault(scope, Artifacts.empty());
    }

    @Override
    public Optional<Object> find(ArtifactScope scope, String name) {
        return read(scope).find(name);
    }

    @Override
    public List<ArtifactScope> scopes(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        return List.copyOf(scopesByRun.getOrDefault(runId, List.of()));
    }

    /**
     * Returns every artifact of a run keyed by scope.
     *
     * <p>This method is used for diagnostics and test assertions.</p>
     *
     * @param runId the run ID
     * @return scope → artifacts in write order
     */
    public Map<ArtifactScope, Artifacts> dump(RunId runId) {
        Map<ArtifactScope, Artifacts> result = new LinkedHashMap<>();
        for (ArtifactScope scope : scopes(runId)) {
            result.put(scope, read(scope));
        }
        return result;
    }

    /**
     * Removes every artifact of one run.
     *
     * <p>Call only after the run has finished; a concurrent write for the same run may survive.</p>
     *
     * @param runId the run ID
     * @return the number of scopes removed
     */
    public int remove(RunId runId) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        List<ArtifactScope> removed = scopesByRun.remove(runId);
        if (removed == null) {
            return 0;
        }
        removed.forEach(artifacts::remove);
        return removed.size();
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        artifacts.clear();
        scopesByRun.clear();
    }
}
