package com.ryuqq.stepflow.core.spi;

import com.ryuqq.stepflow.core.artifact.ArtifactScope;
import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.RunId;

import java.util.List;
import java.util.Optional;

/**
 * Artifact storage SPI.
 *
 * <p>Every step execution writes the artifacts it produced into exactly one
 * {@link ArtifactScope} (run, branch path, step). Successor steps read them back
 * from the same scope; artifacts of failed runs stay in the store for diagnostics.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Write-once: a name is written at most once per scope</li>
 *   <li>Thread-safe: sibling branches write to different scopes concurrently</li>
 *   <li>Reads return immutable snapshots</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface ArtifactStore {

    /**
     * Writes the artifacts produced by one step execution.
     *
     * <p>Writing an empty {@link Artifacts} is a no-op.</p>
     *
     * @param scope the scope the artifacts belong to
     * @param artifacts produced artifacts
     * @throws IllegalArgumentException if scope or artifacts is null
     * @throws IllegalStateException if any name was already written in this scope
     */
    void write(ArtifactScope scope, Artifacts artifacts);

    /**
     * Reads all artifacts of a scope.
     *
     * @param scope the scope
     * @return artifacts of the scope (empty if nothing was written)
     * @throws IllegalArgumentException if scope is null
     */
    Artifacts read(ArtifactScope scope);

    /**
     * Reads one artifact of a scope.
     *
     * @param scope the scope
     * @param name artifact name
     * @return the value, or empty if absent
     */
    Optional<Object> find(ArtifactScope scope, String name);

    /**
     * Lists every scope written for a run, in write order.
     *
     * @param runId the run ID
     * @return written scopes (empty if none)
     */
    List<ArtifactScope> scopes(RunId runId);
}
