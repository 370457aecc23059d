package com.ryuqq.stepflow.adapter.inmemory.store;

import com.ryuqq.stepflow.core.artifact.ArtifactScope;
import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.model.RunId;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryArtifactStore 진단/정리 기능 테스트.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class InMemoryArtifactStoreTest {

    private final InMemoryArtifactStore store = new InMemoryArtifactStore();

    @Test
    void dump_run별_scope_순서대로_반환() {
        // given
        RunId runId = RunId.generate();
        ArtifactScope start = ArtifactScope.of(runId, BranchPath.root(), "start");
        ArtifactScope fold = ArtifactScope.of(runId, BranchPath.root().enter("cv", 1, 1), "train_fold");
        store.write(start, Artifacts.of("mode", "production"));
        store.write(fold, Artifacts.of("test_accuracy", 0.9));
        store.write(ArtifactScope.of(RunId.generate(), BranchPath.root(), "start"), Artifacts.of("other", 1));

        // when
        Map<ArtifactScope, Artifacts> dump = store.dump(runId);

        // then
        assertThat(dump.keySet()).containsExactly(start, fold);
        assertThat(dump.get(fold).getDouble("test_accuracy")).isEqualTo(0.9);
    }

    @Test
    void remove_해당_run의_scope만_삭제() {
        // given
        RunId finished = RunId.generate();
        RunId other = RunId.generate();
        store.write(ArtifactScope.of(finished, BranchPath.root(), "start"), Artifacts.of("a", 1));
        store.write(ArtifactScope.of(finished, BranchPath.root().enter("cv", 1, 2), "train_fold"), Artifacts.of("b", 2));
        ArtifactScope kept = ArtifactScope.of(other, BranchPath.root(), "start");
        store.write(kept, Artifacts.of("c", 3));

        // when
        int removed = store.remove(finished);

        // then
        assertThat(removed).isEqualTo(2);
        assertThat(store.scopes(finished)).isEmpty();
        assertThat(store.dump(finished)).isEmpty();
        assertThat(store.scopes(other)).containsExactly(kept);
    }

    @Test
    void remove_기록_없는_run이면_0_반환() {
        // when & then
        assertThat(store.remove(RunId.generate())).isZero();
    }

    @Test
    void clear_모든_데이터_삭제() {
        // given
        RunId runId = RunId.generate();
        store.write(ArtifactScope.of(runId, BranchPath.root(), "start"), Artifacts.of("a", 1));

        // when
        store.clear();

        // then
        assertThat(store.scopes(runId)).isEmpty();
    }
}
