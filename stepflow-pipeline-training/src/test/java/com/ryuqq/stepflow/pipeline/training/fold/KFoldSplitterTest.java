package com.ryuqq.stepflow.pipeline.training.fold;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * KFoldSplitter 단위 테스트.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
class KFoldSplitterTest {

    @Test
    void split_모든_row가_정확히_한_fold의_평가_집합에_속함() {
        // given
        KFoldSplitter splitter = new KFoldSplitter(5, 42L);

        // when
        List<Fold> folds = splitter.split(23);

        // then
        assertThat(folds).hasSize(5);
        List<Integer> tested = new ArrayList<>();
        for (Fold fold : folds) {
            tested.addAll(fold.testIndices());

            Set<Integer> union = new HashSet<>(fold.trainIndices());
            union.addAll(fold.testIndices());
            assertThat(union).hasSize(23);
            assertThat(fold.trainIndices()).doesNotContainAnyElementsOf(fold.testIndices());
            assertThat(fold.trainIndices()).isSorted();
        }
        assertThat(tested).hasSize(23).doesNotHaveDuplicates();
    }

    @Test
    void split_나머지는_앞쪽_fold에_하나씩_배분() {
        // when
        List<Fold> folds = new KFoldSplitter(5, 7L).split(23);

        // then
        assertThat(folds).extracting(fold -> fold.testIndices().size())
            .containsExactly(5, 5, 5, 4, 4);
        assertThat(folds).extracting(Fold::number)
            .containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void split_같은_seed_같은_분할() {
        // when
        List<Fold> first = new KFoldSplitter(3, 42L).split(30);
        List<Fold> second = new KFoldSplitter(3, 42L).split(30);

        // then
        assertThat(first).isEqualTo(second);
    }

    @Test
    void split_row_0개_빈_목록() {
        // when
        List<Fold> folds = new KFoldSplitter(5, 42L).split(0);

        // then
        assertThat(folds).isEmpty();
    }

    @Test
    void split_fold_수보다_적은_row_예외() {
        KFoldSplitter splitter = new KFoldSplitter(5, 42L);

        assertThatThrownBy(() -> splitter.split(4))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Cannot split 4 rows into 5 folds");
        assertThatThrownBy(() -> splitter.split(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("rows must be non-negative");
    }

    @Test
    void constructor_fold_2개_미만_예외() {
        assertThatThrownBy(() -> new KFoldSplitter(1, 42L))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("folds must be at least 2");
    }

    @Test
    void fold_평가_집합_비어있으면_예외() {
        assertThatThrownBy(() -> new Fold(0, List.of(1, 2), List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("testIndices cannot be empty");
    }
}
