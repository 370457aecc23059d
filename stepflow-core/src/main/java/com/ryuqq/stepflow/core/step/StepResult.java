package com.ryuqq.stepflow.core.step;

import com.ryuqq.stepflow.core.artifact.Artifacts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * step body의 반환값: 새로 만든 Artifact와 successor 선택.
 *
 * <p><strong>successor 선택 방식:</strong></p>
 * <ul>
 *   <li>{@link Selection#DECLARED}: 그래프에 선언된 successor를 그대로 사용 (linear, join, static split)</li>
 *   <li>{@link Selection#BRANCHES}: static split이 successor 이름을 순서대로 명시 (선언과 같은 집합이어야 함)</li>
 *   <li>{@link Selection#FOREACH}: foreach split이 branch마다 하나씩 넘길 원소 목록</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class StepResult {

    /**
     * successor 선택 방식.
     */
    public enum Selection {
        DECLARED,
        BRANCHES,
        FOREACH
    }

    private final Artifacts artifacts;
    private final Selection selection;
    private final List<String> branches;
    private final List<Object> foreachItems;

    private StepResult(Artifacts artifacts, Selection selection, List<String> branches, List<Object> foreachItems) {
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }
        this.artifacts = artifacts;
        this.selection = selection;
        this.branches = branches;
        this.foreachItems = foreachItems;
    }

    /**
     * Artifact 없이 선언된 successor로 진행.
     *
     * @return StepResult
     */
    public static StepResult next() {
        return next(Artifacts.empty());
    }

    public static StepResult next(Artifacts artifacts) {
        return new StepResult(artifacts, Selection.DECLARED, List.of(), List.of());
    }

    /**
     * static split: successor를 명시적 순서로 선택.
     *
     * @param artifacts 새 Artifact
     * @param successors successor 이름 (branch index 순서)
     * @return StepResult
     * @throws IllegalArgumentException successors가 비어있거나 null을 포함한 경우
     */
    public static StepResult branches(Artifacts artifacts, List<String> successors) {
        if (successors == null || successors.isEmpty() || successors.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("successors cannot be null, empty or contain null");
        }
        return new StepResult(artifacts, Selection.BRANCHES, List.copyOf(successors), List.of());
    }

    /**
     * foreach split: 원소마다 branch 하나.
     *
     * <p>원소 수(K)는 이 시점에 처음 결정됩니다. 빈 목록도 허용되며 처리 방식은
     * 실행기의 빈 foreach 정책을 따릅니다.</p>
     *
     * @param artifacts 새 Artifact
     * @param items branch별 입력 원소
     * @return StepResult
     * @throws IllegalArgumentException items가 null이거나 null 원소를 포함한 경우
     */
    public static StepResult foreach(Artifacts artifacts, Iterable<?> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        List<Object> copy = new ArrayList<>();
        for (Object item : items) {
            if (item == null) {
                throw new IllegalArgumentException("foreach items cannot contain null");
            }
            copy.add(item);
        }
        return new StepResult(artifacts, Selection.FOREACH, List.of(), Collections.unmodifiableList(copy));
    }

    public static StepResult foreach(Iterable<?> items) {
        return foreach(Artifacts.empty(), items);
    }

    public Artifacts getArtifacts() {
        return artifacts;
    }

    public Selection getSelection() {
        return selection;
    }

    public List<String> getBranches() {
        return branches;
    }

    public List<Object> getForeachItems() {
        return foreachItems;
    }

    @Override
    public String toString() {
        return "StepResult{" + selection + ", " + artifacts + '}';
    }
}
