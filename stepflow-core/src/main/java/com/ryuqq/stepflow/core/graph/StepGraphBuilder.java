package com.ryuqq.stepflow.core.graph;

import com.ryuqq.stepflow.core.model.StepResources;
import com.ryuqq.stepflow.core.step.JoinBody;
import com.ryuqq.stepflow.core.step.StepBody;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link StepGraph} 빌더.
 *
 * <p>정의 순서는 그대로 유지되며, 모든 구조 검증은 {@link #build()}에서 한 번에 수행됩니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class StepGraphBuilder {

    private final List<StepDefinition> definitions = new ArrayList<>();

    StepGraphBuilder() {
    }

    public StepGraphBuilder define(StepDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        definitions.add(definition);
        return this;
    }

    /**
     * 종류를 직접 지정해 step 정의 (join 제외).
     *
     * @param name step 이름
     * @param kind step 종류
     * @param body step body
     * @param successors successor 이름
     * @return this
     */
    public StepGraphBuilder defineStep(String name, StepKind kind, StepBody body, String... successors) {
        return define(StepDefinition.step(name, kind, body, List.of(successors)));
    }

    public StepGraphBuilder linear(String name, StepBody body, String... successor) {
        return defineStep(name, StepKind.LINEAR, body, successor);
    }

    public StepGraphBuilder split(String name, StepBody body, String... branches) {
        return defineStep(name, StepKind.SPLIT_STATIC, body, branches);
    }

    public StepGraphBuilder foreach(String name, StepBody body, String branch) {
        return defineStep(name, StepKind.SPLIT_FOREACH, body, branch);
    }

    public StepGraphBuilder join(String name, JoinBody body, int predecessors, String... successor) {
        return define(StepDefinition.join(name, body, predecessors, List.of(successor)));
    }

    /**
     * 마지막으로 정의한 step의 자원 설정 변경.
     *
     * @param resources 자원 설정
     * @return this
     * @throws IllegalStateException 정의된 step이 없는 경우
     */
    public StepGraphBuilder withResources(StepResources resources) {
        if (definitions.isEmpty()) {
            throw new IllegalStateException("No step defined yet");
        }
        int last = definitions.size() - 1;
        definitions.set(last, definitions.get(last).withResources(resources));
        return this;
    }

    public StepGraph build() {
        return StepGraph.of(List.copyOf(definitions));
    }
}
