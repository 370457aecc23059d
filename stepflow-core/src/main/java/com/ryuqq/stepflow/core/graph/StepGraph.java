package com.ryuqq.stepflow.core.graph;

import com.ryuqq.stepflow.core.error.InvalidGraphException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 검증을 통과한 불변 Step 그래프.
 *
 * <p>{@link GraphValidator}를 통과한 정의로만 생성되므로, 실행 엔진은 구조 결함을 다시 확인하지 않고
 * {@link #matchingJoin(String)}으로 split과 join의 짝을 바로 찾을 수 있습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * StepGraph graph = StepGraph.builder()
 *     .split("start", startBody, "a", "b")
 *     .linear("a", aBody, "join")
 *     .linear("b", bBody, "join")
 *     .join("join", joinBody, 2, "end")
 *     .linear("end", endBody)
 *     .build();
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class StepGraph {

    private final Map<String, StepDefinition> steps;
    private final String start;
    private final String end;
    private final List<String> topologicalOrder;
    private final Map<String, List<String>> predecessors;
    private final Map<String, String> joinBySplit;
    private final Map<String, String> splitByJoin;

    private StepGraph(Map<String, StepDefinition> steps, GraphValidator.Analysis analysis) {
        this.steps = steps;
        this.start = analysis.start();
        this.end = analysis.end();
        this.topologicalOrder = analysis.topologicalOrder();
        this.predecessors = analysis.predecessors();
        this.joinBySplit = Map.copyOf(analysis.joinBySplit());
        this.splitByJoin = Map.copyOf(analysis.splitByJoin());
    }

    /**
     * 정의 목록으로부터 그래프 생성.
     *
     * @param definitions step 정의
     * @return 검증된 그래프
     * @throws InvalidGraphException 구조 결함이 있는 경우 (모든 결함 포함)
     */
    public static StepGraph of(List<StepDefinition> definitions) {
        GraphValidator.Analysis analysis = GraphValidator.analyze(definitions);
        if (!analysis.isValid()) {
            throw new InvalidGraphException(analysis.problems());
        }
        Map<String, StepDefinition> steps = new LinkedHashMap<>();
        for (StepDefinition definition : definitions) {
            steps.put(definition.name(), definition);
        }
        return new StepGraph(Collections.unmodifiableMap(steps), analysis);
    }

    public static StepGraphBuilder builder() {
        return new StepGraphBuilder();
    }

    public StepDefinition start() {
        return steps.get(start);
    }

    public StepDefinition end() {
        return steps.get(end);
    }

    /**
     * 이름으로 step 조회.
     *
     * @param name step 이름
     * @return step 정의
     * @throws IllegalArgumentException 없는 이름인 경우
     */
    public StepDefinition step(String name) {
        StepDefinition step = steps.get(name);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step: " + name);
        }
        return step;
    }

    public boolean contains(String name) {
        return steps.containsKey(name);
    }

    public Collection<StepDefinition> steps() {
        return steps.values();
    }

    public int size() {
        return steps.size();
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public List<String> predecessors(String name) {
        step(name);
        return predecessors.get(name);
    }

    /**
     * split을 닫는 join 이름.
     *
     * @param split split step 이름
     * @return join step 이름
     * @throws IllegalArgumentException split이 아닌 경우
     */
    public String matchingJoin(String split) {
        String join = joinBySplit.get(split);
        if (join == null) {
            throw new IllegalArgumentException("Step is not a split: " + split);
        }
        return join;
    }

    public Optional<String> matchingSplit(String join) {
        return Optional.ofNullable(splitByJoin.get(join));
    }

    @Override
    public String toString() {
        return "StepGraph{start=" + start + ", end=" + end + ", steps=" + topologicalOrder + '}';
    }
}
