package com.ryuqq.stepflow.application.flow;

import com.ryuqq.stepflow.core.graph.StepGraph;
import com.ryuqq.stepflow.core.spi.RunInitializer;

/**
 * 실행 가능한 워크플로 정의: 이름, 검증된 그래프, Run 초기화 hook.
 *
 * <p>그래프는 생성 시점에 이미 검증되었으므로 Flow를 만들 수 있다면 구조 결함은 없습니다.</p>
 *
 * @param name Flow 이름 (로그/추적용)
 * @param graph 검증된 Step 그래프
 * @param initializer start step 이전에 한 번 실행할 초기화
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record Flow(
    String name,
    StepGraph graph,
    RunInitializer initializer
) {

    public Flow {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (initializer == null) {
            throw new IllegalArgumentException("initializer cannot be null");
        }
    }

    public static Flow of(String name, StepGraph graph) {
        return new Flow(name, graph, RunInitializer.none());
    }

    public Flow withInitializer(RunInitializer initializer) {
        return new Flow(name, graph, initializer);
    }
}
