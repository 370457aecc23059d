package com.ryuqq.stepflow.core.graph;

import com.ryuqq.stepflow.core.model.StepResources;
import com.ryuqq.stepflow.core.step.JoinBody;
import com.ryuqq.stepflow.core.step.StepBody;

import java.util.List;
import java.util.Objects;

/**
 * 그래프의 노드 하나: 이름, 종류, body, 선언된 successor.
 *
 * <p>join은 {@link JoinBody}와 선언된 선행 step 수를, 나머지 종류는 {@link StepBody}를 가집니다.
 * successor가 없는 step이 그래프의 끝 노드입니다.</p>
 *
 * @param name step 이름
 * @param kind step 종류
 * @param body linear/split body (join이면 null)
 * @param joinBody join body (join이 아니면 null)
 * @param successors 선언된 successor 이름 (순서 = static split의 branch 번호 순서)
 * @param declaredPredecessors join의 선언된 선행 step 수 (join이 아니면 0)
 * @param resources 실행 기반에 전달할 선언적 자원 설정
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record StepDefinition(
    String name,
    StepKind kind,
    StepBody body,
    JoinBody joinBody,
    List<String> successors,
    int declaredPredecessors,
    StepResources resources
) {

    /**
     * Compact Constructor.
     *
     * <p>종류와 body의 짝만 검증합니다. successor 참조와 구조 규칙은
     * {@link GraphValidator}가 그래프 단위로 검증합니다.</p>
     *
     * @throws IllegalArgumentException 필수 값이 없거나 종류와 body가 맞지 않는 경우
     */
    public StepDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null (step: " + name + ")");
        }
        if (successors == null || successors.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("successors cannot be null or contain null (step: " + name + ")");
        }
        if (resources == null) {
            throw new IllegalArgumentException("resources cannot be null (step: " + name + ")");
        }
        if (kind == StepKind.JOIN) {
            if (joinBody == null || body != null) {
                throw new IllegalArgumentException("join step requires a JoinBody only (step: " + name + ")");
            }
            if (declaredPredecessors < 1) {
                throw new IllegalArgumentException(
                    "join step must declare at least one predecessor (step: " + name + ", current: " + declaredPredecessors + ")"
                );
            }
        } else {
            if (body == null || joinBody != null) {
                throw new IllegalArgumentException(kind + " step requires a StepBody only (step: " + name + ")");
            }
            if (declaredPredecessors != 0) {
                throw new IllegalArgumentException("only join steps declare predecessors (step: " + name + ")");
            }
        }
        successors = List.copyOf(successors);
    }

    public static StepDefinition step(String name, StepKind kind, StepBody body, List<String> successors) {
        return new StepDefinition(name, kind, body, null, successors, 0, StepResources.none());
    }

    public static StepDefinition join(String name, JoinBody body, int declaredPredecessors, List<String> successors) {
        return new StepDefinition(name, StepKind.JOIN, null, body, successors, declaredPredecessors, StepResources.none());
    }

    /**
     * 자원 설정만 바꾼 새 정의.
     *
     * @param resources 자원 설정
     * @return 새 StepDefinition
     */
    public StepDefinition withResources(StepResources resources) {
        return new StepDefinition(name, kind, body, joinBody, successors, declaredPredecessors, resources);
    }

    public boolean isEnd() {
        return successors.isEmpty();
    }
}
