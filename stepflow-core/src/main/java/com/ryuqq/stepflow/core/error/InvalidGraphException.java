package com.ryuqq.stepflow.core.error;

import java.util.List;

/**
 * Step 그래프 구조 결함.
 *
 * <p>순환, 정의되지 않은 successor 참조, 시작/끝 노드 개수 오류, join arity 불일치,
 * 닫히지 않은 split 등 빌드 시점에 발견되는 모든 결함을 한 번에 보고합니다.
 * 재시도 대상이 아닙니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public class InvalidGraphException extends StepflowException {

    private final List<String> problems;

    public InvalidGraphException(List<String> problems) {
        super(ErrorKind.GRAPH, buildMessage(problems), null, null, null);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String buildMessage(List<String> problems) {
        if (problems == null || problems.isEmpty()) {
            throw new IllegalArgumentException("problems cannot be null or empty");
        }
        return "Invalid step graph: " + String.join("; ", problems);
    }
}
