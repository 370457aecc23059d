package com.ryuqq.stepflow.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Step별 선언적 자원/환경 설정.
 *
 * <p>엔진은 이 값을 해석하지 않습니다. {@code StepInvoker} 같은 외부 실행 기반이
 * 메모리 할당이나 환경 변수 주입에 사용합니다.</p>
 *
 * @param memoryMb 요청 메모리 (MB, 0이면 기본값)
 * @param environment step 실행 시 주입할 환경 변수
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record StepResources(
    int memoryMb,
    Map<String, String> environment
) {

    private static final StepResources NONE = new StepResources(0, Map.of());

    public StepResources {
        if (memoryMb < 0) {
            throw new IllegalArgumentException("memoryMb must be non-negative (current: " + memoryMb + ")");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        environment = Map.copyOf(environment);
    }

    public static StepResources none() {
        return NONE;
    }

    public static StepResources memory(int memoryMb) {
        return new StepResources(memoryMb, Map.of());
    }

    public StepResources withEnvironment(String name, String value) {
        Map<String, String> next = new LinkedHashMap<>(environment);
        next.put(name, value);
        return new StepResources(memoryMb, next);
    }

    public boolean isDefault() {
        return memoryMb == 0 && environment.isEmpty();
    }
}
