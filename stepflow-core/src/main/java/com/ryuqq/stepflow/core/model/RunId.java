package com.ryuqq.stepflow.core.model;

import java.util.UUID;

/**
 * Run의 전역 고유 식별자.
 *
 * <p>RunId는 하나의 그래프 실행(Run)을 식별하며, Artifact 네임스페이스와
 * 실행 기록(RunStore)의 키로 사용됩니다. 외부 Experiment Tracker의 run 이름으로도
 * 전달될 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class RunId {

    private final String value;

    private RunId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("RunId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("RunId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * RunId 생성.
     *
     * @param value RunId 값
     * @return RunId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RunId of(String value) {
        return new RunId(value);
    }

    /**
     * UUID 기반 RunId 생성.
     *
     * @return 새 RunId
     */
    public static RunId generate() {
        return new RunId(UUID.randomUUID().toString());
    }

    /**
     * RunId 값 조회.
     *
     * @return RunId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return value.equals(runId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RunId{" + value + '}';
    }
}
