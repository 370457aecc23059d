package com.ryuqq.stepflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Run 범위 파라미터 (실행 시작 시 고정, 이후 불변).
 *
 * <p>epoch 수, batch 크기, 정확도 임계값처럼 Run 전체에서 공유되는 설정값을 담습니다.
 * 모든 step은 {@code StepContext#parameters()}로 같은 인스턴스를 읽습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RunParameters params = RunParameters.builder()
 *     .put("training-epochs", 50)
 *     .put("accuracy-threshold", 0.7)
 *     .build();
 *
 * int epochs = params.getInt("training-epochs");
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class RunParameters {

    private static final RunParameters EMPTY = new RunParameters(Map.of());

    private final Map<String, Object> values;

    private RunParameters(Map<String, Object> values) {
        this.values = values;
    }

    public static RunParameters empty() {
        return EMPTY;
    }

    /**
     * Map으로부터 생성 (방어적 복사).
     *
     * @param values 파라미터 이름 → 값
     * @return RunParameters
     * @throws IllegalArgumentException values가 null이거나 null 키/값을 포함한 경우
     */
    public static RunParameters of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Optional<Object> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * 필수 파라미터 조회.
     *
     * @param name 파라미터 이름
     * @return 값
     * @throws IllegalStateException 파라미터가 없는 경우
     */
    public Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalStateException("Run parameter not defined: " + name);
        }
        return value;
    }

    public String getString(String name) {
        return String.valueOf(require(name));
    }

    public int getInt(String name) {
        Object value = require(name);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    public double getDouble(String name) {
        Object value = require(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(value.toString().trim());
    }

    public boolean getBoolean(String name) {
        Object value = require(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((RunParameters) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RunParameters" + values;
    }

    /**
     * RunParameters 빌더.
     */
    public static final class Builder {

        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, Object value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("parameter name cannot be null or blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("parameter value cannot be null (name: " + name + ")");
            }
            values.put(name, value);
            return this;
        }

        public RunParameters build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new RunParameters(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
