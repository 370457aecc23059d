package com.ryuqq.stepflow.core.artifact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 불변 Artifact 맵 (이름 → 값).
 *
 * <p>step body는 상속받은 Artifact를 이 타입으로 읽고, 새로 만든 Artifact를 이 타입으로 반환합니다.
 * 모든 변경 연산은 새 인스턴스를 반환하므로 branch 간 공유해도 안전합니다 (copy-on-branch).</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>이름은 null/blank 불가</li>
 *   <li>값은 null 불가 (값이 없으면 Artifact를 만들지 않음)</li>
 *   <li>삽입 순서 유지</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Artifacts produced = Artifacts.of("test_accuracy", 0.8)
 *     .with("test_loss", 0.1);
 *
 * double accuracy = produced.get("test_accuracy", Double.class);
 * Artifacts visible = inherited.overlay(produced);
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class Artifacts {

    private static final Artifacts EMPTY = new Artifacts(Map.of());

    private final Map<String, Object> values;

    private Artifacts(Map<String, Object> values) {
        this.values = values;
    }

    public static Artifacts empty() {
        return EMPTY;
    }

    public static Artifacts of(String name, Object value) {
        return EMPTY.with(name, value);
    }

    /**
     * Map으로부터 생성 (방어적 복사).
     *
     * @param values 이름 → 값
     * @return Artifacts
     * @throws IllegalArgumentException null 키/값이 있는 경우
     */
    public static Artifacts of(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> copy.put(checkName(name), checkValue(name, value)));
        return new Artifacts(Collections.unmodifiableMap(copy));
    }

    /**
     * 이름 하나를 추가(또는 대체)한 새 인스턴스.
     *
     * @param name Artifact 이름
     * @param value 값
     * @return 새 Artifacts
     */
    public Artifacts with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(checkName(name), checkValue(name, value));
        return new Artifacts(Collections.unmodifiableMap(copy));
    }

    public <T> Artifacts with(ArtifactKey<T> key, T value) {
        return with(key.name(), value);
    }

    /**
     * 다른 Artifacts를 위에 덮어쓴 새 인스턴스.
     *
     * <p>같은 이름은 {@code top}의 값이 이깁니다. 하위 step이 같은 이름의 Artifact를
     * 새로 만들면 조상의 값을 가리는 것과 같습니다.</p>
     *
     * @param top 덮어쓸 Artifacts
     * @return 합쳐진 Artifacts
     */
    public Artifacts overlay(Artifacts top) {
        if (top == null || top.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return top;
        }
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(top.values);
        return new Artifacts(Collections.unmodifiableMap(copy));
    }

    /**
     * 지정한 이름만 남긴 새 인스턴스 (없는 이름은 무시).
     *
     * @param names 남길 이름
     * @return 새 Artifacts
     */
    public Artifacts retain(Set<String> names) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (names.contains(name)) {
                copy.put(name, value);
            }
        });
        return copy.isEmpty() ? EMPTY : new Artifacts(Collections.unmodifiableMap(copy));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
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
     * 필수 Artifact 조회.
     *
     * @param name Artifact 이름
     * @return 값
     * @throws IllegalStateException 해당 이름이 없는 경우
     */
    public Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalStateException("Artifact not found: " + name + " (available: " + values.keySet() + ")");
        }
        return value;
    }

    /**
     * 타입 검증 후 조회.
     *
     * @param name Artifact 이름
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 값
     * @throws IllegalStateException 이름이 없거나 타입이 다른 경우
     */
    public <T> T get(String name, Class<T> type) {
        Object value = require(name);
        if (!type.isInstance(value)) {
            throw new IllegalStateException(
                String.format("Artifact %s has type %s, expected %s",
                    name, value.getClass().getName(), type.getName())
            );
        }
        return type.cast(value);
    }

    public <T> T get(ArtifactKey<T> key) {
        return get(key.name(), key.type());
    }

    public double getDouble(String name) {
        return get(name, Number.class).doubleValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Artifacts) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Artifacts" + values.keySet();
    }

    private static String checkName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("artifact name cannot be null or blank");
        }
        return name;
    }

    private static Object checkValue(String name, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("artifact value cannot be null (name: " + name + ")");
        }
        return value;
    }
}
