package com.ryuqq.stepflow.core.artifact;

/**
 * 타입이 지정된 Artifact 이름.
 *
 * <p>step 간에 주고받는 값의 이름과 기대 타입을 한 곳에 선언해 두고,
 * {@link Artifacts#get(ArtifactKey)}로 캐스팅 없이 읽기 위해 사용합니다.</p>
 *
 * <pre>
 * static final ArtifactKey&lt;Double&gt; TEST_ACCURACY = ArtifactKey.of("test_accuracy", Double.class);
 *
 * double accuracy = artifacts.get(TEST_ACCURACY);
 * </pre>
 *
 * @param name Artifact 이름
 * @param type 값 타입
 * @param <T> 값 타입
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record ArtifactKey<T>(String name, Class<T> type) {

    public ArtifactKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    public static <T> ArtifactKey<T> of(String name, Class<T> type) {
        return new ArtifactKey<>(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type.getSimpleName();
    }
}
