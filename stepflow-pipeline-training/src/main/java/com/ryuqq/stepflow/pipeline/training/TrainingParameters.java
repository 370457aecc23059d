package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.core.model.RunParameters;
import com.ryuqq.stepflow.pipeline.training.fold.KFoldSplitter;

import java.util.Map;

/**
 * 학습 파이프라인 Run 파라미터.
 *
 * <p>Run 시작 시 {@link RunParameters}로 변환되어 고정되며, 모든 step에서 같은 값을 봅니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>trackingUri: {@code MLFLOW_TRACKING_URI} 환경 변수, 없으면 http://127.0.0.1:5000</li>
 *   <li>epochs: 50, batchSize: 32</li>
 *   <li>accuracyThreshold: 0.7 (이 값 이상이어야 모델 등록)</li>
 *   <li>folds: 5, shuffleSeed: 42</li>
 *   <li>production: false, registeredModelName: penguins</li>
 * </ul>
 *
 * @param trackingUri Experiment Tracker 주소
 * @param epochs 학습 epoch 수
 * @param batchSize 학습 batch 크기
 * @param accuracyThreshold 모델 등록 최소 정확도
 * @param folds 교차 검증 fold 수
 * @param shuffleSeed fold 분할 seed
 * @param production production 모드 여부
 * @param registeredModelName 모델 레지스트리 등록 이름
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record TrainingParameters(
    String trackingUri,
    int epochs,
    int batchSize,
    double accuracyThreshold,
    int folds,
    long shuffleSeed,
    boolean production,
    String registeredModelName
) {

    public static final String TRACKING_URI_ENV = "MLFLOW_TRACKING_URI";
    public static final String DEFAULT_TRACKING_URI = "http://127.0.0.1:5000";

    public static final String TRACKING_URI = "mlflow-tracking-uri";
    public static final String EPOCHS = "training-epochs";
    public static final String BATCH_SIZE = "training-batch-size";
    public static final String ACCURACY_THRESHOLD = "accuracy-threshold";
    public static final String FOLDS = "folds";
    public static final String SHUFFLE_SEED = "shuffle-seed";
    public static final String PRODUCTION = "production";
    public static final String REGISTERED_MODEL_NAME = "registered-model-name";

    private static final int DEFAULT_EPOCHS = 50;
    private static final int DEFAULT_BATCH_SIZE = 32;
    private static final double DEFAULT_ACCURACY_THRESHOLD = 0.7;
    private static final long DEFAULT_SHUFFLE_SEED = 42L;
    private static final String DEFAULT_REGISTERED_MODEL_NAME = "penguins";

    public TrainingParameters {
        if (trackingUri == null || trackingUri.isBlank()) {
            throw new IllegalArgumentException("trackingUri cannot be null or blank");
        }
        if (epochs <= 0) {
            throw new IllegalArgumentException("epochs must be positive (current: " + epochs + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (Double.isNaN(accuracyThreshold) || accuracyThreshold < 0.0 || accuracyThreshold > 1.0) {
            throw new IllegalArgumentException(
                "accuracyThreshold must be between 0.0 and 1.0 (current: " + accuracyThreshold + ")");
        }
        if (folds < 2) {
            throw new IllegalArgumentException("folds must be at least 2 (current: " + folds + ")");
        }
        if (registeredModelName == null || registeredModelName.isBlank()) {
            throw new IllegalArgumentException("registeredModelName cannot be null or blank");
        }
    }

    /**
     * 기본값 생성자.
     */
    public TrainingParameters() {
        this(DEFAULT_TRACKING_URI, DEFAULT_EPOCHS, DEFAULT_BATCH_SIZE, DEFAULT_ACCURACY_THRESHOLD,
            KFoldSplitter.DEFAULT_FOLDS, DEFAULT_SHUFFLE_SEED, false, DEFAULT_REGISTERED_MODEL_NAME);
    }

    /**
     * 환경 변수에서 tracking URI를 읽어 기본 파라미터 생성.
     *
     * @param environment 환경 변수 (보통 {@code System.getenv()})
     * @return 파라미터
     */
    public static TrainingParameters fromEnvironment(Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        String uri = environment.get(TRACKING_URI_ENV);
        TrainingParameters defaults = new TrainingParameters();
        if (uri == null || uri.isBlank()) {
            return defaults;
        }
        return defaults.withTrackingUri(uri.trim());
    }

    /**
     * Run 파라미터에서 복원. 없는 값은 기본값을 사용합니다.
     *
     * @param parameters Run 파라미터
     * @return 파라미터
     */
    public static TrainingParameters from(RunParameters parameters) {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        TrainingParameters defaults = new TrainingParameters();
        return new TrainingParameters(
            parameters.contains(TRACKING_URI) ? parameters.getString(TRACKING_URI) : defaults.trackingUri,
            parameters.contains(EPOCHS) ? parameters.getInt(EPOCHS) : defaults.epochs,
            parameters.contains(BATCH_SIZE) ? parameters.getInt(BATCH_SIZE) : defaults.batchSize,
            parameters.contains(ACCURACY_THRESHOLD)
                ? parameters.getDouble(ACCURACY_THRESHOLD) : defaults.accuracyThreshold,
            parameters.contains(FOLDS) ? parameters.getInt(FOLDS) : defaults.folds,
            parameters.contains(SHUFFLE_SEED)
                ? Long.parseLong(parameters.getString(SHUFFLE_SEED).trim()) : defaults.shuffleSeed,
            parameters.contains(PRODUCTION) && parameters.getBoolean(PRODUCTION),
            parameters.contains(REGISTERED_MODEL_NAME)
                ? parameters.getString(REGISTERED_MODEL_NAME) : defaults.registeredModelName
        );
    }

    public RunParameters toRunParameters() {
        return RunParameters.builder()
            .put(TRACKING_URI, trackingUri)
            .put(EPOCHS, epochs)
            .put(BATCH_SIZE, batchSize)
            .put(ACCURACY_THRESHOLD, accuracyThreshold)
            .put(FOLDS, folds)
            .put(SHUFFLE_SEED, shuffleSeed)
            .put(PRODUCTION, production)
            .put(REGISTERED_MODEL_NAME, registeredModelName)
            .build();
    }

    /**
     * 실행 모드 이름.
     *
     * @return "production" 또는 "development"
     */
    public String mode() {
        return production ? "production" : "development";
    }

    public TrainingParameters withTrackingUri(String trackingUri) {
        return new TrainingParameters(trackingUri, epochs, batchSize, accuracyThreshold,
            folds, shuffleSeed, production, registeredModelName);
    }

    public TrainingParameters withEpochs(int epochs) {
        return new TrainingParameters(trackingUri, epochs, batchSize, accuracyThreshold,
            folds, shuffleSeed, production, registeredModelName);
    }

    public TrainingParameters withBatchSize(int batchSize) {
        return new TrainingParameters(trackingUri, epochs, batchSize, accuracyThreshold,
            folds, shuffleSeed, production, registeredModelName);
    }

    public TrainingParameters withAccuracyThreshold(double accuracyThreshold) {
        return new TrainingParameters(trackingUri, epochs, batchSize, accuracyThreshold,
            folds, shuffleSeed, production, registeredModelName);
    }

    public TrainingParameters withFolds(int folds) {
        return new TrainingParameters(trackingUri, epochs, batchSize, accuracyThreshold,
            folds, shuffleSeed, production, registeredModelName);
    }

    public TrainingParameters withShuffleSeed(long shuffleSeed) {
        return new TrainingParameters(trackingUri, epochs, batchSize, accuracyThreshold,
            folds, shuffleSeed, production, registeredModelName);
    }

    public TrainingParameters withProduction(boolean production) {
        return new TrainingParameters(trackingUri, epochs, batchSize, accuracyThreshold,
            folds, shuffleSeed, production, registeredModelName);
    }

    public TrainingParameters withRegisteredModelName(String registeredModelName) {
        return new TrainingParameters(trackingUri, epochs, batchSize, accuracyThreshold,
            folds, shuffleSeed, production, registeredModelName);
    }
}
