package com.ryuqq.stepflow.core.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 지표가 임계값 이상일 때만 동작을 실행하는 게이트.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>{@code metric >= threshold}이면 동작 실행 후 {@link GateDecision#PUBLISHED}</li>
 *   <li>미만이거나 NaN이면 동작 없이 {@link GateDecision#SKIPPED} (info 로그)</li>
 *   <li>동작이 던진 예외는 그대로 전파 (step 실패)</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class ThresholdGate {

    private static final Logger log = LoggerFactory.getLogger(ThresholdGate.class);

    private final String metricName;

    public ThresholdGate(String metricName) {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName cannot be null or blank");
        }
        this.metricName = metricName;
    }

    /**
     * 게이트 평가.
     *
     * @param metric 지표 값
     * @param threshold 임계값
     * @param action 게이트가 열렸을 때 실행할 동작
     * @return 판정 결과
     * @throws IllegalArgumentException threshold가 NaN이거나 action이 null인 경우
     * @throws Exception action이 던진 예외
     */
    public GateDecision evaluate(double metric, double threshold, GateAction action) throws Exception {
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold cannot be NaN");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (Double.isNaN(metric) || metric < threshold) {
            log.info("Gate closed: {}={} below threshold {}, skipping", metricName, metric, threshold);
            return GateDecision.SKIPPED;
        }
        action.run();
        log.info("Gate open: {}={} meets threshold {}", metricName, metric, threshold);
        return GateDecision.PUBLISHED;
    }

    public String getMetricName() {
        return metricName;
    }
}
