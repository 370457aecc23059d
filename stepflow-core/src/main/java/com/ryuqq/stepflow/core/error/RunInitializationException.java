package com.ryuqq.stepflow.core.error;

/**
 * Run 초기화 실패 (예: Experiment Tracker 연결 불가).
 *
 * <p>어떤 step도 실행되기 전에 Run을 중단시킵니다. 재시도하지 않습니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public class RunInitializationException extends StepflowException {

    public RunInitializationException(String message, Throwable cause) {
        super(ErrorKind.RUN_INITIALIZATION, message, null, null, cause);
    }

    public RunInitializationException(String message) {
        this(message, null);
    }
}
