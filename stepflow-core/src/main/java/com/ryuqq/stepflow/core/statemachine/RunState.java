package com.ryuqq.stepflow.core.statemachine;

/**
 * Run 생명주기 상태.
 *
 * <pre>
 * PENDING
 *    │
 *    ▼ (초기화 시작)
 * RUNNING
 *    │
 *    ├─► SUCCEEDED (끝 step 도달)
 *    │
 *    └─► FAILED (초기화 실패 또는 step 실패)
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public enum RunState {

    PENDING,

    RUNNING,

    SUCCEEDED,

    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
