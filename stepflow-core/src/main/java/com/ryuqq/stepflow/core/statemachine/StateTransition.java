package com.ryuqq.stepflow.core.statemachine;

/**
 * Run/Step 상태 전이 검증 및 실행.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(SUCCEEDED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: RUNNING → PENDING)</li>
 * </ul>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Run 상태 전이 검증.
     *
     * <p>PENDING → RUNNING, RUNNING → SUCCEEDED/FAILED만 허용됩니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RunState from, RunState to) {
        requireStates(from, to);
        boolean allowed = switch (from) {
            case PENDING -> to == RunState.RUNNING;
            case RUNNING -> to == RunState.SUCCEEDED || to == RunState.FAILED;
            case SUCCEEDED, FAILED -> false;
        };
        check(from.isTerminal(), allowed, from, to);
    }

    /**
     * Step 상태 전이 검증.
     *
     * <p>join은 branch를 기다리는 동안 AWAITING_JOIN에 머물며, branch 실패 시 바로 FAILED가 됩니다.</p>
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(StepState from, StepState to) {
        requireStates(from, to);
        boolean allowed = switch (from) {
            case PENDING -> to == StepState.RUNNING || to == StepState.AWAITING_JOIN;
            case AWAITING_JOIN -> to == StepState.RUNNING || to == StepState.FAILED;
            case RUNNING -> to == StepState.SUCCEEDED || to == StepState.FAILED;
            case SUCCEEDED, FAILED -> false;
        };
        check(from.isTerminal(), allowed, from, to);
    }

    public static RunState transition(RunState current, RunState next) {
        validate(current, next);
        return next;
    }

    public static StepState transition(StepState current, StepState next) {
        validate(current, next);
        return next;
    }

    private static void requireStates(Enum<?> from, Enum<?> to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
    }

    private static void check(boolean terminal, boolean allowed, Enum<?> from, Enum<?> to) {
        if (terminal) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (!allowed) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }
}
