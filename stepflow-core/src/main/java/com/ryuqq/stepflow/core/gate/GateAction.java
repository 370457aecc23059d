package com.ryuqq.stepflow.core.gate;

/**
 * 게이트가 열렸을 때 실행할 동작.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GateAction {

    void run() throws Exception;
}
