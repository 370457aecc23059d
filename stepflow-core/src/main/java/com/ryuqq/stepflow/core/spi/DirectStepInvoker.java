package com.ryuqq.stepflow.core.spi;

import com.ryuqq.stepflow.core.graph.StepDefinition;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.step.StepResult;

import java.util.concurrent.Callable;

/**
 * 기본 StepInvoker: body를 한 번만 호출.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class DirectStepInvoker implements StepInvoker {

    private static final DirectStepInvoker INSTANCE = new DirectStepInvoker();

    private DirectStepInvoker() {
    }

    public static DirectStepInvoker getInstance() {
        return INSTANCE;
    }

    @Override
    public StepResult invoke(StepDefinition step, BranchPath branchPath, Callable<StepResult> call) throws Exception {
        return call.call();
    }
}
