package com.ryuqq.stepflow.core.spi;

import com.ryuqq.stepflow.core.graph.StepDefinition;
import com.ryuqq.stepflow.core.model.BranchPath;
import com.ryuqq.stepflow.core.step.StepResult;

import java.util.concurrent.Callable;

/**
 * Execution substrate hook wrapped around every step body invocation.
 *
 * <p>The runner never calls a body directly; it hands the call to the invoker,
 * which may run it once ({@link DirectStepInvoker}), retry it, or apply the
 * step's {@link com.ryuqq.stepflow.core.model.StepResources}.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepInvoker {

    /**
     * Invokes a step body.
     *
     * @param step the step definition (name, kind, resources)
     * @param branchPath branch path of this execution
     * @param call the body invocation
     * @return the body's result
     * @throws Exception whatever the body (last attempt) threw
     */
    StepResult invoke(StepDefinition step, BranchPath branchPath, Callable<StepResult> call) throws Exception;
}
