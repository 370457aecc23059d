/**
 * Flow execution engine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.adapter.runner.ParallelFlowRunner} - runs step graphs with parallel branches on a worker pool</li>
 *   <li>{@link com.ryuqq.stepflow.adapter.runner.JoinBarrier} - collects branch arrivals for one join, sized at spawn time</li>
 *   <li>{@link com.ryuqq.stepflow.adapter.runner.FlowRunnerConfig} - worker count, empty foreach policy, shutdown timeout</li>
 *   <li>{@link com.ryuqq.stepflow.adapter.runner.RetryingStepInvoker} - retries failed bodies with exponential backoff</li>
 *   <li>{@link com.ryuqq.stepflow.adapter.runner.BackoffCalculator} - exponential backoff with jitter</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ParallelFlowRunner runner = new ParallelFlowRunner(
 *     new InMemoryArtifactStore(),
 *     new InMemoryRunStore(),
 *     new RetryingStepInvoker(new RetryConfig()),
 *     new FlowRunnerConfig().withConcurrency(4)
 * );
 *
 * RunOutcome outcome = runner.run(flow, parameters);
 * runner.shutdown();
 * </pre>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.adapter.runner;
