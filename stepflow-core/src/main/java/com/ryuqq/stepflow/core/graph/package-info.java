/**
 * Step graph definition and static validation.
 *
 * <p>{@link com.ryuqq.stepflow.core.graph.StepGraphBuilder} collects
 * {@link com.ryuqq.stepflow.core.graph.StepDefinition}s;
 * {@link com.ryuqq.stepflow.core.graph.GraphValidator} rejects malformed graphs
 * (cycles, arity mismatches, unclosed or overlapping split regions) before any step runs.</p>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.core.graph;
