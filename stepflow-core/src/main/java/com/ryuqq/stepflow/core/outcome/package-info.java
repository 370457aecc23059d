/**
 * Run outcome package.
 *
 * <p>{@link com.ryuqq.stepflow.core.outcome.RunOutcome} is a sealed interface with
 * {@link com.ryuqq.stepflow.core.outcome.Succeeded} and
 * {@link com.ryuqq.stepflow.core.outcome.Failed}.</p>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.core.outcome;
