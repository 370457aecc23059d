/**
 * Cross-validation fold generation.
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.pipeline.training.fold;
