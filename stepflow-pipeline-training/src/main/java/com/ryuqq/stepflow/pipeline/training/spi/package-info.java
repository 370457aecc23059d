/**
 * External collaborators of the training pipeline.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.pipeline.training.spi.DatasetLoader} - loads the tabular dataset</li>
 *   <li>{@link com.ryuqq.stepflow.pipeline.training.spi.TransformerFactory} - features/target preprocessing</li>
 *   <li>{@link com.ryuqq.stepflow.pipeline.training.spi.ModelFactory} - model architecture, fit and evaluate</li>
 *   <li>{@link com.ryuqq.stepflow.pipeline.training.spi.ExperimentTracker} - run, metric and parameter tracking</li>
 *   <li>{@link com.ryuqq.stepflow.pipeline.training.spi.ModelRegistry} - publishes the packaged model</li>
 * </ul>
 *
 * <p>The pipeline treats every implementation as opaque computation; none of them
 * is provided by this module.</p>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.pipeline.training.spi;
