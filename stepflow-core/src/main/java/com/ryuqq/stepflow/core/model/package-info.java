/**
 * Core value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.core.model.RunId} - Run unique identifier</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.BranchPath} - Position of an execution inside nested splits</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.BranchSegment} - One (split, index, width) level of a branch path</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.RunParameters} - Immutable run-wide parameters</li>
 *   <li>{@link com.ryuqq.stepflow.core.model.StepResources} - Declarative per-step resources</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.core.model;
