/**
 * Flow definition and runner contract.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.application.flow.Flow} - named graph plus run initializer</li>
 *   <li>{@link com.ryuqq.stepflow.application.flow.FlowRunner} - submits runs</li>
 *   <li>{@link com.ryuqq.stepflow.application.flow.RunHandle} - run ID and pending outcome</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.application.flow;
