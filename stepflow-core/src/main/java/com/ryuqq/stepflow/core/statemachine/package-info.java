/**
 * Run/Step state machine package.
 *
 * <h2>Run</h2>
 * <pre>
 * PENDING → RUNNING → SUCCEEDED | FAILED
 * </pre>
 *
 * <h2>Step</h2>
 * <pre>
 * PENDING → RUNNING → SUCCEEDED | FAILED
 * PENDING → AWAITING_JOIN → RUNNING | FAILED   (joins only)
 * </pre>
 *
 * <p>Terminal states never transition again; invalid transitions throw
 * {@link java.lang.IllegalStateException} immediately.</p>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.core.statemachine;
