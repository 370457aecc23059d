/**
 * SPI contract tests.
 *
 * <p>Abstract JUnit 5 test classes that every {@code ArtifactStore} and {@code RunStore}
 * implementation must pass. Adapter modules extend them in their own test sources.</p>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.testkit.contract;
