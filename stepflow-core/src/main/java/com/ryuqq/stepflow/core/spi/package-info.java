/**
 * Service Provider Interfaces (SPI) for external integrations.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.core.spi.ArtifactStore} - write-once artifact storage per scope</li>
 *   <li>{@link com.ryuqq.stepflow.core.spi.RunStore} - run and step state history</li>
 *   <li>{@link com.ryuqq.stepflow.core.spi.StepInvoker} - execution substrate around step bodies</li>
 *   <li>{@link com.ryuqq.stepflow.core.spi.RunInitializer} - run-level setup before the start step</li>
 * </ul>
 *
 * <p>In-memory implementations live in {@code stepflow-adapter-inmemory};
 * contract tests live in {@code stepflow-testkit}.</p>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.core.spi;
