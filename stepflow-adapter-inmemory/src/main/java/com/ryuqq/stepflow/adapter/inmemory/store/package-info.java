/**
 * In-memory SPI implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.stepflow.adapter.inmemory.store.InMemoryArtifactStore} - write-once artifacts per scope</li>
 *   <li>{@link com.ryuqq.stepflow.adapter.inmemory.store.InMemoryRunStore} - run and step state history</li>
 * </ul>
 *
 * <p>Both are thread-safe and lose their data on process restart.</p>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.adapter.inmemory.store;
