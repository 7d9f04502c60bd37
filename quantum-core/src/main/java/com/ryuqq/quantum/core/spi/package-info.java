/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the engine talks to but does not implement
 * itself. Adapter modules provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.quantum.core.spi.StatePublisher} - outbound publish of changed states</li>
 *   <li>{@link com.ryuqq.quantum.core.spi.StateObservable} - listener registration</li>
 *   <li>{@link com.ryuqq.quantum.core.spi.History} - any-thread history reader</li>
 *   <li>{@link com.ryuqq.quantum.core.spi.MutableHistory} - engine-only history writer</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>{@code quantum-adapter-inmemory} ships the default implementations
 * ({@code ExecutorStateSubject}, {@code SynchronizedHistory}).</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Single Writer:</strong> publish and push are only called from the engine's serial context</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.core.spi;
