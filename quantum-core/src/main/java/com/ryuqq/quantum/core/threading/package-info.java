/**
 * Threading options and shutdown handles.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.quantum.core.threading.Threading} - closed set of execution strategies</li>
 *   <li>{@link com.ryuqq.quantum.core.threading.Joinable} - handle returned by quit calls</li>
 *   <li>{@link com.ryuqq.quantum.core.threading.QuitException} - teardown failure reported on join</li>
 * </ul>
 *
 * <h2>Resource Ownership</h2>
 * <pre>
 * DEDICATED_THREAD          → owned, torn down on quit
 * SHARED_POOL               → shared, never torn down by an instance
 * DEDICATED_POOL            → owned, shut down on quit
 * CALLER_SUPPLIED_EXECUTOR  → caller's, never torn down
 * SYNCHRONOUS_INLINE        → no resource
 * COOPERATIVE_SINGLE_THREAD → host loop, never torn down
 * </pre>
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.core.threading;
