/**
 * In-memory history recorder.
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.adapter.inmemory.history;
