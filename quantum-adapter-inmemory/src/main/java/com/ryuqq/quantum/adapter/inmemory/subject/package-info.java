/**
 * Listener registry and executor-based state delivery.
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.adapter.inmemory.subject;
