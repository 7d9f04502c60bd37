/**
 * User-facing function contracts.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.quantum.core.contract.Reducer} - state transformation {@code T -> T}</li>
 *   <li>{@link com.ryuqq.quantum.core.contract.Action} - read-only callback against the reduced state</li>
 *   <li>{@link com.ryuqq.quantum.core.contract.StateListener} - receiver of published states</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.core.contract;
