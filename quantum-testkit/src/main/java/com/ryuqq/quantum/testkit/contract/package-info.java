/**
 * Contract test suite shared by every Quantum backend.
 *
 * <p>Adapter modules extend {@link com.ryuqq.quantum.testkit.contract.AbstractQuantumContractTest}
 * once per threading option.</p>
 *
 * @since 1.0.0
 * @author Quantum Team
 */
package com.ryuqq.quantum.testkit.contract;
