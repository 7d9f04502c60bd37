package com.ryuqq.quantum.testkit.contract;

/**
 * Immutable state used by the contract suite.
 *
 * @param revision monotonically increasing revision number
 * @author Quantum Team
 * @since 1.0.0
 */
public record TestState(int revision) {

    public TestState() {
        this(0);
    }

    /**
     * Returns a copy with the next revision.
     *
     * @return state with {@code revision + 1}
     */
    public TestState next() {
        return new TestState(revision + 1);
    }

    /**
     * Returns a copy with the given revision.
     *
     * @param revision new revision
     * @return state with the given revision
     */
    public TestState withRevision(int revision) {
        return new TestState(revision);
    }
}
