package com.raditha.approx.search;

/**
 * Lifecycle of a tree node: PENDING, then SIMULATING, then one of the terminal states.
 */
public enum NodeStatus {
    PENDING,
    SIMULATING,
    /** Accepted; its children are evaluated on the next level. */
    COMPLETED,
    /** Rejected by cost, or below a rejected node. */
    PRUNED,
    /** An external stage failed. */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == PRUNED || this == FAILED;
    }

    public boolean isRejected() {
        return this == PRUNED || this == FAILED;
    }
}
