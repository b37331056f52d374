package com.tagatlas.dto;

/**
 * Outcome of an edge insert. Every rejection leaves the edge set unchanged.
 */
public enum EdgeMutationResult {
    ADDED,
    ALREADY_PRESENT,
    SELF_LOOP_REJECTED,
    CYCLE_REJECTED,
    /** Ancestor walk failed; the edge was refused as if it closed a cycle */
    GUARD_FAILED,
    UNKNOWN_NODE;

    public boolean isRejected() {
        return this != ADDED && this != ALREADY_PRESENT;
    }
}
