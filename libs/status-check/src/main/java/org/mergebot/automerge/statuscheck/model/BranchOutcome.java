package org.mergebot.automerge.statuscheck.model;

/**
 * Aggregate of the verdicts of every required check on a branch.
 */
public enum BranchOutcome {
    /** Every required check succeeded. */
    ALL_SUCCESS,
    /** At least one required check failed. */
    HAS_FAILURE,
    /** Some checks are still pending and none failed. */
    INDETERMINATE
}
