package org.mergebot.automerge.statuscheck.model;

/**
 * Verdict assigned to a single required check.
 */
public enum Verdict {
    SUCCESS,
    FAILURE,
    PENDING
}
