package org.mergebot.automerge.vcsclient.github.model;

import java.util.List;

/**
 * Protection settings of a single branch.
 *
 * @param branch            the branch name
 * @param isProtected       whether GitHub reports the branch as protected
 * @param requiredContexts  the status check contexts required before merge; empty when unprotected
 */
public record BranchProtection(
        String branch,
        boolean isProtected,
        List<String> requiredContexts
) {
    public BranchProtection {
        requiredContexts = requiredContexts != null ? List.copyOf(requiredContexts) : List.of();
    }

    public static BranchProtection unprotected(String branch) {
        return new BranchProtection(branch, false, List.of());
    }
}
