package org.mergebot.automerge.statuscheck.model;

import java.util.Objects;

/**
 * The parts of a pull request the status assessment works with.
 *
 * @param owner   repository owner (user or organization login)
 * @param repo    repository name
 * @param number  pull request number
 * @param baseRef the branch the pull request merges into
 * @param headSha the commit whose checks are evaluated
 */
public record PullRequestRef(
        String owner,
        String repo,
        int number,
        String baseRef,
        String headSha
) {
    public PullRequestRef {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(repo, "repo");
        Objects.requireNonNull(baseRef, "baseRef");
        Objects.requireNonNull(headSha, "headSha");
    }

    @Override
    public String toString() {
        return owner + "/" + repo + "#" + number;
    }
}
