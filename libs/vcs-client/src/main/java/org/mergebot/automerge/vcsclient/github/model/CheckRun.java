package org.mergebot.automerge.vcsclient.github.model;

/**
 * A check-run reported against a commit.
 *
 * @param name       the check name, matched against required contexts
 * @param status     lifecycle phase: queued, in_progress or completed
 * @param conclusion outcome, null until the run completes
 */
public record CheckRun(
        String name,
        String status,
        String conclusion
) {
    public boolean isCompleted() {
        return "completed".equals(status);
    }
}
