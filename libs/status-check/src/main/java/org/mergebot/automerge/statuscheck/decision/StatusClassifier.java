package org.mergebot.automerge.statuscheck.decision;

import org.mergebot.automerge.statuscheck.model.Verdict;
import org.mergebot.automerge.vcsclient.github.model.CommitStatus;

/**
 * Maps a legacy commit status to a verdict.
 * <p>
 * Unknown states are treated as success.
 */
public final class StatusClassifier {

    private StatusClassifier() {
    }

    public static Verdict classify(CommitStatus item) {
        String state = item.state();
        if (state == null) {
            return Verdict.SUCCESS;
        }
        return switch (state) {
            case "failure", "error" -> Verdict.FAILURE;
            case "pending" -> Verdict.PENDING;
            default -> Verdict.SUCCESS;
        };
    }
}
