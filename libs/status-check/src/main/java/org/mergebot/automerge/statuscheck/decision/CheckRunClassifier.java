package org.mergebot.automerge.statuscheck.decision;

import org.mergebot.automerge.statuscheck.model.Verdict;
import org.mergebot.automerge.vcsclient.github.model.CheckRun;

import java.util.Set;

/**
 * Maps a check-run to a verdict.
 * <p>
 * A failing conclusion wins over the status field. Any other completed run counts as success,
 * whatever its conclusion.
 */
public final class CheckRunClassifier {

    static final Set<String> FAILURE_CONCLUSIONS = Set.of("failure", "action_required", "cancelled", "timed_out");

    private CheckRunClassifier() {
    }

    public static Verdict classify(CheckRun item) {
        if (item.conclusion() != null && FAILURE_CONCLUSIONS.contains(item.conclusion())) {
            return Verdict.FAILURE;
        }
        if (item.isCompleted()) {
            return Verdict.SUCCESS;
        }
        return Verdict.PENDING;
    }
}
