package org.mergebot.automerge.statuscheck.decision;

import org.mergebot.automerge.statuscheck.model.BranchOutcome;
import org.mergebot.automerge.statuscheck.model.LabelAction;
import org.mergebot.automerge.statuscheck.model.LabelRemovalReason;
import org.mergebot.automerge.statuscheck.model.Verdict;
import org.mergebot.automerge.vcsclient.github.model.CheckRun;
import org.mergebot.automerge.vcsclient.github.model.CommitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

/**
 * Folds the verdicts of a branch's required checks into a label decision.
 */
@Component
public class BranchDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(BranchDecisionEngine.class);

    /**
     * Decide what to do with the merge-intent labels.
     * <p>
     * With no required checks a blocked pull request can only be waiting on reviews, so the labels are
     * removed for {@link LabelRemovalReason#OUTSTANDING_REVIEWS}. Otherwise every required name is resolved:
     * all successful removes for outstanding reviews, any failure removes for status checks, and anything
     * still pending leaves the labels in place.
     *
     * @param requiredNames required check names from branch protection
     * @param checkMap      check-runs by name
     * @param statusMap     statuses by context
     */
    public LabelAction decide(Collection<String> requiredNames,
                              Map<String, CheckRun> checkMap,
                              Map<String, CommitStatus> statusMap) {
        if (requiredNames.isEmpty()) {
            return LabelAction.remove(LabelRemovalReason.OUTSTANDING_REVIEWS);
        }

        Map<String, Verdict> verdicts = RequiredCheckResolver.resolveAll(requiredNames, checkMap, statusMap);
        verdicts.forEach((name, verdict) -> log.debug("Required check '{}' resolved to {}", name, verdict));

        BranchOutcome outcome = aggregate(verdicts.values());
        return switch (outcome) {
            case ALL_SUCCESS -> LabelAction.remove(LabelRemovalReason.OUTSTANDING_REVIEWS, outcome);
            case HAS_FAILURE -> LabelAction.remove(LabelRemovalReason.STATUS_CHECKS, outcome);
            case INDETERMINATE -> LabelAction.none(outcome);
        };
    }

    public BranchOutcome aggregate(Collection<Verdict> verdicts) {
        if (verdicts.stream().allMatch(verdict -> verdict == Verdict.SUCCESS)) {
            return BranchOutcome.ALL_SUCCESS;
        }
        if (verdicts.contains(Verdict.FAILURE)) {
            return BranchOutcome.HAS_FAILURE;
        }
        return BranchOutcome.INDETERMINATE;
    }
}
