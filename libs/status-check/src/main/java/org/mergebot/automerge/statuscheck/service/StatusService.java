package org.mergebot.automerge.statuscheck.service;

import org.mergebot.automerge.statuscheck.decision.BranchDecisionEngine;
import org.mergebot.automerge.statuscheck.decision.RequiredCheckResolver;
import org.mergebot.automerge.statuscheck.fetch.BranchProtectionFetcher;
import org.mergebot.automerge.statuscheck.fetch.CheckRunFetcher;
import org.mergebot.automerge.statuscheck.fetch.FetchResult;
import org.mergebot.automerge.statuscheck.fetch.StatusFetcher;
import org.mergebot.automerge.statuscheck.label.LabelRemover;
import org.mergebot.automerge.statuscheck.model.LabelAction;
import org.mergebot.automerge.statuscheck.model.PullRequestRef;
import org.mergebot.automerge.vcsclient.github.model.BranchProtection;
import org.mergebot.automerge.vcsclient.github.model.CheckRun;
import org.mergebot.automerge.vcsclient.github.model.CommitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Assesses the required status checks of a pull request and removes its merge-intent labels
 * when they can no longer help it merge.
 */
@Service
public class StatusService {

    private static final Logger log = LoggerFactory.getLogger(StatusService.class);

    private final BranchProtectionFetcher branchProtectionFetcher;
    private final CheckRunFetcher checkRunFetcher;
    private final StatusFetcher statusFetcher;
    private final BranchDecisionEngine decisionEngine;
    private final LabelRemover labelRemover;

    public StatusService(
            BranchProtectionFetcher branchProtectionFetcher,
            CheckRunFetcher checkRunFetcher,
            StatusFetcher statusFetcher,
            BranchDecisionEngine decisionEngine,
            LabelRemover labelRemover
    ) {
        this.branchProtectionFetcher = branchProtectionFetcher;
        this.checkRunFetcher = checkRunFetcher;
        this.statusFetcher = statusFetcher;
        this.decisionEngine = decisionEngine;
        this.labelRemover = labelRemover;
    }

    /**
     * Checks whether there are any outstanding required checks on the pull request.
     * <p>
     * A blocked pull request with no outstanding checks is waiting on something else (reviews or conflicts),
     * so its labels are removed. Labels are also removed when a required check failed. If any remote call
     * fails nothing is changed.
     *
     * @param pull the pull request to assess
     * @return the action that was applied
     */
    public LabelAction assessStatusAndChecks(PullRequestRef pull) {
        LabelAction action = branchProtectionFetcher.fetchBranchProtection(pull.owner(), pull.repo(), pull.baseRef())
                .map(BranchProtection::requiredContexts)
                .flatMap(required -> required.isEmpty()
                        ? FetchResult.success(decisionEngine.decide(required, Map.of(), Map.of()))
                        : evaluateRequiredChecks(pull, required))
                .fold(decided -> decided, failure -> {
                    log.warn("Skipping status assessment of {}: {}", pull, failure.getMessage());
                    return LabelAction.none();
                });

        if (action.removesLabels()) {
            log.info("Pull request {} assessed as {}, removing labels ({})",
                    pull, action.evaluatedOutcome().map(Enum::name).orElse("NO_REQUIRED_CHECKS"), action.reason());
            labelRemover.removeLabels(pull, action.reason());
        } else if (action.evaluatedOutcome().isPresent()) {
            log.info("Pull request {} still has pending required checks, labels kept", pull);
        }
        return action;
    }

    private FetchResult<LabelAction> evaluateRequiredChecks(PullRequestRef pull, List<String> required) {
        return fetchCheckRunsByName(pull)
                .flatMap(checkMap -> fetchStatusesByContext(pull)
                        .map(statusMap -> decisionEngine.decide(required, checkMap, statusMap)));
    }

    private FetchResult<Map<String, CheckRun>> fetchCheckRunsByName(PullRequestRef pull) {
        return checkRunFetcher.fetchCheckRuns(pull.owner(), pull.repo(), pull.headSha())
                .map(RequiredCheckResolver::indexCheckRuns);
    }

    private FetchResult<Map<String, CommitStatus>> fetchStatusesByContext(PullRequestRef pull) {
        return statusFetcher.fetchStatuses(pull.owner(), pull.repo(), pull.headSha())
                .map(RequiredCheckResolver::indexStatuses);
    }
}
