package org.mergebot.automerge.statuscheck.decision;

import org.mergebot.automerge.statuscheck.model.Verdict;
import org.mergebot.automerge.vcsclient.github.model.CheckRun;
import org.mergebot.automerge.vcsclient.github.model.CommitStatus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves required check names against the check-runs and statuses reported for a commit.
 * <p>
 * Check-runs take precedence over statuses; a name reported by neither is pending.
 */
public final class RequiredCheckResolver {

    private RequiredCheckResolver() {
    }

    public static Verdict resolve(String name,
                                  Map<String, CheckRun> checkMap,
                                  Map<String, CommitStatus> statusMap) {
        CheckRun checkRun = checkMap.get(name);
        if (checkRun != null) {
            return CheckRunClassifier.classify(checkRun);
        }
        CommitStatus status = statusMap.get(name);
        if (status != null) {
            return StatusClassifier.classify(status);
        }
        return Verdict.PENDING;
    }

    /**
     * Resolve every required name. A name listed twice keeps a single entry.
     */
    public static Map<String, Verdict> resolveAll(Collection<String> requiredNames,
                                                  Map<String, CheckRun> checkMap,
                                                  Map<String, CommitStatus> statusMap) {
        Map<String, Verdict> verdicts = new LinkedHashMap<>();
        for (String name : requiredNames) {
            verdicts.put(name, resolve(name, checkMap, statusMap));
        }
        return verdicts;
    }

    /**
     * Index check-runs by name. When a name repeats, the later run replaces the earlier one.
     */
    public static Map<String, CheckRun> indexCheckRuns(List<CheckRun> checkRuns) {
        Map<String, CheckRun> byName = new LinkedHashMap<>();
        for (CheckRun checkRun : checkRuns) {
            if (checkRun.name() != null) {
                byName.put(checkRun.name(), checkRun);
            }
        }
        return byName;
    }

    /**
     * Index statuses by context. When a context repeats, the later status replaces the earlier one.
     */
    public static Map<String, CommitStatus> indexStatuses(List<CommitStatus> statuses) {
        Map<String, CommitStatus> byContext = new LinkedHashMap<>();
        for (CommitStatus status : statuses) {
            if (status.context() != null) {
                byContext.put(status.context(), status);
            }
        }
        return byContext;
    }
}
