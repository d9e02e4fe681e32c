package org.mergebot.automerge.statuscheck.github;

import org.mergebot.automerge.statuscheck.fetch.CheckRunFetcher;
import org.mergebot.automerge.statuscheck.fetch.FetchResult;
import org.mergebot.automerge.vcsclient.VcsClientException;
import org.mergebot.automerge.vcsclient.github.actions.GetCommitCheckRunsAction;
import org.mergebot.automerge.vcsclient.github.model.CheckRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

@Component
public class GitHubCheckRunFetcher implements CheckRunFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitHubCheckRunFetcher.class);

    private final GetCommitCheckRunsAction getCommitCheckRunsAction;

    public GitHubCheckRunFetcher(GetCommitCheckRunsAction getCommitCheckRunsAction) {
        this.getCommitCheckRunsAction = getCommitCheckRunsAction;
    }

    @Override
    public FetchResult<List<CheckRun>> fetchCheckRuns(String owner, String repo, String commitSha) {
        try {
            return FetchResult.success(getCommitCheckRunsAction.getCheckRuns(owner, repo, commitSha));
        } catch (IOException | VcsClientException e) {
            log.warn("Failed to fetch check-runs for {}/{}@{}: {}", owner, repo, commitSha, e.getMessage());
            return FetchResult.failure(e);
        }
    }
}
