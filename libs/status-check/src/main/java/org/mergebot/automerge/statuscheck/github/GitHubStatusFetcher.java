package org.mergebot.automerge.statuscheck.github;

import org.mergebot.automerge.statuscheck.fetch.FetchResult;
import org.mergebot.automerge.statuscheck.fetch.StatusFetcher;
import org.mergebot.automerge.vcsclient.VcsClientException;
import org.mergebot.automerge.vcsclient.github.actions.GetCommitStatusesAction;
import org.mergebot.automerge.vcsclient.github.model.CommitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

@Component
public class GitHubStatusFetcher implements StatusFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitHubStatusFetcher.class);

    private final GetCommitStatusesAction getCommitStatusesAction;

    public GitHubStatusFetcher(GetCommitStatusesAction getCommitStatusesAction) {
        this.getCommitStatusesAction = getCommitStatusesAction;
    }

    @Override
    public FetchResult<List<CommitStatus>> fetchStatuses(String owner, String repo, String commitSha) {
        try {
            return FetchResult.success(getCommitStatusesAction.getStatuses(owner, repo, commitSha));
        } catch (IOException | VcsClientException e) {
            log.warn("Failed to fetch statuses for {}/{}@{}: {}", owner, repo, commitSha, e.getMessage());
            return FetchResult.failure(e);
        }
    }
}
