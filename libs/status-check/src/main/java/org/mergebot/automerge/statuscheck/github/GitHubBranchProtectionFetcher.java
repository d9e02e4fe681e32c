package org.mergebot.automerge.statuscheck.github;

import org.mergebot.automerge.statuscheck.fetch.BranchProtectionFetcher;
import org.mergebot.automerge.statuscheck.fetch.FetchResult;
import org.mergebot.automerge.vcsclient.VcsClientException;
import org.mergebot.automerge.vcsclient.github.actions.GetBranchAction;
import org.mergebot.automerge.vcsclient.github.model.BranchProtection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class GitHubBranchProtectionFetcher implements BranchProtectionFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitHubBranchProtectionFetcher.class);

    private final GetBranchAction getBranchAction;

    public GitHubBranchProtectionFetcher(GetBranchAction getBranchAction) {
        this.getBranchAction = getBranchAction;
    }

    @Override
    public FetchResult<BranchProtection> fetchBranchProtection(String owner, String repo, String branchRef) {
        try {
            return FetchResult.success(getBranchAction.getBranchProtection(owner, repo, branchRef));
        } catch (IOException | VcsClientException e) {
            log.warn("There was a problem getting the branch protections for {}/{}:{}: {}",
                    owner, repo, branchRef, e.getMessage());
            return FetchResult.failure(e);
        }
    }
}
