package org.mergebot.automerge.statuscheck.fetch;

import org.mergebot.automerge.vcsclient.github.model.BranchProtection;

public interface BranchProtectionFetcher {
    FetchResult<BranchProtection> fetchBranchProtection(String owner, String repo, String branchRef);
}
