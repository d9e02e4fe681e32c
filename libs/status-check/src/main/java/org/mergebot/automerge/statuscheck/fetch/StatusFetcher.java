package org.mergebot.automerge.statuscheck.fetch;

import org.mergebot.automerge.vcsclient.github.model.CommitStatus;

import java.util.List;

public interface StatusFetcher {
    FetchResult<List<CommitStatus>> fetchStatuses(String owner, String repo, String commitSha);
}
