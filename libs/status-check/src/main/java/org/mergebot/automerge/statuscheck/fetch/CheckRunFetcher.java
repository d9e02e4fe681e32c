package org.mergebot.automerge.statuscheck.fetch;

import org.mergebot.automerge.vcsclient.github.model.CheckRun;

import java.util.List;

public interface CheckRunFetcher {
    FetchResult<List<CheckRun>> fetchCheckRuns(String owner, String repo, String commitSha);
}
