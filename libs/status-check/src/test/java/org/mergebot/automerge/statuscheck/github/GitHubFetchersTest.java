package org.mergebot.automerge.statuscheck.github;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mergebot.automerge.statuscheck.fetch.FetchResult;
import org.mergebot.automerge.vcsclient.github.GitHubException;
import org.mergebot.automerge.vcsclient.github.actions.GetBranchAction;
import org.mergebot.automerge.vcsclient.github.actions.GetCommitCheckRunsAction;
import org.mergebot.automerge.vcsclient.github.actions.GetCommitStatusesAction;
import org.mergebot.automerge.vcsclient.github.model.BranchProtection;
import org.mergebot.automerge.vcsclient.github.model.CheckRun;
import org.mergebot.automerge.vcsclient.github.model.CommitStatus;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GitHubFetchersTest {

    @Mock
    private GetBranchAction getBranchAction;

    @Mock
    private GetCommitCheckRunsAction getCommitCheckRunsAction;

    @Mock
    private GetCommitStatusesAction getCommitStatusesAction;

    @Test
    void testFetchBranchProtection_Success_WrapsValue() throws IOException {
        BranchProtection protection = new BranchProtection("main", true, List.of("ci/build"));
        when(getBranchAction.getBranchProtection("owner", "repo", "main")).thenReturn(protection);

        FetchResult<BranchProtection> result = new GitHubBranchProtectionFetcher(getBranchAction)
                .fetchBranchProtection("owner", "repo", "main");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get()).isEqualTo(protection);
    }

    @Test
    void testFetchBranchProtection_IOException_ReturnsFailure() throws IOException {
        IOException error = new IOException("GitHub returned 500");
        when(getBranchAction.getBranchProtection("owner", "repo", "main")).thenThrow(error);

        FetchResult<BranchProtection> result = new GitHubBranchProtectionFetcher(getBranchAction)
                .fetchBranchProtection("owner", "repo", "main");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailure()).isSameAs(error);
    }

    @Test
    void testFetchCheckRuns_Success_WrapsValue() throws IOException {
        List<CheckRun> runs = List.of(new CheckRun("ci/build", "completed", "success"));
        when(getCommitCheckRunsAction.getCheckRuns("owner", "repo", "abc123")).thenReturn(runs);

        FetchResult<List<CheckRun>> result = new GitHubCheckRunFetcher(getCommitCheckRunsAction)
                .fetchCheckRuns("owner", "repo", "abc123");

        assertThat(result.get()).isEqualTo(runs);
    }

    @Test
    void testFetchCheckRuns_ClientException_ReturnsFailure() throws IOException {
        when(getCommitCheckRunsAction.getCheckRuns("owner", "repo", "abc123"))
                .thenThrow(new GitHubException("list check-runs", 403, "API rate limit exceeded"));

        FetchResult<List<CheckRun>> result = new GitHubCheckRunFetcher(getCommitCheckRunsAction)
                .fetchCheckRuns("owner", "repo", "abc123");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailure()).isInstanceOf(GitHubException.class);
    }

    @Test
    void testFetchStatuses_Success_WrapsValue() throws IOException {
        List<CommitStatus> statuses = List.of(new CommitStatus("legacy-ci", "success"));
        when(getCommitStatusesAction.getStatuses("owner", "repo", "abc123")).thenReturn(statuses);

        FetchResult<List<CommitStatus>> result = new GitHubStatusFetcher(getCommitStatusesAction)
                .fetchStatuses("owner", "repo", "abc123");

        assertThat(result.get()).isEqualTo(statuses);
    }

    @Test
    void testFetchStatuses_IOException_ReturnsFailure() throws IOException {
        when(getCommitStatusesAction.getStatuses("owner", "repo", "abc123")).thenThrow(new IOException("timeout"));

        FetchResult<List<CommitStatus>> result = new GitHubStatusFetcher(getCommitStatusesAction)
                .fetchStatuses("owner", "repo", "abc123");

        assertThat(result.isSuccess()).isFalse();
    }
}
