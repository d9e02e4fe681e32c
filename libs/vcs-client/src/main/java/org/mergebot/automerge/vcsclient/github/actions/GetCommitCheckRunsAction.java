package org.mergebot.automerge.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.mergebot.automerge.vcsclient.github.GitHubConfig;
import org.mergebot.automerge.vcsclient.github.GitHubException;
import org.mergebot.automerge.vcsclient.github.model.CheckRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists the check-runs reported for a commit.
 */
public class GetCommitCheckRunsAction {

    private static final Logger log = LoggerFactory.getLogger(GetCommitCheckRunsAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GetCommitCheckRunsAction(OkHttpClient authorizedOkHttpClient) {
        this(authorizedOkHttpClient, GitHubConfig.API_BASE);
    }

    public GetCommitCheckRunsAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    /**
     * List every check-run of the commit, following pages until {@code total_count} runs have been read.
     */
    public List<CheckRun> getCheckRuns(String owner, String repo, String sha) throws IOException {
        List<CheckRun> checkRuns = new ArrayList<>();
        int page = 1;
        while (true) {
            HttpUrl url = HttpUrl.get(apiBase).newBuilder()
                    .addPathSegment("repos")
                    .addPathSegment(owner)
                    .addPathSegment(repo)
                    .addPathSegment("commits")
                    .addPathSegment(sha)
                    .addPathSegment("check-runs")
                    .addQueryParameter("per_page", String.valueOf(GitHubConfig.MAX_PAGE_SIZE))
                    .addQueryParameter("page", String.valueOf(page))
                    .build();

            Request req = new Request.Builder()
                    .url(url)
                    .header(GitHubConfig.ACCEPT_HEADER, GitHubConfig.ACCEPT_VALUE)
                    .header(GitHubConfig.API_VERSION_HEADER, GitHubConfig.API_VERSION)
                    .get()
                    .build();

            try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
                if (!resp.isSuccessful()) {
                    String body = resp.body() != null ? resp.body().string() : "";
                    GitHubException cause = new GitHubException("list check-runs for " + sha, resp.code(), body);
                    log.warn(cause.getMessage());
                    throw new IOException(cause.getMessage(), cause);
                }

                JsonNode root = objectMapper.readTree(resp.body().string());
                JsonNode runs = root.path("check_runs");
                if (!runs.isArray() || runs.isEmpty()) {
                    break;
                }
                for (JsonNode node : runs) {
                    checkRuns.add(new CheckRun(
                            getTextOrNull(node, "name"),
                            getTextOrNull(node, "status"),
                            getTextOrNull(node, "conclusion")
                    ));
                }

                int totalCount = root.path("total_count").asInt(0);
                if (checkRuns.size() >= totalCount) {
                    break;
                }
                page++;
            }
        }
        log.debug("Commit {} has {} check-run(s)", sha, checkRuns.size());
        return checkRuns;
    }

    private String getTextOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }
}
