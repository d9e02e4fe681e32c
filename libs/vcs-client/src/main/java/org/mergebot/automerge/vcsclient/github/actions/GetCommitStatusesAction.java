package org.mergebot.automerge.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.mergebot.automerge.vcsclient.github.GitHubConfig;
import org.mergebot.automerge.vcsclient.github.GitHubException;
import org.mergebot.automerge.vcsclient.github.model.CommitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the combined legacy status of a commit and returns its individual statuses.
 */
public class GetCommitStatusesAction {

    private static final Logger log = LoggerFactory.getLogger(GetCommitStatusesAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GetCommitStatusesAction(OkHttpClient authorizedOkHttpClient) {
        this(authorizedOkHttpClient, GitHubConfig.API_BASE);
    }

    public GetCommitStatusesAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    public List<CommitStatus> getStatuses(String owner, String repo, String sha) throws IOException {
        HttpUrl url = HttpUrl.get(apiBase).newBuilder()
                .addPathSegment("repos")
                .addPathSegment(owner)
                .addPathSegment(repo)
                .addPathSegment("commits")
                .addPathSegment(sha)
                .addPathSegment("status")
                .addQueryParameter("per_page", String.valueOf(GitHubConfig.MAX_PAGE_SIZE))
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
                GitHubException cause = new GitHubException("get combined status for " + sha, resp.code(), body);
                log.warn(cause.getMessage());
                throw new IOException(cause.getMessage(), cause);
            }

            JsonNode root = objectMapper.readTree(resp.body().string());
            List<CommitStatus> statuses = new ArrayList<>();
            JsonNode items = root.path("statuses");
            if (items.isArray()) {
                for (JsonNode node : items) {
                    statuses.add(new CommitStatus(
                            node.path("context").asText(null),
                            node.path("state").asText(null)
                    ));
                }
            }
            return statuses;
        }
    }
}
