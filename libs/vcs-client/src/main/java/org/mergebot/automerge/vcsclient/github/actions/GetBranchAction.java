package org.mergebot.automerge.vcsclient.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.mergebot.automerge.vcsclient.github.GitHubConfig;
import org.mergebot.automerge.vcsclient.github.GitHubException;
import org.mergebot.automerge.vcsclient.github.model.BranchProtection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the protection settings of a branch.
 */
public class GetBranchAction {

    private static final Logger log = LoggerFactory.getLogger(GetBranchAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GetBranchAction(OkHttpClient authorizedOkHttpClient) {
        this(authorizedOkHttpClient, GitHubConfig.API_BASE);
    }

    public GetBranchAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    /**
     * Fetch the branch and extract its required status check contexts.
     *
     * @return the protection settings; an unprotected branch has no required contexts
     * @throws IOException on transport failure or a non-success response
     */
    public BranchProtection getBranchProtection(String owner, String repo, String branch) throws IOException {
        HttpUrl url = HttpUrl.get(apiBase).newBuilder()
                .addPathSegment("repos")
                .addPathSegment(owner)
                .addPathSegment(repo)
                .addPathSegment("branches")
                .addPathSegment(branch)
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
                GitHubException cause = new GitHubException("get branch " + branch, resp.code(), body);
                log.warn(cause.getMessage());
                throw new IOException(cause.getMessage(), cause);
            }
            JsonNode root = objectMapper.readTree(resp.body().string());
            return parseBranch(branch, root);
        }
    }

    private BranchProtection parseBranch(String branch, JsonNode root) {
        if (!root.path("protected").asBoolean(false)) {
            return BranchProtection.unprotected(branch);
        }

        List<String> contexts = new ArrayList<>();
        JsonNode contextsNode = root.path("protection").path("required_status_checks").path("contexts");
        if (contextsNode.isArray()) {
            for (JsonNode context : contextsNode) {
                contexts.add(context.asText());
            }
        }
        return new BranchProtection(branch, true, contexts);
    }
}
