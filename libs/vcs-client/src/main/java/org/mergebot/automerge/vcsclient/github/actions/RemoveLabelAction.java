package org.mergebot.automerge.vcsclient.github.actions;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.mergebot.automerge.vcsclient.github.GitHubConfig;
import org.mergebot.automerge.vcsclient.github.GitHubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Removes a label from an issue or pull request.
 */
public class RemoveLabelAction {

    private static final Logger log = LoggerFactory.getLogger(RemoveLabelAction.class);
    private final OkHttpClient authorizedOkHttpClient;
    private final String apiBase;

    public RemoveLabelAction(OkHttpClient authorizedOkHttpClient) {
        this(authorizedOkHttpClient, GitHubConfig.API_BASE);
    }

    public RemoveLabelAction(OkHttpClient authorizedOkHttpClient, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.apiBase = apiBase;
    }

    /**
     * Remove {@code label} from the pull request. A label that is not present is not an error.
     *
     * @return true if the label was removed, false if it was not on the pull request
     * @throws IOException on transport failure or any other non-success response
     */
    public boolean removeLabel(String owner, String repo, int pullRequestNumber, String label) throws IOException {
        HttpUrl url = HttpUrl.get(apiBase).newBuilder()
                .addPathSegment("repos")
                .addPathSegment(owner)
                .addPathSegment(repo)
                .addPathSegment("issues")
                .addPathSegment(String.valueOf(pullRequestNumber))
                .addPathSegment("labels")
                .addPathSegment(label)
                .build();

        Request req = new Request.Builder()
                .url(url)
                .header(GitHubConfig.ACCEPT_HEADER, GitHubConfig.ACCEPT_VALUE)
                .header(GitHubConfig.API_VERSION_HEADER, GitHubConfig.API_VERSION)
                .delete()
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                String body = resp.body() != null ? resp.body().string() : "";
                GitHubException cause = new GitHubException("remove label " + label, resp.code(), body);
                if (cause.isNotFound()) {
                    log.debug("Label '{}' not present on {}/{}#{}", label, owner, repo, pullRequestNumber);
                    return false;
                }
                log.warn(cause.getMessage());
                throw new IOException(cause.getMessage(), cause);
            }
            log.debug("Removed label '{}' from {}/{}#{}", label, owner, repo, pullRequestNumber);
            return true;
        }
    }
}
