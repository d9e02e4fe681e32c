package org.mergebot.automerge.vcsclient.github;

import org.mergebot.automerge.vcsclient.VcsClientException;

/**
 * Non-success response from the GitHub REST API.
 */
public class GitHubException extends VcsClientException {

    private final int statusCode;

    public GitHubException(String operation, int statusCode, String responseBody) {
        super(String.format("GitHub API error during %s: HTTP %d - %s", operation, statusCode, responseBody));
        this.statusCode = statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
