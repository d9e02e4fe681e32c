package org.mergebot.automerge.vcsclient.github;

public final class GitHubConfig {

    public static final String API_BASE = "https://api.github.com";

    public static final String ACCEPT_HEADER = "Accept";
    public static final String API_VERSION_HEADER = "X-GitHub-Api-Version";
    public static final String ACCEPT_VALUE = "application/vnd.github+json";
    public static final String API_VERSION = "2022-11-28";

    public static final int MAX_PAGE_SIZE = 100;

    private GitHubConfig() {
        // Utility class
    }
}
