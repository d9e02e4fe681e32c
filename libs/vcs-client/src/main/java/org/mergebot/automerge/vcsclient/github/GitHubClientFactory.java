package org.mergebot.automerge.vcsclient.github;

import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.util.concurrent.TimeUnit;

/**
 * Builds OkHttp clients authorized against the GitHub REST API.
 */
public class GitHubClientFactory {

    private final long connectTimeoutSeconds;
    private final long readTimeoutSeconds;

    public GitHubClientFactory() {
        this(30, 60);
    }

    public GitHubClientFactory(long connectTimeoutSeconds, long readTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
        this.readTimeoutSeconds = readTimeoutSeconds;
    }

    /**
     * Create an OkHttpClient configured for GitHub API with bearer token authentication.
     *
     * @param accessToken the GitHub personal access token, OAuth token or installation token
     * @return configured OkHttpClient for GitHub API
     */
    public OkHttpClient createGitHubClient(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }

        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header("Authorization", "Bearer " + accessToken)
                            .header(GitHubConfig.ACCEPT_HEADER, GitHubConfig.ACCEPT_VALUE)
                            .header(GitHubConfig.API_VERSION_HEADER, GitHubConfig.API_VERSION)
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }

    public long getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public long getReadTimeoutSeconds() {
        return readTimeoutSeconds;
    }
}
