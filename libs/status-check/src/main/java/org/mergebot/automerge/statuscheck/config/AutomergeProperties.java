package org.mergebot.automerge.statuscheck.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the automerge status assessment.
 */
@ConfigurationProperties(prefix = "automerge")
public class AutomergeProperties {

    /**
     * Labels removed from a pull request when it can no longer be merged automatically.
     */
    private List<String> labels = new ArrayList<>(List.of("automerge", "priority automerge"));

    private final Github github = new Github();

    public List<String> getLabels() {
        return labels;
    }

    public void setLabels(List<String> labels) {
        this.labels = labels;
    }

    public Github getGithub() {
        return github;
    }

    public static class Github {

        /**
         * Base URL of the GitHub REST API. Override for GitHub Enterprise Server.
         */
        private String apiBase = "https://api.github.com";

        /**
         * Token used to authorize API calls.
         */
        private String token = "";

        private long connectTimeoutSeconds = 30;

        private long readTimeoutSeconds = 60;

        public String getApiBase() {
            return apiBase;
        }

        public void setApiBase(String apiBase) {
            this.apiBase = apiBase;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public long getConnectTimeoutSeconds() {
            return connectTimeoutSeconds;
        }

        public void setConnectTimeoutSeconds(long connectTimeoutSeconds) {
            this.connectTimeoutSeconds = connectTimeoutSeconds;
        }

        public long getReadTimeoutSeconds() {
            return readTimeoutSeconds;
        }

        public void setReadTimeoutSeconds(long readTimeoutSeconds) {
            this.readTimeoutSeconds = readTimeoutSeconds;
        }
    }
}
