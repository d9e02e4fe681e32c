package org.mergebot.automerge.statuscheck.config;

import okhttp3.OkHttpClient;
import org.mergebot.automerge.vcsclient.github.GitHubClientFactory;
import org.mergebot.automerge.vcsclient.github.actions.GetBranchAction;
import org.mergebot.automerge.vcsclient.github.actions.GetCommitCheckRunsAction;
import org.mergebot.automerge.vcsclient.github.actions.GetCommitStatusesAction;
import org.mergebot.automerge.vcsclient.github.actions.RemoveLabelAction;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

/**
 * Auto-configuration for the status assessment module.
 */
@AutoConfiguration
@ComponentScan(basePackages = {
        "org.mergebot.automerge.statuscheck.decision",
        "org.mergebot.automerge.statuscheck.github",
        "org.mergebot.automerge.statuscheck.label",
        "org.mergebot.automerge.statuscheck.service"
})
@EnableConfigurationProperties(AutomergeProperties.class)
public class StatusCheckAutoConfiguration {

    /**
     * Name of the GitHub-authorized client. Define a bean with this name to replace it.
     */
    public static final String GITHUB_HTTP_CLIENT = "gitHubHttpClient";

    @Bean
    @ConditionalOnMissingBean
    public GitHubClientFactory gitHubClientFactory(AutomergeProperties properties) {
        return new GitHubClientFactory(
                properties.getGithub().getConnectTimeoutSeconds(),
                properties.getGithub().getReadTimeoutSeconds());
    }

    @Bean(GITHUB_HTTP_CLIENT)
    @ConditionalOnMissingBean(name = GITHUB_HTTP_CLIENT)
    public OkHttpClient gitHubHttpClient(GitHubClientFactory factory, AutomergeProperties properties) {
        return factory.createGitHubClient(properties.getGithub().getToken());
    }

    @Bean
    public GetBranchAction getBranchAction(@Qualifier(GITHUB_HTTP_CLIENT) OkHttpClient gitHubHttpClient,
            AutomergeProperties properties) {
        return new GetBranchAction(gitHubHttpClient, properties.getGithub().getApiBase());
    }

    @Bean
    public GetCommitCheckRunsAction getCommitCheckRunsAction(@Qualifier(GITHUB_HTTP_CLIENT) OkHttpClient gitHubHttpClient,
            AutomergeProperties properties) {
        return new GetCommitCheckRunsAction(gitHubHttpClient, properties.getGithub().getApiBase());
    }

    @Bean
    public GetCommitStatusesAction getCommitStatusesAction(@Qualifier(GITHUB_HTTP_CLIENT) OkHttpClient gitHubHttpClient,
            AutomergeProperties properties) {
        return new GetCommitStatusesAction(gitHubHttpClient, properties.getGithub().getApiBase());
    }

    @Bean
    public RemoveLabelAction removeLabelAction(@Qualifier(GITHUB_HTTP_CLIENT) OkHttpClient gitHubHttpClient,
            AutomergeProperties properties) {
        return new RemoveLabelAction(gitHubHttpClient, properties.getGithub().getApiBase());
    }
}
