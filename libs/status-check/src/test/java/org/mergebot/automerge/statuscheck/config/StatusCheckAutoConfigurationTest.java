package org.mergebot.automerge.statuscheck.config;

import okhttp3.OkHttpClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mergebot.automerge.statuscheck.label.LabelService;
import org.mergebot.automerge.statuscheck.service.StatusService;
import org.mergebot.automerge.vcsclient.github.GitHubClientFactory;
import org.mergebot.automerge.vcsclient.github.actions.GetBranchAction;
import org.mergebot.automerge.vcsclient.github.actions.RemoveLabelAction;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StatusCheckAutoConfiguration")
class StatusCheckAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(StatusCheckAutoConfiguration.class));

    @Test
    @DisplayName("should wire the status service when a token is configured")
    void shouldWireStatusService() {
        contextRunner
                .withPropertyValues(
                        "automerge.github.token=ghp_test",
                        "automerge.github.connect-timeout-seconds=5",
                        "automerge.labels=ship-it,urgent")
                .run(context -> {
                    assertThat(context).hasSingleBean(StatusService.class);
                    assertThat(context.getBean(LabelService.class).getLabels()).containsExactly("ship-it", "urgent");
                    assertThat(context.getBean(GitHubClientFactory.class).getConnectTimeoutSeconds()).isEqualTo(5);
                });
    }

    @Test
    @DisplayName("should fail fast without a token")
    void shouldFailWithoutToken() {
        contextRunner.run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("should keep the GitHub client when the application defines its own OkHttpClient")
    void shouldNotWireActionsToUnrelatedHttpClient() {
        OkHttpClient unrelated = new OkHttpClient();
        contextRunner
                .withPropertyValues("automerge.github.token=ghp_test")
                .withBean("plainHttpClient", OkHttpClient.class, () -> unrelated)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    OkHttpClient gitHubClient = context.getBean(StatusCheckAutoConfiguration.GITHUB_HTTP_CLIENT, OkHttpClient.class);
                    assertThat(gitHubClient).isNotSameAs(unrelated);
                    assertThat(gitHubClient.interceptors()).hasSize(1);
                    assertThat(ReflectionTestUtils.getField(context.getBean(GetBranchAction.class), "authorizedOkHttpClient"))
                            .isSameAs(gitHubClient);
                    assertThat(ReflectionTestUtils.getField(context.getBean(RemoveLabelAction.class), "authorizedOkHttpClient"))
                            .isSameAs(gitHubClient);
                });
    }

    @Test
    @DisplayName("should back off when a GitHub client bean is defined by name")
    void shouldUseNamedGitHubClient() {
        OkHttpClient custom = new OkHttpClient();
        contextRunner
                .withBean(StatusCheckAutoConfiguration.GITHUB_HTTP_CLIENT, OkHttpClient.class, () -> custom)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(OkHttpClient.class)).isSameAs(custom);
                    assertThat(ReflectionTestUtils.getField(context.getBean(GetBranchAction.class), "authorizedOkHttpClient"))
                            .isSameAs(custom);
                });
    }
}
