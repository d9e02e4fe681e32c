package org.mergebot.automerge.statuscheck.decision;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mergebot.automerge.statuscheck.model.BranchOutcome;
import org.mergebot.automerge.statuscheck.model.LabelAction;
import org.mergebot.automerge.statuscheck.model.LabelRemovalReason;
import org.mergebot.automerge.statuscheck.model.Verdict;
import org.mergebot.automerge.vcsclient.github.model.CheckRun;
import org.mergebot.automerge.vcsclient.github.model.CommitStatus;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BranchDecisionEngine")
class BranchDecisionEngineTest {

    private final BranchDecisionEngine engine = new BranchDecisionEngine();

    @Nested
    @DisplayName("decide")
    class Decide {

        @Test
        @DisplayName("should remove labels for outstanding reviews when nothing is required")
        void noRequiredChecks() {
            LabelAction action = engine.decide(List.of(),
                    Map.of("ci/build", new CheckRun("ci/build", "completed", "failure")), Map.of());

            assertThat(action.removesLabels()).isTrue();
            assertThat(action.reason()).isEqualTo(LabelRemovalReason.OUTSTANDING_REVIEWS);
            assertThat(action.evaluatedOutcome()).isEmpty();
        }

        @Test
        @DisplayName("should remove labels for outstanding reviews when the only required check-run succeeded")
        void singleSuccessfulCheckRun() {
            LabelAction action = engine.decide(List.of("ci/build"),
                    Map.of("ci/build", new CheckRun("ci/build", "completed", "success")), Map.of());

            assertThat(action).isEqualTo(LabelAction.remove(LabelRemovalReason.OUTSTANDING_REVIEWS, BranchOutcome.ALL_SUCCESS));
        }

        @Test
        @DisplayName("should remove labels for status checks when a required check failed")
        void failedCheckRunWithSuccessfulStatus() {
            LabelAction action = engine.decide(List.of("ci/build", "legacy-ci"),
                    Map.of("ci/build", new CheckRun("ci/build", "completed", "failure")),
                    Map.of("legacy-ci", new CommitStatus("legacy-ci", "success")));

            assertThat(action).isEqualTo(LabelAction.remove(LabelRemovalReason.STATUS_CHECKS, BranchOutcome.HAS_FAILURE));
        }

        @Test
        @DisplayName("should report a failure even while other checks are pending")
        void failureWithPending() {
            LabelAction action = engine.decide(List.of("a", "b", "c"),
                    Map.of("a", new CheckRun("a", "queued", null)),
                    Map.of("b", new CommitStatus("b", "error"), "c", new CommitStatus("c", "success")));

            assertThat(action.reason()).isEqualTo(LabelRemovalReason.STATUS_CHECKS);
        }

        @Test
        @DisplayName("should keep labels when a required check was never reported")
        void missingRequiredCheck() {
            LabelAction action = engine.decide(List.of("ci/build"), Map.of(), Map.of());

            assertThat(action.removesLabels()).isFalse();
            assertThat(action.evaluatedOutcome()).contains(BranchOutcome.INDETERMINATE);
        }

        @Test
        @DisplayName("should keep labels while checks are mixed success and pending")
        void mixedSuccessAndPending() {
            LabelAction action = engine.decide(List.of("ci/build", "legacy-ci"),
                    Map.of("ci/build", new CheckRun("ci/build", "completed", "success")),
                    Map.of("legacy-ci", new CommitStatus("legacy-ci", "pending")));

            assertThat(action).isEqualTo(LabelAction.none(BranchOutcome.INDETERMINATE));
        }
    }

    @Nested
    @DisplayName("aggregate")
    class Aggregate {

        @Test
        void allSuccess() {
            assertThat(engine.aggregate(List.of(Verdict.SUCCESS, Verdict.SUCCESS))).isEqualTo(BranchOutcome.ALL_SUCCESS);
        }

        @Test
        void anyFailure() {
            assertThat(engine.aggregate(List.of(Verdict.SUCCESS, Verdict.PENDING, Verdict.FAILURE)))
                    .isEqualTo(BranchOutcome.HAS_FAILURE);
        }

        @Test
        void pendingWithoutFailure() {
            assertThat(engine.aggregate(List.of(Verdict.PENDING, Verdict.SUCCESS))).isEqualTo(BranchOutcome.INDETERMINATE);
        }
    }
}
