package org.mergebot.automerge.statuscheck.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of assessing a pull request: either leave the labels alone or remove them for a reason.
 *
 * @param reason  the removal reason, null when no label is removed
 * @param outcome the branch outcome the decision was derived from, null when checks were not evaluated
 */
public record LabelAction(
        LabelRemovalReason reason,
        BranchOutcome outcome
) {
    private static final LabelAction NONE = new LabelAction(null, null);

    public static LabelAction none() {
        return NONE;
    }

    public static LabelAction none(BranchOutcome outcome) {
        return new LabelAction(null, outcome);
    }

    public static LabelAction remove(LabelRemovalReason reason) {
        return new LabelAction(Objects.requireNonNull(reason, "reason"), null);
    }

    public static LabelAction remove(LabelRemovalReason reason, BranchOutcome outcome) {
        return new LabelAction(Objects.requireNonNull(reason, "reason"), outcome);
    }

    public boolean removesLabels() {
        return reason != null;
    }

    public Optional<BranchOutcome> evaluatedOutcome() {
        return Optional.ofNullable(outcome);
    }
}
