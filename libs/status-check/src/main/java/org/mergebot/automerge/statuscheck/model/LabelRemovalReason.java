package org.mergebot.automerge.statuscheck.model;

/**
 * Why merge-intent labels are being removed from a pull request.
 */
public enum LabelRemovalReason {
    OUTSTANDING_REVIEWS("no outstanding status checks remain, the pull request is blocked by reviews"),
    STATUS_CHECKS("one or more required status checks failed");

    private final String description;

    LabelRemovalReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
