package org.mergebot.automerge.statuscheck.label;

import org.mergebot.automerge.statuscheck.model.LabelRemovalReason;
import org.mergebot.automerge.statuscheck.model.PullRequestRef;

/**
 * Removes merge-intent labels from a pull request. Removing a label that is not present is a no-op.
 */
public interface LabelRemover {
    void removeLabels(PullRequestRef pull, LabelRemovalReason reason);
}
