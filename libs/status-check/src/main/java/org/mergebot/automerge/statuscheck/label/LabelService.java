package org.mergebot.automerge.statuscheck.label;

import org.mergebot.automerge.statuscheck.config.AutomergeProperties;
import org.mergebot.automerge.statuscheck.model.LabelRemovalReason;
import org.mergebot.automerge.statuscheck.model.PullRequestRef;
import org.mergebot.automerge.vcsclient.VcsClientException;
import org.mergebot.automerge.vcsclient.github.actions.RemoveLabelAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Removes the configured automerge and priority labels from pull requests.
 */
@Service
public class LabelService implements LabelRemover {

    private static final Logger log = LoggerFactory.getLogger(LabelService.class);

    private final RemoveLabelAction removeLabelAction;
    private final List<String> labels;

    public LabelService(RemoveLabelAction removeLabelAction, AutomergeProperties properties) {
        this.removeLabelAction = removeLabelAction;
        this.labels = List.copyOf(properties.getLabels());
    }

    /**
     * Remove every configured label. A failure on one label is logged and does not stop the others.
     */
    @Override
    public void removeLabels(PullRequestRef pull, LabelRemovalReason reason) {
        log.info("Removing labels {} from {}: {}", labels, pull, reason.getDescription());
        for (String label : labels) {
            try {
                removeLabelAction.removeLabel(pull.owner(), pull.repo(), pull.number(), label);
            } catch (IOException | VcsClientException e) {
                log.warn("Failed to remove label '{}' from {}: {}", label, pull, e.getMessage());
            }
        }
    }

    public List<String> getLabels() {
        return labels;
    }
}
