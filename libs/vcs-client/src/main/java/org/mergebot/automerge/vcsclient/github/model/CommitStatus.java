package org.mergebot.automerge.vcsclient.github.model;

/**
 * A legacy commit status.
 *
 * @param context the status context, matched against required contexts
 * @param state   success, failure, error or pending
 */
public record CommitStatus(
        String context,
        String state
) {
}
