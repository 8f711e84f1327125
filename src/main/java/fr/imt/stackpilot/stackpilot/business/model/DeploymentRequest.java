package fr.imt.stackpilot.stackpilot.business.model;

import java.time.Instant;

/**
 * Queued intent to deploy a repository. Lives only inside the deployment queue.
 *
 * @param repositoryId repository to deploy
 * @param trigger      what produced the request
 * @param enqueuedAt   when the request was produced
 * @param priority     higher runs first among ready candidates
 * @param observedHash remote hash seen by the poller, informational only (may be null)
 */
public record DeploymentRequest(
        String repositoryId,
        TriggerReason trigger,
        Instant enqueuedAt,
        int priority,
        String observedHash) {

    public static DeploymentRequest manual(String repositoryId, int priority) {
        return new DeploymentRequest(repositoryId, TriggerReason.MANUAL, Instant.now(), priority, null);
    }

    public static DeploymentRequest poll(String repositoryId, int priority, String observedHash) {
        return new DeploymentRequest(repositoryId, TriggerReason.POLL, Instant.now(), priority, observedHash);
    }
}
