package fr.imt.stackpilot.stackpilot.business.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a finished deployment handed to notification senders.
 */
public record DeploymentSummary(
        Long deploymentId,
        String repositoryId,
        String projectName,
        String commitHash,
        DeploymentStatus status,
        Instant startedAt,
        Instant finishedAt) {

    public double durationSeconds() {
        Instant start = startedAt != null ? startedAt : Instant.now();
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(start, end).toMillis() / 1000.0;
    }
}
