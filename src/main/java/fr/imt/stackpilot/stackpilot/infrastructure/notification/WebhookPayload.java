package fr.imt.stackpilot.stackpilot.infrastructure.notification;

/**
 * JSON body posted to HTTP notification targets.
 */
public record WebhookPayload(
        String event,
        String message,
        Long deploymentId,
        String repositoryId,
        String projectName,
        String status,
        String commitHash,
        double durationSeconds) {
}
