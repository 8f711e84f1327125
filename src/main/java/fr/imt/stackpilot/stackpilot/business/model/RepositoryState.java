package fr.imt.stackpilot.stackpilot.business.model;

/**
 * Current-state view of a repository for status widgets.
 */
public record RepositoryState(
        String repositoryId,
        String lastCommitHash,
        boolean deploymentRunning,
        boolean deploymentPending,
        Long latestDeploymentId,
        DeploymentStatus latestStatus) {
}
