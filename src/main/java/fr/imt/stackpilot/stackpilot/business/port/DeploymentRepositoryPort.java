package fr.imt.stackpilot.stackpilot.business.port;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.business.model.TriggerReason;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DeploymentRepositoryPort {
    Deployment create(String repositoryId, String commitHash, TriggerReason trigger);
    void markRunning(Long deploymentId, Instant startedAt);
    void appendLog(Long deploymentId, String line);
    void updateCommitHash(Long deploymentId, String commitHash);
    void finish(Long deploymentId, DeploymentStatus status, Instant finishedAt, String errorCode, String failureKind);
    Optional<Deployment> findById(Long deploymentId);
    Optional<Deployment> findLatestByRepositoryId(String repositoryId);
    List<Deployment> findByRepositoryId(String repositoryId, int limit);
}
