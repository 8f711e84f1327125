package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.RepositoryState;
import fr.imt.stackpilot.stackpilot.business.port.ContainerPort;
import fr.imt.stackpilot.stackpilot.business.port.DeploymentRepositoryPort;
import fr.imt.stackpilot.stackpilot.business.port.GitRepositoryPort;
import fr.imt.stackpilot.stackpilot.exception.DeploymentNotFoundException;
import fr.imt.stackpilot.stackpilot.exception.RepositoryNotFoundException;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class DeploymentQueryService {

    private static final int MAX_LIMIT = 200;

    private final DeploymentRepositoryPort deploymentRepositoryPort;
    private final GitRepositoryPort gitRepositoryPort;
    private final DeploymentQueue deploymentQueue;
    private final ContainerPort containerPort;

    public Deployment getDeployment(Long deploymentId) {
        return deploymentRepositoryPort.findById(deploymentId)
                .orElseThrow(() -> new DeploymentNotFoundException(deploymentId));
    }

    /**
     * Most recent deployments of a repository, newest first.
     */
    public List<Deployment> listDeployments(String repositoryId, int limit) {
        requireRepository(repositoryId);
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return deploymentRepositoryPort.findByRepositoryId(repositoryId, Math.min(limit, MAX_LIMIT));
    }

    public RepositoryState repositoryState(String repositoryId) {
        GitRepository repository = requireRepository(repositoryId);
        Optional<Deployment> latest = deploymentRepositoryPort.findLatestByRepositoryId(repositoryId);
        return new RepositoryState(
                repositoryId,
                repository.getLastCommitHash(),
                deploymentQueue.isRunning(repositoryId),
                deploymentQueue.isPending(repositoryId),
                latest.map(Deployment::getId).orElse(null),
                latest.map(Deployment::getStatus).orElse(null));
    }

    public String containerLogs(String containerId, int lines) {
        if (lines < 1) {
            throw new IllegalArgumentException("lines must be positive");
        }
        return containerPort.tailLogs(containerId, lines);
    }

    private GitRepository requireRepository(String repositoryId) {
        return gitRepositoryPort.findById(repositoryId)
                .orElseThrow(() -> new RepositoryNotFoundException(repositoryId));
    }
}
