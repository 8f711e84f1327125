package fr.imt.stackpilot.stackpilot.business.port;

import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;

import java.util.List;
import java.util.Optional;

public interface GitRepositoryPort {
    Optional<GitRepository> findById(String repositoryId);
    List<GitRepository> findAll();
    List<GitRepository> findByProjectName(String projectName);
    GitRepository save(GitRepository repository);
    void deleteById(String repositoryId);
    void updateLastCommitHash(String repositoryId, String commitHash);
}
