package fr.imt.stackpilot.stackpilot.support;

import fr.imt.stackpilot.stackpilot.business.port.GitRepositoryPort;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryGitRepositoryPort implements GitRepositoryPort {

    private final Map<String, GitRepository> repositories = new ConcurrentHashMap<>();

    @Override
    public Optional<GitRepository> findById(String repositoryId) {
        return Optional.ofNullable(repositories.get(repositoryId)).map(r -> r.toBuilder().build());
    }

    @Override
    public List<GitRepository> findAll() {
        return new ArrayList<>(repositories.values());
    }

    @Override
    public List<GitRepository> findByProjectName(String projectName) {
        return repositories.values().stream()
                .filter(r -> projectName.equals(r.getProjectName()))
                .toList();
    }

    @Override
    public GitRepository save(GitRepository repository) {
        repositories.put(repository.getId(), repository.toBuilder().build());
        return repository;
    }

    @Override
    public void deleteById(String repositoryId) {
        repositories.remove(repositoryId);
    }

    @Override
    public void updateLastCommitHash(String repositoryId, String commitHash) {
        repositories.computeIfPresent(repositoryId, (id, r) -> r.toBuilder().lastCommitHash(commitHash).build());
    }
}
