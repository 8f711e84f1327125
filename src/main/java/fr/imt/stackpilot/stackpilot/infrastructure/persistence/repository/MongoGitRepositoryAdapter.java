package fr.imt.stackpilot.stackpilot.infrastructure.persistence.repository;

import fr.imt.stackpilot.stackpilot.business.port.GitRepositoryPort;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoGitRepositoryAdapter implements GitRepositoryPort {

    private final GitRepositoryRepository gitRepositoryRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<GitRepository> findById(String repositoryId) {
        return gitRepositoryRepository.findById(repositoryId);
    }

    @Override
    public List<GitRepository> findAll() {
        return gitRepositoryRepository.findAll();
    }

    @Override
    public List<GitRepository> findByProjectName(String projectName) {
        return gitRepositoryRepository.findByProjectName(projectName);
    }

    @Override
    public GitRepository save(GitRepository repository) {
        return gitRepositoryRepository.save(repository);
    }

    @Override
    public void deleteById(String repositoryId) {
        gitRepositoryRepository.deleteById(repositoryId);
    }

    @Override
    public void updateLastCommitHash(String repositoryId, String commitHash) {
        Query query = Query.query(Criteria.where("_id").is(repositoryId));
        mongoTemplate.updateFirst(query, Update.update("lastCommitHash", commitHash), GitRepository.class);
    }
}
