package fr.imt.stackpilot.stackpilot.infrastructure.persistence.repository;

import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GitRepositoryRepository extends MongoRepository<GitRepository, String> {

    List<GitRepository> findByProjectName(String projectName);
}
