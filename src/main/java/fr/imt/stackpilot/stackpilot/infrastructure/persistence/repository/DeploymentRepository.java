package fr.imt.stackpilot.stackpilot.infrastructure.persistence.repository;

import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DeploymentRepository extends MongoRepository<Deployment, Long> {

    Optional<Deployment> findFirstByRepositoryIdOrderByIdDesc(String repositoryId);

    List<Deployment> findByRepositoryIdOrderByIdDesc(String repositoryId, Pageable pageable);
}
