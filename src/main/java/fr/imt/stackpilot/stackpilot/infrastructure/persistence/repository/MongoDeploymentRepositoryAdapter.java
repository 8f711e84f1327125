package fr.imt.stackpilot.stackpilot.infrastructure.persistence.repository;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.business.model.TriggerReason;
import fr.imt.stackpilot.stackpilot.business.port.DeploymentRepositoryPort;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class MongoDeploymentRepositoryAdapter implements DeploymentRepositoryPort {

    private final DeploymentRepository deploymentRepository;
    private final MongoTemplate mongoTemplate;
    private final MongoSequenceGenerator sequenceGenerator;

    @Override
    public Deployment create(String repositoryId, String commitHash, TriggerReason trigger) {
        Deployment deployment = Deployment.builder()
                .id(sequenceGenerator.next(Deployment.SEQUENCE_NAME))
                .repositoryId(repositoryId)
                .commitHash(commitHash)
                .status(DeploymentStatus.PENDING)
                .trigger(trigger)
                .build();
        return mongoTemplate.insert(deployment);
    }

    @Override
    public void markRunning(Long deploymentId, Instant startedAt) {
        update(deploymentId, Update.update("status", DeploymentStatus.RUNNING).set("startedAt", startedAt));
    }

    @Override
    public void appendLog(Long deploymentId, String line) {
        update(deploymentId, new Update().push("logs", line));
    }

    @Override
    public void updateCommitHash(Long deploymentId, String commitHash) {
        update(deploymentId, Update.update("commitHash", commitHash));
    }

    @Override
    public void finish(Long deploymentId, DeploymentStatus status, Instant finishedAt,
                       String errorCode, String failureKind) {
        update(deploymentId, Update.update("status", status)
                .set("finishedAt", finishedAt)
                .set("errorCode", errorCode)
                .set("failureKind", failureKind));
    }

    @Override
    public Optional<Deployment> findById(Long deploymentId) {
        return deploymentRepository.findById(deploymentId);
    }

    @Override
    public Optional<Deployment> findLatestByRepositoryId(String repositoryId) {
        return deploymentRepository.findFirstByRepositoryIdOrderByIdDesc(repositoryId);
    }

    @Override
    public List<Deployment> findByRepositoryId(String repositoryId, int limit) {
        return deploymentRepository.findByRepositoryIdOrderByIdDesc(repositoryId, PageRequest.of(0, limit));
    }

    private void update(Long deploymentId, Update update) {
        Query query = Query.query(Criteria.where("_id").is(deploymentId));
        mongoTemplate.updateFirst(query, update, Deployment.class);
    }
}
