package fr.imt.stackpilot.stackpilot.infrastructure.persistence;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.business.model.TriggerReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable record of one deployment attempt. The log only grows while the deployment runs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "deployments")
public class Deployment {

    public static final String SEQUENCE_NAME = "deployments_sequence";

    @Id
    private Long id;

    @Indexed
    private String repositoryId;

    private String commitHash;

    @Builder.Default
    private DeploymentStatus status = DeploymentStatus.PENDING;

    private TriggerReason trigger;

    private Instant startedAt;

    private Instant finishedAt;

    // Set on failure, e.g. GIT_ERR / AUTH
    private String errorCode;

    private String failureKind;

    @Builder.Default
    private List<String> logs = new ArrayList<>();

}
