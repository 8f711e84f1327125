package fr.imt.stackpilot.stackpilot.presentation.web.dto;

import lombok.Data;

@Data
public class RepositoryStateResponse {
    private String repositoryId;
    private String lastCommitHash;
    private boolean deploymentRunning;
    private boolean deploymentPending;
    private Long latestDeploymentId;
    private String latestStatus;
}
