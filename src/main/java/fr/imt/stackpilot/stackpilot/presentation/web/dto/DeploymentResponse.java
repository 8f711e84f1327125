package fr.imt.stackpilot.stackpilot.presentation.web.dto;

import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class DeploymentResponse {
    private Long id;
    private String repositoryId;
    private String commitHash;
    private String status;
    private String trigger;
    private Instant startedAt;
    private Instant finishedAt;
    private String errorCode;
    private String failureKind;
    private List<String> logs;
}
