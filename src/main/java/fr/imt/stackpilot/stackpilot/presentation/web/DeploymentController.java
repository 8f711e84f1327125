package fr.imt.stackpilot.stackpilot.presentation.web;

import fr.imt.stackpilot.stackpilot.business.model.TriggerResult;
import fr.imt.stackpilot.stackpilot.business.service.DeploymentQueryService;
import fr.imt.stackpilot.stackpilot.business.service.DeploymentQueue;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import fr.imt.stackpilot.stackpilot.presentation.web.dto.DeploymentResponse;
import fr.imt.stackpilot.stackpilot.presentation.web.dto.RepositoryStateResponse;
import fr.imt.stackpilot.stackpilot.presentation.web.dto.TriggerResponse;
import fr.imt.stackpilot.stackpilot.presentation.web.dto.mappers.DeploymentMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DeploymentController {

    private final DeploymentQueue deploymentQueue;
    private final DeploymentQueryService deploymentQueryService;
    private final DeploymentMapper deploymentMapper;

    @PostMapping("/projects/{projectName}/repositories/{repositoryName}/deploy")
    public ResponseEntity<TriggerResponse> triggerDeploy(@PathVariable String projectName,
                                                         @PathVariable String repositoryName,
                                                         @RequestParam(defaultValue = "0") int priority) {
        String repositoryId = GitRepository.idOf(projectName, repositoryName);
        TriggerResult result = deploymentQueue.triggerDeploy(repositoryId, priority);
        return ResponseEntity.accepted().body(new TriggerResponse(repositoryId, result.name()));
    }

    @GetMapping("/deployments/{deploymentId}")
    public ResponseEntity<DeploymentResponse> getDeployment(@PathVariable Long deploymentId) {
        return ResponseEntity.ok(deploymentMapper.toResponse(deploymentQueryService.getDeployment(deploymentId)));
    }

    @GetMapping("/projects/{projectName}/repositories/{repositoryName}/deployments")
    public ResponseEntity<List<DeploymentResponse>> listDeployments(@PathVariable String projectName,
                                                                    @PathVariable String repositoryName,
                                                                    @RequestParam(defaultValue = "20") int limit) {
        String repositoryId = GitRepository.idOf(projectName, repositoryName);
        return ResponseEntity.ok(deploymentMapper.toResponses(
                deploymentQueryService.listDeployments(repositoryId, limit)));
    }

    @GetMapping("/projects/{projectName}/repositories/{repositoryName}/state")
    public ResponseEntity<RepositoryStateResponse> repositoryState(@PathVariable String projectName,
                                                                   @PathVariable String repositoryName) {
        String repositoryId = GitRepository.idOf(projectName, repositoryName);
        return ResponseEntity.ok(deploymentMapper.toResponse(deploymentQueryService.repositoryState(repositoryId)));
    }

    @GetMapping(value = "/containers/{containerId}/logs", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> containerLogs(@PathVariable String containerId,
                                                @RequestParam(defaultValue = "100") int lines) {
        return ResponseEntity.ok(deploymentQueryService.containerLogs(containerId, lines));
    }
}
