package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.business.model.RepositoryState;
import fr.imt.stackpilot.stackpilot.business.port.ContainerPort;
import fr.imt.stackpilot.stackpilot.exception.DeploymentNotFoundException;
import fr.imt.stackpilot.stackpilot.exception.RepositoryNotFoundException;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import fr.imt.stackpilot.stackpilot.support.InMemoryDeploymentRepository;
import fr.imt.stackpilot.stackpilot.support.InMemoryGitRepositoryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeploymentQueryServiceTest {

    private final InMemoryDeploymentRepository deployments = new InMemoryDeploymentRepository();
    private final InMemoryGitRepositoryPort repositories = new InMemoryGitRepositoryPort();
    private final DeploymentQueue queue = mock(DeploymentQueue.class);
    private final ContainerPort containerPort = mock(ContainerPort.class);
    private DeploymentQueryService service;

    @BeforeEach
    void setUp() {
        service = new DeploymentQueryService(deployments, repositories, queue, containerPort);
        repositories.save(GitRepository.builder()
                .id("home/api").projectName("home").localPath("/tmp/api").lastCommitHash("c3").build());
    }

    @Test
    void listsNewestFirst() {
        deployments.record("home/api", DeploymentStatus.FAILED);
        Deployment latest = deployments.record("home/api", DeploymentStatus.SUCCESS);

        List<Deployment> history = service.listDeployments("home/api", 10);

        assertThat(history).hasSize(2);
        assertThat(history.get(0).getId()).isEqualTo(latest.getId());
    }

    @Test
    void stateCombinesStoreAndQueue() {
        Deployment latest = deployments.record("home/api", DeploymentStatus.FAILED);
        when(queue.isPending("home/api")).thenReturn(true);

        RepositoryState state = service.repositoryState("home/api");

        assertThat(state.lastCommitHash()).isEqualTo("c3");
        assertThat(state.deploymentPending()).isTrue();
        assertThat(state.deploymentRunning()).isFalse();
        assertThat(state.latestDeploymentId()).isEqualTo(latest.getId());
        assertThat(state.latestStatus()).isEqualTo(DeploymentStatus.FAILED);
    }

    @Test
    void unknownIdentifiersAreReported() {
        assertThatThrownBy(() -> service.getDeployment(99L)).isInstanceOf(DeploymentNotFoundException.class);
        assertThatThrownBy(() -> service.repositoryState("home/none")).isInstanceOf(RepositoryNotFoundException.class);
    }

    @Test
    void containerLogsAreTailed() {
        when(containerPort.tailLogs("abc", 50)).thenReturn("ready\n");

        assertThat(service.containerLogs("abc", 50)).isEqualTo("ready\n");
    }
}
