package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentEvent;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentRequest;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.business.model.TriggerReason;
import fr.imt.stackpilot.stackpilot.business.service.steps.ComposeUpStep;
import fr.imt.stackpilot.stackpilot.business.service.steps.DecryptSecretsStep;
import fr.imt.stackpilot.stackpilot.business.service.steps.HealthcheckStep;
import fr.imt.stackpilot.stackpilot.business.service.steps.PullStep;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.GitFailureKind;
import fr.imt.stackpilot.stackpilot.exception.GitOperationException;
import fr.imt.stackpilot.stackpilot.exception.RepositoryNotFoundException;
import fr.imt.stackpilot.stackpilot.exception.SecretsException;
import fr.imt.stackpilot.stackpilot.exception.SecretsFailureKind;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import fr.imt.stackpilot.stackpilot.support.FakeContainerPort;
import fr.imt.stackpilot.stackpilot.support.FakeGitPort;
import fr.imt.stackpilot.stackpilot.support.FakeSecretsPort;
import fr.imt.stackpilot.stackpilot.support.InMemoryDeploymentRepository;
import fr.imt.stackpilot.stackpilot.support.InMemoryGitRepositoryPort;
import fr.imt.stackpilot.stackpilot.support.RecordingNotificationPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentStateMachineTest {

    private static final String REPO_ID = "home/api";

    @TempDir
    Path workspace;

    private final StackpilotProperties properties = new StackpilotProperties();
    private final InMemoryGitRepositoryPort repositories = new InMemoryGitRepositoryPort();
    private final InMemoryDeploymentRepository deployments = new InMemoryDeploymentRepository();
    private final FakeGitPort git = new FakeGitPort();
    private final FakeContainerPort containers = new FakeContainerPort();
    private final FakeSecretsPort secrets = new FakeSecretsPort();
    private final RecordingNotificationPort notifications = new RecordingNotificationPort();
    private final List<DeploymentStatus> publishedStatuses = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger healthStatus = new AtomicInteger(200);

    private ThreadPoolTaskExecutor notificationExecutor;
    private DeploymentStateMachine stateMachine;
    private Path checkout;

    @BeforeEach
    void setUp() {
        checkout = workspace.resolve("home").resolve("api");
        notificationExecutor = new ThreadPoolTaskExecutor();
        notificationExecutor.initialize();
        DeploymentLogWriter logWriter = new DeploymentLogWriter(deployments, (id, line) -> { });
        NotificationTrigger trigger = new NotificationTrigger(notifications, notificationExecutor, properties);

        stateMachine = new DeploymentStateMachine(
                repositories,
                deployments,
                (id, repositoryId, status) -> publishedStatuses.add(status),
                git,
                containers,
                List.of(new HealthcheckStep(url -> healthStatus.get(), Duration.ofMillis(10)),
                        new ComposeUpStep(containers),
                        new PullStep(git),
                        new DecryptSecretsStep(secrets)),
                logWriter,
                trigger,
                properties);

        repositories.save(GitRepository.builder()
                .id(REPO_ID)
                .name("api")
                .projectName("home")
                .gitUrl("https://git.example.com/home/api.git")
                .localPath(checkout.toString())
                .successNotifications(List.of("https://hooks.example.com/ok"))
                .failureNotifications(List.of("https://hooks.example.com/ko"))
                .build());
    }

    @AfterEach
    void tearDown() {
        notificationExecutor.shutdown();
    }

    @Test
    void deploysNewCommitAndNotifiesOnce() throws IOException {
        givenCheckoutAt("c1");
        git.setRemoteHead("c2");

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(deployment.getCommitHash()).isEqualTo("c2");
        assertThat(deployment.getTrigger()).isEqualTo(TriggerReason.POLL);
        assertThat(deployment.getStartedAt()).isNotNull();
        assertThat(deployment.getFinishedAt()).isNotNull();
        assertThat(repositories.findById(REPO_ID).orElseThrow().getLastCommitHash()).isEqualTo("c2");
        assertThat(git.calls()).contains("pull").doesNotContain("clone");
        assertThat(containers.bringUps()).isEqualTo(1);
        assertThat(publishedStatuses).containsExactly(
                DeploymentStatus.PENDING, DeploymentStatus.RUNNING, DeploymentStatus.SUCCESS);

        assertThat(notifications.sent()).hasSize(1);
        RecordingNotificationPort.Sent sent = notifications.sent().get(0);
        assertThat(sent.event()).isEqualTo(DeploymentEvent.SUCCESS);
        assertThat(sent.urls()).containsExactly("https://hooks.example.com/ok");
        assertThat(sent.summary().deploymentId()).isEqualTo(deployment.getId());
    }

    @Test
    void clonesWhenWorkingDirectoryIsMissing() {
        git.setRemoteHead("c1");

        Deployment deployment = stateMachine.execute(DeploymentRequest.manual(REPO_ID, 0));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(git.calls()).contains("clone").doesNotContain("pull");
        assertThat(Files.isDirectory(checkout)).isTrue();
        assertThat(repositories.findById(REPO_ID).orElseThrow().getLastCommitHash()).isEqualTo("c1");
        assertThat(deployment.getLogs()).anyMatch(line -> line.startsWith("[PULL] Cloning"));
        assertThat(deployment.getCommitHash()).isEqualTo("c1");
        assertThat(notifications.sent()).singleElement()
                .satisfies(sent -> assertThat(sent.summary().commitHash()).isEqualTo("c1"));
    }

    @Test
    void recordsTheCommitActuallyCheckedOut() {
        git.setRemoteHead("c3");

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(deployment.getCommitHash()).isEqualTo("c3");
        assertThat(repositories.findById(REPO_ID).orElseThrow().getLastCommitHash()).isEqualTo("c3");
        assertThat(notifications.sent()).singleElement()
                .satisfies(sent -> assertThat(sent.summary().commitHash()).isEqualTo("c3"));
    }

    @Test
    void composeFailureKeepsPreviousCommitAndNotifiesFailure() throws IOException {
        givenCheckoutAt("c1");
        git.setRemoteHead("c2");
        containers.setExitCode(1);

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(deployment.getErrorCode()).isEqualTo("CONTAINER_ERR");
        assertThat(deployment.getFailureKind()).isEqualTo("NONZERO_EXIT");
        assertThat(deployment.getLogs()).anyMatch(line -> line.startsWith("[COMPOSE_UP] FAILED"));
        assertThat(repositories.findById(REPO_ID).orElseThrow().getLastCommitHash()).isEqualTo("c1");
        assertThat(notifications.sent()).singleElement()
                .satisfies(sent -> {
                    assertThat(sent.event()).isEqualTo(DeploymentEvent.FAILURE);
                    assertThat(sent.urls()).containsExactly("https://hooks.example.com/ko");
                });
    }

    @Test
    void unchangedRemoteIsANoOp() throws IOException {
        givenCheckoutAt("c1");
        git.setRemoteHead("c1");

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c1"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(deployment.getLogs()).isNotEmpty().allMatch(line -> line.startsWith("[CHANGE_CHECK]"));
        assertThat(git.calls()).doesNotContain("pull", "clone");
        assertThat(containers.bringUps()).isZero();
        assertThat(notifications.sent()).isEmpty();
    }

    @Test
    void stoppedStackIsRedeployedWhenEnabled() throws IOException {
        properties.getDeploy().setRedeployStoppedStacks(true);
        givenCheckoutAt("c1");
        git.setRemoteHead("c1");
        containers.setRunning(false);

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c1"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(containers.bringUps()).isEqualTo(1);
    }

    @Test
    void decryptFailureStopsBeforeContainers() throws IOException {
        givenCheckoutAt("c1");
        givenEnvFile(".env.enc", "DB_PASSWORD: ENC[...]\nsops:\n  version: 3.8.1\n");
        git.setRemoteHead("c2");
        secrets.failWith(new SecretsException(SecretsFailureKind.MISSING_KEY, "no key could decrypt the data key"));

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(deployment.getErrorCode()).isEqualTo("SECRETS_ERR");
        assertThat(deployment.getFailureKind()).isEqualTo("MISSING_KEY");
        assertThat(containers.bringUps()).isZero();
        assertThat(deployment.getLogs()).noneMatch(line -> line.startsWith("[COMPOSE_UP]"));
        assertThat(repositories.findById(REPO_ID).orElseThrow().getLastCommitHash()).isEqualTo("c1");
    }

    @Test
    void decryptsEnvFileBeforeComposeUp() throws IOException {
        givenCheckoutAt("c1");
        givenEnvFile(".env.enc", "sops:\n  version: 3.8.1\n");
        git.setRemoteHead("c2");

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(secrets.decryptions()).isEqualTo(1);
        assertThat(Files.readString(checkout.resolve(".env"))).contains("DB_PASSWORD=decrypted");
    }

    @Test
    void plainEnvFileIsCopiedAsIs() throws IOException {
        givenCheckoutAt("c1");
        givenEnvFile("app.env", "PORT=8080\n");
        git.setRemoteHead("c2");
        secrets.setEncrypted(false);

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(secrets.decryptions()).isZero();
        assertThat(Files.readString(checkout.resolve(".env"))).isEqualTo("PORT=8080\n");
        assertThat(deployment.getLogs()).anyMatch(line -> line.startsWith("[DECRYPT] WARNING"));
    }

    @Test
    void missingEnvFileFailsAsMalformed() throws IOException {
        givenCheckoutAt("c1");
        updateRepository(repository -> repository.setEnvFile("missing.env.enc"));
        git.setRemoteHead("c2");

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(deployment.getFailureKind()).isEqualTo("MALFORMED");
        assertThat(containers.bringUps()).isZero();
    }

    @Test
    void pruneFailureDoesNotFailTheDeployment() throws IOException {
        properties.getDeploy().setPruneImages(true);
        givenCheckoutAt("c1");
        git.setRemoteHead("c2");
        containers.setPruneFails(true);

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(containers.prunes()).isEqualTo(1);
        assertThat(deployment.getLogs()).anyMatch(line -> line.startsWith("[PRUNE] WARNING"));
        assertThat(repositories.findById(REPO_ID).orElseThrow().getLastCommitHash()).isEqualTo("c2");
    }

    @Test
    void notificationFailureDoesNotChangeOutcome() throws IOException {
        givenCheckoutAt("c1");
        git.setRemoteHead("c2");
        notifications.failWith(new IllegalStateException("webhook down"));

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.SUCCESS);
        assertThat(notifications.sent()).hasSize(1);
    }

    @Test
    void gitAuthFailureIsRecordedWithItsKind() throws IOException {
        givenCheckoutAt("c1");
        git.failWith(new GitOperationException(GitFailureKind.AUTH, "Authentication failed"));

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, null));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(deployment.getErrorCode()).isEqualTo("GIT_ERR");
        assertThat(deployment.getFailureKind()).isEqualTo("AUTH");
        assertThat(containers.bringUps()).isZero();
        assertThat(notifications.sent()).singleElement()
                .extracting(RecordingNotificationPort.Sent::event)
                .isEqualTo(DeploymentEvent.FAILURE);
    }

    @Test
    void unhealthyStackFailsTheDeployment() throws IOException {
        givenCheckoutAt("c1");
        updateRepository(repository -> {
            repository.setHealthcheckUrl("http://localhost:8081/health");
            repository.setHealthcheckTimeoutSeconds(1);
        });
        git.setRemoteHead("c2");
        healthStatus.set(503);

        Deployment deployment = stateMachine.execute(DeploymentRequest.poll(REPO_ID, 0, "c2"));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(deployment.getErrorCode()).isEqualTo("CONTAINER_ERR");
        assertThat(deployment.getFailureKind()).isEqualTo("UNHEALTHY");
        assertThat(repositories.findById(REPO_ID).orElseThrow().getLastCommitHash()).isEqualTo("c1");
    }

    @Test
    void unexpectedErrorIsRecordedAsInternalFailure() throws IOException {
        givenCheckoutAt("c1");
        git.setRemoteHead("c2");
        FakeContainerPort crashingContainers = new FakeContainerPort() {
            @Override
            public int bringUp(Path projectDir, String composeProject, Consumer<String> output) {
                throw new IllegalStateException("boom");
            }
        };
        DeploymentStateMachine crashing = new DeploymentStateMachine(
                repositories, deployments, (id, repositoryId, status) -> { }, git, crashingContainers,
                List.of(new ComposeUpStep(crashingContainers)),
                new DeploymentLogWriter(deployments, (id, line) -> { }),
                new NotificationTrigger(notifications, notificationExecutor, properties),
                properties);

        Deployment deployment = crashing.execute(DeploymentRequest.manual(REPO_ID, 0));

        assertThat(deployment.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(deployment.getErrorCode()).isEqualTo(DeploymentStateMachine.INTERNAL_ERROR_CODE);
    }

    @Test
    void unknownRepositoryIsRejected() {
        assertThatThrownBy(() -> stateMachine.execute(DeploymentRequest.manual("home/unknown", 0)))
                .isInstanceOf(RepositoryNotFoundException.class);
        assertThat(deployments.all()).isEmpty();
    }

    private void givenCheckoutAt(String hash) throws IOException {
        Files.createDirectories(checkout.resolve(".git"));
        Files.writeString(checkout.resolve("docker-compose.yml"), "services: {}\n");
        repositories.updateLastCommitHash(REPO_ID, hash);
    }

    private void givenEnvFile(String name, String content) throws IOException {
        Files.writeString(checkout.resolve(name), content);
        updateRepository(repository -> repository.setEnvFile(name));
    }

    private void updateRepository(Consumer<GitRepository> change) {
        GitRepository repository = repositories.findById(REPO_ID).orElseThrow();
        change.accept(repository);
        repositories.save(repository);
    }
}
