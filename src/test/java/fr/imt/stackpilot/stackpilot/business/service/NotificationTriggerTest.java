package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentEvent;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.NotificationException;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import fr.imt.stackpilot.stackpilot.support.RecordingNotificationPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class NotificationTriggerTest {

    private final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    private final StackpilotProperties properties = new StackpilotProperties();
    private final RecordingNotificationPort port = new RecordingNotificationPort();

    private final GitRepository repository = GitRepository.builder()
            .id("home/api")
            .projectName("home")
            .successNotifications(List.of("slack://token@channel"))
            .failureNotifications(List.of("https://hooks.example.com/ko", "discord://token@id"))
            .build();

    private final Deployment deployment = Deployment.builder()
            .id(42L)
            .repositoryId("home/api")
            .commitHash("abc123")
            .status(DeploymentStatus.FAILED)
            .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
            .finishedAt(Instant.parse("2024-05-01T10:00:12Z"))
            .build();

    @BeforeEach
    void setUp() {
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(0);
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void failureGoesToFailureTargets() {
        new NotificationTrigger(port, executor, properties).fire(DeploymentEvent.FAILURE, repository, deployment);

        assertThat(port.sent()).singleElement().satisfies(sent -> {
            assertThat(sent.urls()).containsExactly("https://hooks.example.com/ko", "discord://token@id");
            assertThat(sent.summary().deploymentId()).isEqualTo(42L);
            assertThat(sent.summary().status()).isEqualTo(DeploymentStatus.FAILED);
            assertThat(sent.summary().durationSeconds()).isEqualTo(12.0);
        });
    }

    @Test
    void nothingIsSentWithoutTargets() {
        repository.setSuccessNotifications(List.of());

        new NotificationTrigger(port, executor, properties).fire(DeploymentEvent.SUCCESS, repository, deployment);

        assertThat(port.sent()).isEmpty();
    }

    @Test
    void failingSenderIsSwallowed() {
        port.failWith(new NotificationException("shoutrrr exited with 1"));

        assertThatCode(() -> new NotificationTrigger(port, executor, properties)
                .fire(DeploymentEvent.FAILURE, repository, deployment))
                .doesNotThrowAnyException();
    }

    @Test
    void slowSenderIsAbandonedAfterTimeout() {
        properties.getDeploy().setNotificationTimeout(Duration.ofMillis(100));
        NotificationTrigger trigger = new NotificationTrigger((urls, event, summary) -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, executor, properties);

        long start = System.nanoTime();
        trigger.fire(DeploymentEvent.FAILURE, repository, deployment);

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
    }

    @Test
    void saturatedExecutorSkipsTheNotification() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(2);
        for (int i = 0; i < 2; i++) {
            executor.execute(() -> {
                busy.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        try {
            assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatCode(() -> new NotificationTrigger(port, executor, properties)
                    .fire(DeploymentEvent.FAILURE, repository, deployment))
                    .doesNotThrowAnyException();
            assertThat(port.sent()).isEmpty();
        } finally {
            release.countDown();
        }
    }
}
