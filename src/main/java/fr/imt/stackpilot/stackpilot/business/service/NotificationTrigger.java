package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentEvent;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentSummary;
import fr.imt.stackpilot.stackpilot.business.port.NotificationPort;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends the success or failure notification of a finished deployment. Best effort: a failing or
 * slow notification target never changes the deployment outcome and never blocks the worker
 * longer than the configured timeout.
 */
@Slf4j
@Component
public class NotificationTrigger {

    private final NotificationPort notificationPort;
    private final AsyncTaskExecutor notificationExecutor;
    private final Duration timeout;

    public NotificationTrigger(NotificationPort notificationPort,
                               @Qualifier("notificationExecutor") AsyncTaskExecutor notificationExecutor,
                               StackpilotProperties properties) {
        this.notificationPort = notificationPort;
        this.notificationExecutor = notificationExecutor;
        this.timeout = properties.getDeploy().getNotificationTimeout();
    }

    public void fire(DeploymentEvent event, GitRepository repository, Deployment deployment) {
        List<String> urls = event == DeploymentEvent.SUCCESS
                ? repository.getSuccessNotifications()
                : repository.getFailureNotifications();

        if (urls == null || urls.isEmpty()) {
            log.debug("No {} notification configured for {}", event.getEventName(), repository.getId());
            return;
        }

        DeploymentSummary summary = new DeploymentSummary(
                deployment.getId(),
                repository.getId(),
                repository.getProjectName(),
                deployment.getCommitHash(),
                deployment.getStatus(),
                deployment.getStartedAt(),
                deployment.getFinishedAt());

        Future<?> delivery;
        try {
            delivery = notificationExecutor.submit(() -> notificationPort.send(urls, event, summary));
        } catch (RejectedExecutionException e) {
            log.warn("Notification executor saturated, skipping {} notification for deployment {}",
                    event.getEventName(), deployment.getId());
            return;
        }
        try {
            delivery.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Sent {} notification for deployment {} to {} target(s)",
                    event.getEventName(), deployment.getId(), urls.size());
        } catch (TimeoutException e) {
            delivery.cancel(true);
            log.warn("Notification for deployment {} timed out after {}", deployment.getId(), timeout);
        } catch (ExecutionException e) {
            log.warn("Notification for deployment {} failed: {}", deployment.getId(), e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while notifying for deployment {}", deployment.getId());
        }
    }
}
