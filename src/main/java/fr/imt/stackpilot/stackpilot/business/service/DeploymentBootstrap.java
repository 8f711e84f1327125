package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Wires the startup sequence: sync configuration, start the workers, then start polling.
 * Shutdown runs in reverse order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeploymentBootstrap {

    private final StackpilotProperties properties;
    private final ConfigSyncService configSyncService;
    private final DeploymentQueue deploymentQueue;
    private final RepositoryPoller repositoryPoller;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        configSyncService.sync();
        deploymentQueue.start(properties.getDeploy().toConcurrencyPolicy());

        if (properties.getPoll().isEnabled()) {
            repositoryPoller.scheduleAll();
        } else {
            log.info("Polling disabled, deployments only run on manual trigger");
        }
    }

    @PreDestroy
    public void shutdown() {
        repositoryPoller.stop();
        deploymentQueue.stop();
    }
}
