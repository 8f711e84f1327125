package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStepType;
import fr.imt.stackpilot.stackpilot.business.port.DeploymentLogPublisherPort;
import fr.imt.stackpilot.stackpilot.business.port.DeploymentRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Appends deployment log lines one at a time to the store and mirrors them to live subscribers.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeploymentLogWriter {

    private final DeploymentRepositoryPort deploymentRepositoryPort;
    private final DeploymentLogPublisherPort logPublisherPort;

    public void append(Long deploymentId, DeploymentStepType step, String message) {
        String line = step.getLabel() + " " + message;
        deploymentRepositoryPort.appendLog(deploymentId, line);
        try {
            logPublisherPort.publish(deploymentId, line);
        } catch (RuntimeException e) {
            log.warn("Failed to publish log line for deployment {}: {}", deploymentId, e.getMessage());
        }
    }

    public Consumer<String> streamFor(Long deploymentId, DeploymentStepType step) {
        return line -> {
            if (!line.isBlank()) {
                append(deploymentId, step, line);
            }
        };
    }
}
