package fr.imt.stackpilot.stackpilot.business.service.steps;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStepType;
import fr.imt.stackpilot.stackpilot.business.port.HealthcheckPort;
import fr.imt.stackpilot.stackpilot.exception.ContainerExecutionException;
import fr.imt.stackpilot.stackpilot.exception.ContainerFailureKind;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Polls the repository's healthcheck URL until it answers with the expected status.
 */
@Component
@Slf4j
public class HealthcheckStep implements DeploymentStep {

    private static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(2);

    private final HealthcheckPort healthcheckPort;
    private final Duration retryInterval;

    @Autowired
    public HealthcheckStep(HealthcheckPort healthcheckPort) {
        this(healthcheckPort, DEFAULT_RETRY_INTERVAL);
    }

    public HealthcheckStep(HealthcheckPort healthcheckPort, Duration retryInterval) {
        this.healthcheckPort = healthcheckPort;
        this.retryInterval = retryInterval;
    }

    @Override
    public DeploymentStepType getType() {
        return DeploymentStepType.HEALTHCHECK;
    }

    @Override
    public boolean appliesTo(GitRepository repository) {
        return repository.getHealthcheckUrl() != null && !repository.getHealthcheckUrl().isBlank();
    }

    @Override
    public void execute(DeploymentContext context) {
        GitRepository repository = context.getRepository();
        String url = repository.getHealthcheckUrl();
        int expected = repository.getHealthcheckExpectedStatus();
        int timeoutSeconds = repository.getHealthcheckTimeoutSeconds();
        Instant deadline = Instant.now().plusSeconds(timeoutSeconds);

        context.log(getType(), "Starting healthcheck on " + url + " (timeout: " + timeoutSeconds + "s)");

        int lastStatus;
        do {
            lastStatus = healthcheckPort.statusOf(url);
            if (lastStatus == expected) {
                context.log(getType(), "Healthcheck passed: " + url + " returned " + lastStatus);
                return;
            }
            if (!sleep()) {
                break;
            }
        } while (Instant.now().isBefore(deadline));

        log.warn("Healthcheck of {} failed, last status {}", repository.getId(), lastStatus);
        throw new ContainerExecutionException(ContainerFailureKind.UNHEALTHY, String.format(
                "Healthcheck failed: %s did not return %d within %ds (last status %d)",
                url, expected, timeoutSeconds, lastStatus));
    }

    private boolean sleep() {
        try {
            Thread.sleep(retryInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
