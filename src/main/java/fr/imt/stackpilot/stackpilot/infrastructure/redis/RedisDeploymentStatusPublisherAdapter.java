package fr.imt.stackpilot.stackpilot.infrastructure.redis;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.business.port.DeploymentStatusPublisherPort;
import fr.imt.stackpilot.stackpilot.configuration.RedisConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class RedisDeploymentStatusPublisherAdapter implements DeploymentStatusPublisherPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publish(Long deploymentId, String repositoryId, DeploymentStatus status) {
        try {
            String message = String.format("%d|%s|%s", deploymentId, repositoryId, status.name());
            redisTemplate.convertAndSend(RedisConfiguration.DEPLOYMENT_STATUS_TOPIC, message);
        } catch (Exception e) {
            log.error("Failed to publish status {} for deployment {}", status, deploymentId, e);
        }
    }
}
