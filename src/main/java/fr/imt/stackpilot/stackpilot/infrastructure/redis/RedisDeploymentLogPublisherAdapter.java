package fr.imt.stackpilot.stackpilot.infrastructure.redis;

import fr.imt.stackpilot.stackpilot.business.port.DeploymentLogPublisherPort;
import fr.imt.stackpilot.stackpilot.configuration.RedisConfiguration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class RedisDeploymentLogPublisherAdapter implements DeploymentLogPublisherPort {

    private final StringRedisTemplate redisTemplate;

    @Override
    public void publish(Long deploymentId, String message) {
        try {
            redisTemplate.convertAndSend(RedisConfiguration.DEPLOYMENT_LOGS_TOPIC, deploymentId + "|" + message);
        } catch (Exception e) {
            log.debug("Failed to mirror log line of deployment {}: {}", deploymentId, e.getMessage());
        }
    }
}
