package fr.imt.stackpilot.stackpilot.infrastructure.redis;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.configuration.RedisConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisPublisherAdapterTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Test
    void statusMessageCarriesDeploymentAndRepository() {
        new RedisDeploymentStatusPublisherAdapter(redisTemplate).publish(12L, "home/api", DeploymentStatus.RUNNING);

        verify(redisTemplate).convertAndSend(RedisConfiguration.DEPLOYMENT_STATUS_TOPIC, "12|home/api|RUNNING");
    }

    @Test
    void logLineIsPrefixedWithDeploymentId() {
        new RedisDeploymentLogPublisherAdapter(redisTemplate).publish(12L, "[PULL] Pulling branch main");

        verify(redisTemplate).convertAndSend(RedisConfiguration.DEPLOYMENT_LOGS_TOPIC, "12|[PULL] Pulling branch main");
    }

    @Test
    void brokerOutageIsNotPropagated() {
        when(redisTemplate.convertAndSend(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("Unable to connect to Redis"));

        assertThatCode(() -> new RedisDeploymentStatusPublisherAdapter(redisTemplate)
                .publish(12L, "home/api", DeploymentStatus.FAILED)).doesNotThrowAnyException();
        assertThatCode(() -> new RedisDeploymentLogPublisherAdapter(redisTemplate)
                .publish(12L, "line")).doesNotThrowAnyException();
    }
}
