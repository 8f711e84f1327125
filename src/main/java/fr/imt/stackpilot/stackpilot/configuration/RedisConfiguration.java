package fr.imt.stackpilot.stackpilot.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfiguration {

    public static final String DEPLOYMENT_LOGS_TOPIC = "deployment-logs";
    public static final String DEPLOYMENT_STATUS_TOPIC = "deployment-status";

    @Bean
    StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }
}
