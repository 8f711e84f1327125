package fr.imt.stackpilot.stackpilot.configuration;

import fr.imt.stackpilot.stackpilot.exception.GitOperationException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfiguration {

    /**
     * Retries git network operations. Callers mark non-transient failures as exhausted.
     */
    @Bean
    public RetryTemplate gitRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(3)
                .exponentialBackoff(1000, 2, 5000)
                .retryOn(GitOperationException.class)
                .build();
    }
}
