package fr.imt.stackpilot.stackpilot.infrastructure.client;

import feign.FeignException;
import fr.imt.stackpilot.stackpilot.business.port.HealthcheckPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;

@Slf4j
@Component
@RequiredArgsConstructor
public class FeignHealthcheckAdapter implements HealthcheckPort {

    private final HealthcheckClient healthcheckClient;

    @Override
    public int statusOf(String url) {
        try {
            return healthcheckClient.get(URI.create(url)).getStatusCode().value();
        } catch (FeignException e) {
            // status() is -1 when no response was received
            log.debug("Healthcheck of {} answered {}: {}", url, e.status(), e.getMessage());
            return e.status();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid healthcheck URL {}: {}", url, e.getMessage());
            return -1;
        }
    }
}
