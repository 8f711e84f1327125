package fr.imt.stackpilot.stackpilot.infrastructure.client;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;

import java.net.URI;

/**
 * Calls healthcheck endpoints. The target URI is given per call; the client URL is only a placeholder.
 */
@FeignClient(name = "healthcheckClient", url = "http://localhost")
public interface HealthcheckClient {

    @GetMapping
    ResponseEntity<Void> get(URI target);

}
