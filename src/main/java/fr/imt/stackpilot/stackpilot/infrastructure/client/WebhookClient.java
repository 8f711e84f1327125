package fr.imt.stackpilot.stackpilot.infrastructure.client;

import fr.imt.stackpilot.stackpilot.infrastructure.notification.WebhookPayload;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.net.URI;

/**
 * Posts deployment notifications to generic HTTP webhooks. The target URI is given per call.
 */
@FeignClient(name = "webhookClient", url = "http://localhost")
public interface WebhookClient {

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    void post(URI target, @RequestBody WebhookPayload payload);

}
