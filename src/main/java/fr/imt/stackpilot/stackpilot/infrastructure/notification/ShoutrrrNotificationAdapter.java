package fr.imt.stackpilot.stackpilot.infrastructure.notification;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentEvent;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentSummary;
import fr.imt.stackpilot.stackpilot.business.model.ProcessResult;
import fr.imt.stackpilot.stackpilot.business.port.NotificationPort;
import fr.imt.stackpilot.stackpilot.business.utils.NameSanitizer;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.NotificationException;
import fr.imt.stackpilot.stackpilot.infrastructure.ProcessRunner;
import fr.imt.stackpilot.stackpilot.infrastructure.client.WebhookClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Delivers notifications to every configured target. Plain {@code http(s)} URLs receive a JSON
 * webhook; any other scheme (slack://, discord://, telegram://, ...) goes through shoutrrr.
 * A failing target is logged and does not prevent delivery to the others.
 */
@Slf4j
@Component
public class ShoutrrrNotificationAdapter implements NotificationPort {

    private final WebhookClient webhookClient;
    private final ProcessRunner processRunner;
    private final String shoutrrrBinary;
    private final Duration timeout;

    public ShoutrrrNotificationAdapter(WebhookClient webhookClient, ProcessRunner processRunner,
                                       StackpilotProperties properties) {
        this.webhookClient = webhookClient;
        this.processRunner = processRunner;
        this.shoutrrrBinary = properties.getNotifications().getShoutrrrBinary();
        this.timeout = properties.getDeploy().getNotificationTimeout();
    }

    @Override
    public void send(List<String> urls, DeploymentEvent event, DeploymentSummary summary) {
        String message = formatMessage(event, summary);
        for (String url : urls) {
            try {
                if (isWebhook(url)) {
                    webhookClient.post(URI.create(url), toPayload(event, summary, message));
                } else {
                    sendWithShoutrrr(url, message);
                }
                log.info("Notification sent to {}", NameSanitizer.maskCredentials(url));
            } catch (RuntimeException e) {
                log.error("Notification to {} failed: {}", NameSanitizer.maskCredentials(url), e.getMessage());
            }
        }
    }

    static String formatMessage(DeploymentEvent event, DeploymentSummary summary) {
        return String.format(Locale.ROOT, "Stackpilot %s - repo=%s status=%s duration=%.1fs deployment_id=%d",
                event.getEventName().toUpperCase(Locale.ROOT),
                summary.repositoryId(),
                summary.status().name().toLowerCase(Locale.ROOT),
                summary.durationSeconds(),
                summary.deploymentId());
    }

    private void sendWithShoutrrr(String url, String message) {
        ProcessResult result;
        try {
            result = processRunner.run(List.of(shoutrrrBinary, "send", "--url", url, "--message", message),
                    null, null, timeout, null);
        } catch (IOException e) {
            throw new NotificationException("Cannot run " + shoutrrrBinary + ": " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new NotificationException(result.timedOut()
                    ? shoutrrrBinary + " timed out"
                    : shoutrrrBinary + " exited with " + result.exitCode() + ": " + result.output());
        }
    }

    private static boolean isWebhook(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static WebhookPayload toPayload(DeploymentEvent event, DeploymentSummary summary, String message) {
        return new WebhookPayload(
                event.getEventName(),
                message,
                summary.deploymentId(),
                summary.repositoryId(),
                summary.projectName(),
                summary.status().name().toLowerCase(Locale.ROOT),
                summary.commitHash(),
                summary.durationSeconds());
    }
}
