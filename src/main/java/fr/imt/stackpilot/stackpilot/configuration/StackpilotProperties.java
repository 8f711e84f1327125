package fr.imt.stackpilot.stackpilot.configuration;

import fr.imt.stackpilot.stackpilot.business.model.ConcurrencyPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings and project definitions bound from the {@code stackpilot} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "stackpilot")
public class StackpilotProperties {

    private static final String NAME_PATTERN = "^[a-zA-Z0-9_-]+$";

    @NotBlank
    private String workspacePath = "./deployments";

    @Valid
    private Deploy deploy = new Deploy();

    @Valid
    private Poll poll = new Poll();

    @Valid
    private Git git = new Git();

    @Valid
    private Sops sops = new Sops();

    @Valid
    private Notifications notifications = new Notifications();

    @Valid
    private List<ProjectDefinition> projects = new ArrayList<>();

    @Data
    public static class Deploy {

        @NotNull
        private ConcurrencyPolicy.Mode policy = ConcurrencyPolicy.Mode.SEQUENTIAL;

        @Min(1)
        private int maxWorkers = 5;

        @NotNull
        private Duration gitTimeout = Duration.ofMinutes(2);

        @NotNull
        private Duration secretsTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration composeTimeout = Duration.ofMinutes(10);

        @NotNull
        private Duration notificationTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration stopGracePeriod = Duration.ofMinutes(5);

        // Upper bound between two readiness evaluations when nothing signals the queue
        @NotNull
        private Duration dependencyRecheckInterval = Duration.ofSeconds(5);

        private boolean pruneImages = false;

        private boolean redeployStoppedStacks = false;

        public ConcurrencyPolicy toConcurrencyPolicy() {
            return policy == ConcurrencyPolicy.Mode.SEQUENTIAL
                    ? ConcurrencyPolicy.sequential()
                    : ConcurrencyPolicy.parallel(maxWorkers);
        }
    }

    @Data
    public static class Poll {
        private boolean enabled = true;
    }

    @Data
    public static class Git {
        private String githubToken;

        @NotNull
        private Duration remoteHashCacheTtl = Duration.ofSeconds(5);
    }

    @Data
    public static class Sops {
        private String ageKeyFile;
    }

    @Data
    public static class Notifications {
        private String shoutrrrBinary = "shoutrrr";
    }

    @Data
    public static class NotificationTargets {
        private List<String> success = new ArrayList<>();
        private List<String> failure = new ArrayList<>();
    }

    @Data
    public static class ProjectDefinition {

        @NotBlank
        @Pattern(regexp = NAME_PATTERN)
        private String name;

        private String description;

        private Map<String, String> tokens = new HashMap<>();

        @Valid
        private NotificationTargets notifications = new NotificationTargets();

        @Valid
        private List<RepositoryDefinition> repositories = new ArrayList<>();
    }

    @Data
    public static class RepositoryDefinition {

        @NotBlank
        @Pattern(regexp = NAME_PATTERN)
        private String name;

        @NotBlank
        private String url;

        @NotBlank
        private String branch = "main";

        @NotBlank
        private String path = "./";

        private String localPath;

        private String token;

        @Min(1)
        private long checkInterval = 300;

        private int priority = 0;

        private List<String> dependsOn = new ArrayList<>();

        private String envFile;

        private String healthcheckUrl;

        @Min(1)
        private int healthcheckTimeout = 60;

        private int healthcheckExpectedStatus = 200;

        @Valid
        private NotificationTargets notifications = new NotificationTargets();
    }
}
