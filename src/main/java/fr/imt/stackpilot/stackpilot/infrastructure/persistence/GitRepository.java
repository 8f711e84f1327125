package fr.imt.stackpilot.stackpilot.infrastructure.persistence;

import fr.imt.stackpilot.stackpilot.business.utils.NameSanitizer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A deployable unit: one Git-tracked compose stack.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "repositories")
public class GitRepository {

    // "<project>/<name>"
    @Id
    private String id;

    private String name;

    @Indexed
    private String projectName;

    private String gitUrl;

    @Builder.Default
    private String branch = "main";

    // Sub-directory holding the compose file, relative to localPath
    @Builder.Default
    private String path = "./";

    @Indexed(unique = true)
    private String localPath;

    // Resolved credential, never logged
    private String token;

    @Builder.Default
    private long checkIntervalSeconds = 300;

    @Builder.Default
    private int priority = 0;

    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    private String envFile;

    private String healthcheckUrl;

    @Builder.Default
    private int healthcheckTimeoutSeconds = 60;

    @Builder.Default
    private int healthcheckExpectedStatus = 200;

    // Project defaults already merged in
    @Builder.Default
    private List<String> successNotifications = new ArrayList<>();

    @Builder.Default
    private List<String> failureNotifications = new ArrayList<>();

    private String lastCommitHash;

    private Instant createdAt;

    public static String idOf(String projectName, String repositoryName) {
        return projectName + "/" + repositoryName;
    }

    public Path localWorkingPath() {
        return Path.of(localPath).toAbsolutePath().normalize();
    }

    /**
     * Directory the compose file lives in.
     */
    public Path composeDirectory() {
        Path root = localWorkingPath();
        if (path == null || path.isBlank()) {
            return root;
        }
        return root.resolve(path).normalize();
    }

    /**
     * Compose project name used to label this repository's containers.
     */
    public String composeProjectName() {
        return "stackpilot_" + NameSanitizer.sanitizeDirectoryName(id).toLowerCase();
    }

    /**
     * Dependency references resolved to repository identifiers. Bare names refer to the same project.
     */
    public List<String> dependencyIds() {
        if (dependsOn == null) {
            return List.of();
        }
        return dependsOn.stream()
                .map(dep -> dep.contains("/") ? dep : idOf(projectName, dep))
                .toList();
    }
}
