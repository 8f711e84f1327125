package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.port.GitRepositoryPort;
import fr.imt.stackpilot.stackpilot.business.port.ProjectRepositoryPort;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties.ProjectDefinition;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties.RepositoryDefinition;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Project;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mirrors the configured projects and repositories into the store at startup.
 * <p>
 * Credentials are resolved per repository in this order: the repository token, the project token
 * matching the Git host ({@code github}, {@code gitlab}), the project {@code default} token, the
 * project's only token, and finally the global GitHub token for github.com URLs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigSyncService {

    private final StackpilotProperties properties;
    private final ProjectRepositoryPort projectRepositoryPort;
    private final GitRepositoryPort gitRepositoryPort;

    public record SyncReport(int projects, int created, int updated, int deleted, int skipped) {
    }

    public SyncReport sync() {
        Set<String> conflictingPaths = findConflictingLocalPaths();
        Set<String> configuredIds = new HashSet<>();
        for (ProjectDefinition project : properties.getProjects()) {
            for (RepositoryDefinition definition : project.getRepositories()) {
                if (!conflictingPaths.contains(localPathOf(project, definition))) {
                    configuredIds.add(GitRepository.idOf(project.getName(), definition.getName()));
                }
            }
        }

        // Stale entries go first so their local paths can be reused
        int deleted = 0;
        for (GitRepository stored : gitRepositoryPort.findAll()) {
            if (!configuredIds.contains(stored.getId())) {
                log.info("Removing repository {} which is no longer configured", stored.getId());
                gitRepositoryPort.deleteById(stored.getId());
                deleted++;
            }
        }

        int created = 0;
        int updated = 0;
        int skipped = 0;
        for (ProjectDefinition projectDefinition : properties.getProjects()) {
            syncProject(projectDefinition);

            for (RepositoryDefinition definition : projectDefinition.getRepositories()) {
                String id = GitRepository.idOf(projectDefinition.getName(), definition.getName());
                String localPath = localPathOf(projectDefinition, definition);

                if (conflictingPaths.contains(localPath)) {
                    log.error("Skipping {}: local path {} is shared with another repository", id, localPath);
                    skipped++;
                    continue;
                }

                GitRepository existing = gitRepositoryPort.findById(id).orElse(null);
                gitRepositoryPort.save(toRepository(projectDefinition, definition, localPath, existing));
                if (existing == null) {
                    created++;
                } else {
                    updated++;
                }
            }
        }

        SyncReport report = new SyncReport(properties.getProjects().size(), created, updated, deleted, skipped);
        log.info("Configuration synced: {}", report);
        return report;
    }

    private void syncProject(ProjectDefinition definition) {
        Instant now = Instant.now();
        Project project = projectRepositoryPort.findByName(definition.getName())
                .orElseGet(() -> Project.builder().name(definition.getName()).createdAt(now).build());
        project.setDescription(definition.getDescription());
        project.setTokens(new HashMap<>(definition.getTokens()));
        project.setSuccessNotifications(new ArrayList<>(definition.getNotifications().getSuccess()));
        project.setFailureNotifications(new ArrayList<>(definition.getNotifications().getFailure()));
        project.setUpdatedAt(now);
        projectRepositoryPort.save(project);
    }

    private GitRepository toRepository(ProjectDefinition project, RepositoryDefinition definition,
                                       String localPath, GitRepository existing) {
        String lastCommitHash = null;
        Instant createdAt = Instant.now();

        if (existing != null) {
            createdAt = existing.getCreatedAt() != null ? existing.getCreatedAt() : createdAt;
            boolean sourceChanged = !Objects.equals(existing.getGitUrl(), definition.getUrl())
                    || !Objects.equals(existing.getBranch(), definition.getBranch());
            if (sourceChanged) {
                log.info("Source of {} changed, resetting its working directory", existing.getId());
                deleteWorkingDirectory(existing);
            } else {
                lastCommitHash = existing.getLastCommitHash();
            }
        }

        return GitRepository.builder()
                .id(GitRepository.idOf(project.getName(), definition.getName()))
                .name(definition.getName())
                .projectName(project.getName())
                .gitUrl(definition.getUrl())
                .branch(definition.getBranch())
                .path(definition.getPath())
                .localPath(localPath)
                .token(resolveToken(project, definition))
                .checkIntervalSeconds(definition.getCheckInterval())
                .priority(definition.getPriority())
                .dependsOn(new ArrayList<>(definition.getDependsOn()))
                .envFile(definition.getEnvFile())
                .healthcheckUrl(definition.getHealthcheckUrl())
                .healthcheckTimeoutSeconds(definition.getHealthcheckTimeout())
                .healthcheckExpectedStatus(definition.getHealthcheckExpectedStatus())
                .successNotifications(merge(definition.getNotifications().getSuccess(),
                        project.getNotifications().getSuccess()))
                .failureNotifications(merge(definition.getNotifications().getFailure(),
                        project.getNotifications().getFailure()))
                .lastCommitHash(lastCommitHash)
                .createdAt(createdAt)
                .build();
    }

    String resolveToken(ProjectDefinition project, RepositoryDefinition definition) {
        if (StringUtils.hasText(definition.getToken())) {
            return definition.getToken();
        }

        String url = definition.getUrl().toLowerCase();
        Map<String, String> tokens = project.getTokens();
        if (tokens != null && !tokens.isEmpty()) {
            if (url.contains("github") && tokens.containsKey("github")) {
                return tokens.get("github");
            }
            if (url.contains("gitlab") && tokens.containsKey("gitlab")) {
                return tokens.get("gitlab");
            }
            if (tokens.containsKey("default")) {
                return tokens.get("default");
            }
            if (tokens.size() == 1) {
                return tokens.values().iterator().next();
            }
        }

        String githubToken = properties.getGit().getGithubToken();
        if (StringUtils.hasText(githubToken) && url.contains("github.com")) {
            return githubToken;
        }
        return null;
    }

    private Set<String> findConflictingLocalPaths() {
        Map<String, Integer> usage = new HashMap<>();
        for (ProjectDefinition project : properties.getProjects()) {
            for (RepositoryDefinition definition : project.getRepositories()) {
                usage.merge(localPathOf(project, definition), 1, Integer::sum);
            }
        }
        Set<String> conflicts = new HashSet<>();
        usage.forEach((path, count) -> {
            if (count > 1) {
                conflicts.add(path);
            }
        });
        return conflicts;
    }

    private String localPathOf(ProjectDefinition project, RepositoryDefinition definition) {
        Path path = StringUtils.hasText(definition.getLocalPath())
                ? Path.of(definition.getLocalPath())
                : Path.of(properties.getWorkspacePath(), project.getName(), definition.getName());
        return path.toAbsolutePath().normalize().toString();
    }

    private void deleteWorkingDirectory(GitRepository repository) {
        try {
            FileSystemUtils.deleteRecursively(repository.localWorkingPath());
        } catch (IOException e) {
            log.warn("Cannot delete working directory of {}: {}", repository.getId(), e.getMessage());
        }
    }

    private static List<String> merge(List<String> own, List<String> defaults) {
        Set<String> merged = new LinkedHashSet<>(own);
        merged.addAll(defaults);
        return new ArrayList<>(merged);
    }
}
