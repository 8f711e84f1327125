package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentRequest;
import fr.imt.stackpilot.stackpilot.business.model.EnqueueResult;
import fr.imt.stackpilot.stackpilot.business.port.GitPort;
import fr.imt.stackpilot.stackpilot.business.port.GitRepositoryPort;
import fr.imt.stackpilot.stackpilot.exception.GitOperationException;
import fr.imt.stackpilot.stackpilot.exception.QueueRejectedException;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically asks the queue to deploy every repository. Whether there is anything new is
 * decided by the deployment itself, so a tick only records the observed remote hash when the
 * repository is already checked out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepositoryPoller {

    private final TaskScheduler taskScheduler;
    private final GitRepositoryPort gitRepositoryPort;
    private final GitPort gitPort;
    private final DeploymentQueue deploymentQueue;

    private final Map<String, ScheduledFuture<?>> scheduledPolls = new ConcurrentHashMap<>();

    public void scheduleAll() {
        for (GitRepository repository : gitRepositoryPort.findAll()) {
            schedule(repository);
        }
        log.info("Polling {} repositories", scheduledPolls.size());
    }

    /**
     * Schedules the polls of a repository, replacing an earlier schedule. The fixed delay keeps
     * ticks of one repository from overlapping.
     */
    public void schedule(GitRepository repository) {
        cancel(repository.getId());
        Duration interval = Duration.ofSeconds(repository.getCheckIntervalSeconds());
        ScheduledFuture<?> future = taskScheduler.scheduleWithFixedDelay(
                () -> poll(repository.getId()), Instant.now(), interval);
        scheduledPolls.put(repository.getId(), future);
        log.debug("Polling {} every {}s", repository.getId(), interval.toSeconds());
    }

    public void cancel(String repositoryId) {
        ScheduledFuture<?> previous = scheduledPolls.remove(repositoryId);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    public void stop() {
        scheduledPolls.keySet().forEach(this::cancel);
        log.info("Repository polling stopped");
    }

    public boolean isScheduled(String repositoryId) {
        return scheduledPolls.containsKey(repositoryId);
    }

    /**
     * One poll tick. Never throws, so a failing tick does not end the schedule.
     */
    public void poll(String repositoryId) {
        GitRepository repository = gitRepositoryPort.findById(repositoryId).orElse(null);
        if (repository == null) {
            log.info("Repository {} no longer configured, stopping its polls", repositoryId);
            cancel(repositoryId);
            return;
        }

        String observedHash = null;
        if (Files.isDirectory(repository.localWorkingPath().resolve(".git"))) {
            try {
                observedHash = gitPort.remoteHash(repository.localWorkingPath(), repository.getBranch(),
                        repository.getGitUrl(), repository.getToken());
            } catch (GitOperationException e) {
                log.warn("[POLL] {}: cannot read remote hash ({}): {}", repositoryId, e.getKind(), e.getMessage());
            }
        }

        try {
            EnqueueResult result = deploymentQueue.enqueue(
                    DeploymentRequest.poll(repositoryId, repository.getPriority(), observedHash));
            log.debug("[POLL] {} at {}: {}", repositoryId, observedHash, result);
        } catch (QueueRejectedException e) {
            log.debug("[POLL] {} skipped: {}", repositoryId, e.getReason());
        } catch (RuntimeException e) {
            log.error("[POLL] {} failed", repositoryId, e);
        }
    }
}
