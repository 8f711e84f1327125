package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.ConcurrencyPolicy;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentRequest;
import fr.imt.stackpilot.stackpilot.business.model.DeploymentStatus;
import fr.imt.stackpilot.stackpilot.business.model.EnqueueResult;
import fr.imt.stackpilot.stackpilot.business.model.TriggerResult;
import fr.imt.stackpilot.stackpilot.business.port.DeploymentRepositoryPort;
import fr.imt.stackpilot.stackpilot.business.port.GitRepositoryPort;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.QueueRejectedException;
import fr.imt.stackpilot.stackpilot.exception.RepositoryNotFoundException;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.Deployment;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admits deployment requests to a fixed pool of workers.
 * <p>
 * At most one request per repository is pending at any time; a newer request replaces it. A
 * candidate is admitted when no deployment of its project is running and the latest deployment of
 * each of its dependencies succeeded. Among admissible candidates the highest priority wins, then
 * the oldest. Admission is re-evaluated whenever a request arrives or a deployment finishes, and
 * at least every {@code dependency-recheck-interval}.
 * <p>
 * Dependency statuses are read from the stores without holding the queue lock. Admission then
 * re-takes the lock and only admits candidates that are still pending and whose project is still free.
 */
@Slf4j
@Service
public class DeploymentQueue {

    private final GitRepositoryPort gitRepositoryPort;
    private final DeploymentRepositoryPort deploymentRepositoryPort;
    private final DeploymentExecutor deploymentExecutor;
    private final Duration recheckInterval;
    private final Duration stopGracePeriod;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition admissionChanged = lock.newCondition();
    private final AdmissionState state = new AdmissionState();

    private ExecutorService workers;
    private boolean stopped;
    // Bumped on every change that can make another candidate admissible
    private long admissionVersion;

    public DeploymentQueue(GitRepositoryPort gitRepositoryPort,
                           DeploymentRepositoryPort deploymentRepositoryPort,
                           DeploymentExecutor deploymentExecutor,
                           StackpilotProperties properties) {
        this.gitRepositoryPort = gitRepositoryPort;
        this.deploymentRepositoryPort = deploymentRepositoryPort;
        this.deploymentExecutor = deploymentExecutor;
        this.recheckInterval = properties.getDeploy().getDependencyRecheckInterval();
        this.stopGracePeriod = properties.getDeploy().getStopGracePeriod();
    }

    public void start(ConcurrencyPolicy policy) {
        lock.lock();
        try {
            if (workers != null) {
                throw new IllegalStateException("Deployment queue already started");
            }
            if (stopped) {
                throw new IllegalStateException("Deployment queue was stopped");
            }
            workers = Executors.newFixedThreadPool(policy.maxWorkers(), new WorkerThreadFactory());
            for (int i = 0; i < policy.maxWorkers(); i++) {
                workers.execute(this::workerLoop);
            }
        } finally {
            lock.unlock();
        }
        log.info("Deployment queue started ({}, {} worker(s))", policy.mode(), policy.maxWorkers());
    }

    /**
     * Stops admitting work and drops pending requests. Waits up to the grace period for running
     * deployments; those still running afterwards are left to finish on their own and are never
     * interrupted.
     */
    public void stop() {
        ExecutorService pool;
        List<AdmissionState.Candidate> dropped;
        lock.lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            dropped = state.drain();
            pool = workers;
            admissionVersion++;
            admissionChanged.signalAll();
        } finally {
            lock.unlock();
        }

        if (!dropped.isEmpty()) {
            log.warn("Dropping {} pending deployment request(s): {}", dropped.size(),
                    dropped.stream().map(AdmissionState.Candidate::repositoryId).toList());
        }
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(stopGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Deployments still running after {}, letting them finish in the background",
                        stopGracePeriod);
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for running deployments, letting them finish in the background");
            return;
        }
        log.info("Deployment queue stopped");
    }

    public EnqueueResult enqueue(DeploymentRequest request) {
        GitRepository repository = gitRepositoryPort.findById(request.repositoryId())
                .orElseThrow(() -> new RepositoryNotFoundException(request.repositoryId()));

        EnqueueResult result;
        lock.lock();
        try {
            if (stopped) {
                throw new QueueRejectedException(QueueRejectedException.Reason.STOPPED, request.repositoryId());
            }
            result = state.offer(request, repository.getProjectName(), repository.dependencyIds());
            admissionVersion++;
            admissionChanged.signalAll();
        } finally {
            lock.unlock();
        }

        log.debug("Enqueued {} request for {} (priority {}): {}",
                request.trigger(), request.repositoryId(), request.priority(), result);
        return result;
    }

    /**
     * Manual deployment entry point.
     */
    public TriggerResult triggerDeploy(String repositoryId, int priority) {
        EnqueueResult result = enqueue(DeploymentRequest.manual(repositoryId, priority));
        log.info("Manual deployment of {} requested: {}", repositoryId, result);
        return result == EnqueueResult.SUPERSEDED ? TriggerResult.ALREADY_PENDING : TriggerResult.ACCEPTED;
    }

    public boolean isPending(String repositoryId) {
        lock.lock();
        try {
            return state.isPending(repositoryId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning(String repositoryId) {
        lock.lock();
        try {
            return state.isRunning(repositoryId);
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return state.pendingCount();
        } finally {
            lock.unlock();
        }
    }

    private void workerLoop() {
        while (true) {
            AdmissionState.Candidate candidate;
            try {
                candidate = awaitAdmission();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (candidate == null) {
                return;
            }
            dispatch(candidate);
        }
    }

    // Returns null once the queue is stopped
    private AdmissionState.Candidate awaitAdmission() throws InterruptedException {
        while (true) {
            List<AdmissionState.Candidate> waiting;
            long version;
            lock.lock();
            try {
                if (stopped) {
                    return null;
                }
                waiting = state.unlockedCandidates();
                version = admissionVersion;
                if (waiting.stream().allMatch(c -> c.dependencyIds().isEmpty())) {
                    Optional<AdmissionState.Candidate> admitted = state.admitNext(c -> true);
                    if (admitted.isPresent()) {
                        return admitted.get();
                    }
                    admissionChanged.await(recheckInterval.toMillis(), TimeUnit.MILLISECONDS);
                    continue;
                }
            } finally {
                lock.unlock();
            }

            Set<String> ready = readyRepositories(waiting);

            lock.lock();
            try {
                if (stopped) {
                    return null;
                }
                Optional<AdmissionState.Candidate> admitted = state.admitNext(
                        c -> c.dependencyIds().isEmpty() || ready.contains(c.repositoryId()));
                if (admitted.isPresent()) {
                    return admitted.get();
                }
                if (admissionVersion == version) {
                    admissionChanged.await(recheckInterval.toMillis(), TimeUnit.MILLISECONDS);
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private void dispatch(AdmissionState.Candidate candidate) {
        log.info("Dispatching deployment of {} ({} trigger, priority {})", candidate.repositoryId(),
                candidate.request().trigger(), candidate.request().priority());
        try {
            deploymentExecutor.execute(candidate.request());
        } catch (RuntimeException e) {
            log.error("Deployment of {} aborted", candidate.repositoryId(), e);
        } finally {
            lock.lock();
            try {
                state.release(candidate);
                admissionVersion++;
                admissionChanged.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    // Called without the lock; each dependency is looked up once per round
    private Set<String> readyRepositories(List<AdmissionState.Candidate> waiting) {
        Map<String, Boolean> succeeded = new HashMap<>();
        Set<String> ready = new HashSet<>();
        for (AdmissionState.Candidate candidate : waiting) {
            if (candidate.dependencyIds().isEmpty()) {
                continue;
            }
            boolean satisfied = candidate.dependencyIds().stream()
                    .allMatch(dependencyId -> succeeded.computeIfAbsent(dependencyId,
                            id -> dependencySatisfied(candidate, id)));
            if (satisfied) {
                ready.add(candidate.repositoryId());
            }
        }
        return ready;
    }

    private boolean dependencySatisfied(AdmissionState.Candidate candidate, String dependencyId) {
        try {
            if (gitRepositoryPort.findById(dependencyId).isEmpty()) {
                log.warn("{} depends on unknown repository {}, ignoring it", candidate.repositoryId(), dependencyId);
                return true;
            }
            DeploymentStatus latest = deploymentRepositoryPort.findLatestByRepositoryId(dependencyId)
                    .map(Deployment::getStatus)
                    .orElse(null);
            if (latest != DeploymentStatus.SUCCESS) {
                log.debug("{} waits for {} (latest status: {})", candidate.repositoryId(), dependencyId, latest);
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("Cannot check dependency {} of {}: {}", dependencyId, candidate.repositoryId(), e.getMessage());
            return false;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "deploy-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
