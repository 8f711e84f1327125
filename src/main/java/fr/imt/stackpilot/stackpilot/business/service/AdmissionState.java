package fr.imt.stackpilot.stackpilot.business.service;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentRequest;
import fr.imt.stackpilot.stackpilot.business.model.EnqueueResult;
import fr.imt.stackpilot.stackpilot.business.model.TriggerReason;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Pending candidates, locked projects and running repositories of the deployment queue.
 * Not thread-safe: every call happens under the queue's lock.
 */
final class AdmissionState {

    /**
     * A pending request with what admission needs to know about its repository.
     */
    record Candidate(DeploymentRequest request, String projectName, List<String> dependencyIds, long sequence) {

        String repositoryId() {
            return request.repositoryId();
        }
    }

    private static final Comparator<Candidate> ADMISSION_ORDER = Comparator
            .comparingInt((Candidate c) -> c.request().priority()).reversed()
            .thenComparingLong(Candidate::sequence);

    private final List<Candidate> candidates = new ArrayList<>();
    private final Set<String> lockedProjects = new HashSet<>();
    private final Set<String> runningRepositories = new HashSet<>();
    private long nextSequence;

    /**
     * Adds a request, or replaces the pending one of the same repository. A replacement keeps the
     * older position and the higher priority of the two.
     */
    EnqueueResult offer(DeploymentRequest request, String projectName, List<String> dependencyIds) {
        for (int i = 0; i < candidates.size(); i++) {
            Candidate pending = candidates.get(i);
            if (pending.repositoryId().equals(request.repositoryId())) {
                candidates.set(i, new Candidate(merge(pending.request(), request), projectName, dependencyIds,
                        pending.sequence()));
                candidates.sort(ADMISSION_ORDER);
                return EnqueueResult.SUPERSEDED;
            }
        }
        candidates.add(new Candidate(request, projectName, dependencyIds, nextSequence++));
        candidates.sort(ADMISSION_ORDER);
        return EnqueueResult.ACCEPTED;
    }

    /**
     * Removes and admits the first candidate whose project is free and whose dependencies are met,
     * locking its project.
     */
    Optional<Candidate> admitNext(Predicate<Candidate> dependenciesSatisfied) {
        for (Candidate candidate : candidates) {
            if (lockedProjects.contains(candidate.projectName())) {
                continue;
            }
            if (!dependenciesSatisfied.test(candidate)) {
                continue;
            }
            candidates.remove(candidate);
            lockedProjects.add(candidate.projectName());
            runningRepositories.add(candidate.repositoryId());
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    /**
     * Candidates whose project is free, in admission order.
     */
    List<Candidate> unlockedCandidates() {
        return candidates.stream()
                .filter(c -> !lockedProjects.contains(c.projectName()))
                .toList();
    }

    void release(Candidate candidate) {
        lockedProjects.remove(candidate.projectName());
        runningRepositories.remove(candidate.repositoryId());
    }

    boolean isPending(String repositoryId) {
        return candidates.stream().anyMatch(c -> c.repositoryId().equals(repositoryId));
    }

    boolean isRunning(String repositoryId) {
        return runningRepositories.contains(repositoryId);
    }

    boolean isProjectLocked(String projectName) {
        return lockedProjects.contains(projectName);
    }

    int pendingCount() {
        return candidates.size();
    }

    List<Candidate> drain() {
        List<Candidate> drained = List.copyOf(candidates);
        candidates.clear();
        return drained;
    }

    private static DeploymentRequest merge(DeploymentRequest older, DeploymentRequest newer) {
        TriggerReason trigger = older.trigger() == TriggerReason.MANUAL ? TriggerReason.MANUAL : newer.trigger();
        return new DeploymentRequest(newer.repositoryId(), trigger, newer.enqueuedAt(),
                Math.max(older.priority(), newer.priority()), newer.observedHash());
    }
}
