package fr.imt.stackpilot.stackpilot.infrastructure.git;

import fr.imt.stackpilot.stackpilot.business.model.ProcessResult;
import fr.imt.stackpilot.stackpilot.business.port.GitPort;
import fr.imt.stackpilot.stackpilot.business.utils.NameSanitizer;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.GitFailureKind;
import fr.imt.stackpilot.stackpilot.exception.GitOperationException;
import fr.imt.stackpilot.stackpilot.infrastructure.ProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link GitPort} backed by the git command line. Credentials are passed in the fetch URL only and
 * never persisted in the checkout's remote configuration.
 */
@Slf4j
@Component
public class GitCliAdapter implements GitPort {

    private static final Map<String, String> GIT_ENV = Map.of(
            "GIT_TERMINAL_PROMPT", "0",
            "GIT_ASKPASS", "echo");

    private static final List<String> AUTH_MARKERS = List.of(
            "authentication failed", "could not read username", "could not read password",
            "permission denied", "invalid username or password", "http basic: access denied",
            "the requested url returned error: 403", "the requested url returned error: 401");
    private static final List<String> NETWORK_MARKERS = List.of(
            "could not resolve host", "unable to access", "timed out", "connection refused",
            "network is unreachable", "failed to connect", "early eof", "the remote end hung up");
    private static final List<String> CONFLICT_MARKERS = List.of(
            "conflict", "would be overwritten", "not possible to fast-forward", "unmerged files");
    private static final List<String> CORRUPTION_MARKERS = List.of(
            "not a git repository", "corrupt", "bad object", "index.lock", "loose object", "broken");

    private final ProcessRunner processRunner;
    private final RetryTemplate gitRetryTemplate;
    private final Duration timeout;
    private final Duration remoteHashCacheTtl;

    private final Map<String, CachedHash> remoteHashCache = new ConcurrentHashMap<>();

    private record CachedHash(String hash, long fetchedAtNanos) {
    }

    public GitCliAdapter(ProcessRunner processRunner,
                         @Qualifier("gitRetryTemplate") RetryTemplate gitRetryTemplate,
                         StackpilotProperties properties) {
        this.processRunner = processRunner;
        this.gitRetryTemplate = gitRetryTemplate;
        this.timeout = properties.getDeploy().getGitTimeout();
        this.remoteHashCacheTtl = properties.getGit().getRemoteHashCacheTtl();
    }

    @Override
    public String clone(String url, String branch, Path destination, String credential) {
        try {
            Files.createDirectories(destination.getParent());
        } catch (IOException e) {
            throw new GitOperationException(GitFailureKind.CORRUPTED,
                    "Cannot create parent directory of " + destination, e);
        }
        log.info("Cloning {} (branch {}) into {}", NameSanitizer.maskCredentials(url), branch, destination);

        withRetry(() -> git(destination.getParent(), GitFailureKind.NETWORK,
                "clone", "--branch", branch, "--single-branch", authenticatedUrl(url, credential),
                destination.toString()));
        git(destination, GitFailureKind.CORRUPTED, "remote", "set-url", "origin", url);
        return localHash(destination);
    }

    @Override
    public String remoteHash(Path destination, String branch, String url, String credential) {
        String cacheKey = destination + "#" + branch;
        CachedHash cached = remoteHashCache.get(cacheKey);
        if (cached != null && System.nanoTime() - cached.fetchedAtNanos() < remoteHashCacheTtl.toNanos()) {
            return cached.hash();
        }

        fetch(destination, branch, url, credential);
        String hash = revParse(destination, "refs/remotes/origin/" + branch);
        remoteHashCache.put(cacheKey, new CachedHash(hash, System.nanoTime()));
        return hash;
    }

    @Override
    public String localHash(Path destination) {
        return revParse(destination, "HEAD");
    }

    @Override
    public String pull(Path destination, String branch, String url, String credential) {
        fetch(destination, branch, url, credential);
        git(destination, GitFailureKind.CONFLICT, "checkout", "-B", branch, "refs/remotes/origin/" + branch);
        git(destination, GitFailureKind.CONFLICT, "reset", "--hard", "refs/remotes/origin/" + branch);
        git(destination, GitFailureKind.CONFLICT, "clean", "-fd");
        return localHash(destination);
    }

    private void fetch(Path destination, String branch, String url, String credential) {
        String remote = credential != null && !credential.isBlank() ? authenticatedUrl(url, credential) : "origin";
        withRetry(() -> git(destination, GitFailureKind.NETWORK,
                "fetch", "--prune", remote, "+refs/heads/" + branch + ":refs/remotes/origin/" + branch));
    }

    private String revParse(Path destination, String ref) {
        String output = git(destination, GitFailureKind.CORRUPTED, "rev-parse", ref).trim();
        String[] lines = output.split("\\R");
        return lines[lines.length - 1].trim();
    }

    private String withRetry(GitCommand command) {
        return gitRetryTemplate.execute(context -> {
            try {
                return command.run();
            } catch (GitOperationException e) {
                if (e.getKind() != GitFailureKind.NETWORK) {
                    context.setExhaustedOnly();
                } else {
                    log.warn("Git network failure (attempt {}): {}", context.getRetryCount() + 1, e.getMessage());
                }
                throw e;
            }
        });
    }

    private String git(Path workingDirectory, GitFailureKind defaultKind, String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        String operation = args[0];

        ProcessResult result;
        try {
            result = processRunner.run(command, workingDirectory, GIT_ENV, timeout, null);
        } catch (IOException e) {
            throw new GitOperationException(GitFailureKind.CORRUPTED,
                    "Cannot run git " + operation + ": " + e.getMessage(), e);
        }

        if (result.timedOut()) {
            throw new GitOperationException(GitFailureKind.NETWORK,
                    "git " + operation + " timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            String output = NameSanitizer.maskCredentials(result.output());
            throw new GitOperationException(classify(output, defaultKind),
                    "git " + operation + " failed (exit " + result.exitCode() + "): " + output);
        }
        return result.output();
    }

    static GitFailureKind classify(String output, GitFailureKind defaultKind) {
        String text = output == null ? "" : output.toLowerCase(Locale.ROOT);
        if (containsAny(text, AUTH_MARKERS)) {
            return GitFailureKind.AUTH;
        }
        if (containsAny(text, NETWORK_MARKERS)) {
            return GitFailureKind.NETWORK;
        }
        if (containsAny(text, CONFLICT_MARKERS)) {
            return GitFailureKind.CONFLICT;
        }
        if (containsAny(text, CORRUPTION_MARKERS)) {
            return GitFailureKind.CORRUPTED;
        }
        return defaultKind;
    }

    /**
     * Embeds {@code credential} in an HTTPS URL. Other URLs are returned unchanged.
     */
    static String authenticatedUrl(String url, String credential) {
        if (credential == null || credential.isBlank()) {
            return url;
        }
        for (String scheme : List.of("https://", "http://")) {
            if (url.startsWith(scheme)) {
                String rest = url.substring(scheme.length());
                int at = rest.indexOf('@');
                int slash = rest.indexOf('/');
                if (at >= 0 && (slash < 0 || at < slash)) {
                    rest = rest.substring(at + 1);
                }
                return scheme + credential + "@" + rest;
            }
        }
        return url;
    }

    private static boolean containsAny(String text, List<String> markers) {
        return markers.stream().anyMatch(text::contains);
    }

    @FunctionalInterface
    private interface GitCommand {
        String run();
    }
}
