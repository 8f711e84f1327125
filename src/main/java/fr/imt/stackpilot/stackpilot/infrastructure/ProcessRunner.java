package fr.imt.stackpilot.stackpilot.infrastructure;

import fr.imt.stackpilot.stackpilot.business.model.ProcessResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs external commands with a time budget, streaming their output line by line.
 */
@Slf4j
@Component
public class ProcessRunner {

    private static final int OUTPUT_TAIL_LINES = 200;
    private static final long READER_JOIN_MILLIS = 2000;

    /**
     * Runs {@code command} with stderr merged into stdout.
     *
     * @param output receives every output line, may be null
     * @throws IOException when the process cannot be started
     */
    public ProcessResult run(List<String> command, Path workingDirectory, Map<String, String> environment,
                             Duration timeout, Consumer<String> output) throws IOException {
        ProcessBuilder pb = builder(command, workingDirectory, environment);
        pb.redirectErrorStream(true);
        return execute(pb, timeout, output);
    }

    /**
     * Runs {@code command} with stdout written to {@code stdoutFile}; the returned output holds stderr only.
     */
    public ProcessResult runToFile(List<String> command, Path workingDirectory, Map<String, String> environment,
                                   Duration timeout, Path stdoutFile) throws IOException {
        ProcessBuilder pb = builder(command, workingDirectory, environment);
        pb.redirectOutput(stdoutFile.toFile());
        return execute(pb, timeout, null);
    }

    private ProcessBuilder builder(List<String> command, Path workingDirectory, Map<String, String> environment) {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        if (environment != null) {
            pb.environment().putAll(environment);
        }
        return pb;
    }

    private ProcessResult execute(ProcessBuilder pb, Duration timeout, Consumer<String> output) throws IOException {
        String name = pb.command().get(0);
        Process process = pb.start();
        InputStream stream = pb.redirectOutput().type() == ProcessBuilder.Redirect.Type.PIPE
                ? process.getInputStream()
                : process.getErrorStream();

        Deque<String> tail = new ArrayDeque<>();
        Thread reader = new Thread(() -> drain(stream, tail, output), name + "-output-" + process.pid());
        reader.setDaemon(true);
        reader.start();

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + name, e);
        }

        if (!finished) {
            log.warn("{} exceeded {}, killing it", name, timeout);
            kill(process);
            join(reader);
            return new ProcessResult(-1, tailText(tail), true);
        }

        join(reader);
        return new ProcessResult(process.exitValue(), tailText(tail), false);
    }

    private void drain(InputStream stream, Deque<String> tail, Consumer<String> output) {
        Consumer<String> sink = output;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > OUTPUT_TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
                if (sink != null) {
                    try {
                        sink.accept(line);
                    } catch (RuntimeException e) {
                        // Keep draining so the process never blocks on a full pipe
                        log.warn("Dropping further output lines: {}", e.getMessage());
                        sink = null;
                    }
                }
            }
        } catch (IOException e) {
            // Stream closes under us when the process is killed
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }

    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private void join(Thread reader) {
        try {
            reader.join(READER_JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String tailText(Deque<String> tail) {
        synchronized (tail) {
            return String.join("\n", tail);
        }
    }
}
