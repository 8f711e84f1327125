package fr.imt.stackpilot.stackpilot.infrastructure.sops;

import fr.imt.stackpilot.stackpilot.business.model.ProcessResult;
import fr.imt.stackpilot.stackpilot.business.port.SecretsPort;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.SecretsException;
import fr.imt.stackpilot.stackpilot.exception.SecretsFailureKind;
import fr.imt.stackpilot.stackpilot.infrastructure.ProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link SecretsPort} backed by the {@code sops} command line with an age key file.
 * Decrypted content goes to a temporary file first and replaces the destination only on success.
 */
@Slf4j
@Component
public class SopsCliAdapter implements SecretsPort {

    private static final String SOPS_BINARY = "sops";

    private static final List<String> MISSING_KEY_MARKERS = List.of(
            "failed to get the data key", "no key could decrypt", "could not decrypt data key",
            "no identity matched", "error getting data key", "failed to load age identities");

    private final ProcessRunner processRunner;
    private final String ageKeyFile;
    private final Duration timeout;

    public SopsCliAdapter(ProcessRunner processRunner, StackpilotProperties properties) {
        this.processRunner = processRunner;
        this.ageKeyFile = properties.getSops().getAgeKeyFile();
        this.timeout = properties.getDeploy().getSecretsTimeout();
    }

    @Override
    public boolean isEncrypted(Path file) {
        if (!Files.isRegularFile(file)) {
            return false;
        }
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return content.contains("sops:") || content.contains("\"sops\"") || content.contains("sops_version=");
        } catch (IOException e) {
            throw new SecretsException(SecretsFailureKind.MALFORMED, "Cannot read " + file, e);
        }
    }

    @Override
    public void decrypt(Path encrypted, Path destination) {
        Path temporary;
        try {
            Files.createDirectories(destination.getParent());
            temporary = Files.createTempFile(destination.getParent(), ".env-", ".tmp");
        } catch (IOException e) {
            throw new SecretsException(SecretsFailureKind.MALFORMED,
                    "Cannot prepare destination " + destination, e);
        }

        try {
            ProcessResult result = runSops(encrypted, temporary);
            if (result.timedOut()) {
                throw new SecretsException(SecretsFailureKind.TIMEOUT,
                        "sops timed out after " + timeout.toSeconds() + "s on " + encrypted.getFileName());
            }
            if (result.exitCode() != 0) {
                throw new SecretsException(classify(result.output()),
                        "sops failed (exit " + result.exitCode() + "): " + result.output());
            }
            Files.move(temporary, destination, StandardCopyOption.REPLACE_EXISTING);
            restrictPermissions(destination);
            log.info("Decrypted {} into {}", encrypted, destination);
        } catch (IOException e) {
            throw new SecretsException(SecretsFailureKind.MALFORMED,
                    "Cannot write decrypted file " + destination, e);
        } finally {
            deleteQuietly(temporary);
        }
    }

    private ProcessResult runSops(Path encrypted, Path output) {
        List<String> command = new ArrayList<>(List.of(SOPS_BINARY, "--decrypt"));
        if (encrypted.getFileName().toString().contains(".env")) {
            command.addAll(List.of("--input-type", "dotenv", "--output-type", "dotenv"));
        }
        command.add(encrypted.toString());

        Map<String, String> environment = StringUtils.hasText(ageKeyFile)
                ? Map.of("SOPS_AGE_KEY_FILE", ageKeyFile)
                : Map.of();
        try {
            return processRunner.runToFile(command, encrypted.getParent(), environment, timeout, output);
        } catch (IOException e) {
            throw new SecretsException(SecretsFailureKind.BINARY_UNAVAILABLE,
                    "Cannot run " + SOPS_BINARY + ": " + e.getMessage(), e);
        }
    }

    static SecretsFailureKind classify(String stderr) {
        String text = stderr == null ? "" : stderr.toLowerCase(Locale.ROOT);
        return MISSING_KEY_MARKERS.stream().anyMatch(text::contains)
                ? SecretsFailureKind.MISSING_KEY
                : SecretsFailureKind.MALFORMED;
    }

    private void restrictPermissions(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Cannot restrict permissions of {}: {}", file, e.getMessage());
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Cannot delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
