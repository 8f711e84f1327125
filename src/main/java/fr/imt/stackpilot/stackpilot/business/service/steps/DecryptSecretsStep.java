package fr.imt.stackpilot.stackpilot.business.service.steps;

import fr.imt.stackpilot.stackpilot.business.model.DeploymentStepType;
import fr.imt.stackpilot.stackpilot.business.port.SecretsPort;
import fr.imt.stackpilot.stackpilot.exception.SecretsException;
import fr.imt.stackpilot.stackpilot.exception.SecretsFailureKind;
import fr.imt.stackpilot.stackpilot.infrastructure.persistence.GitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the {@code .env} file next to the compose file from the repository's encrypted env file.
 * Runs before the containers so they are never started with a stale or missing secrets file.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecryptSecretsStep implements DeploymentStep {

    static final String DECRYPTED_FILE_NAME = ".env";

    private final SecretsPort secretsPort;

    @Override
    public DeploymentStepType getType() {
        return DeploymentStepType.DECRYPT;
    }

    @Override
    public boolean appliesTo(GitRepository repository) {
        return repository.getEnvFile() != null && !repository.getEnvFile().isBlank();
    }

    @Override
    public void execute(DeploymentContext context) {
        GitRepository repository = context.getRepository();
        Path workdir = repository.composeDirectory();
        Path encrypted = workdir.resolve(repository.getEnvFile()).normalize();
        Path decrypted = workdir.resolve(DECRYPTED_FILE_NAME);

        if (!encrypted.startsWith(workdir)) {
            throw new SecretsException(SecretsFailureKind.MALFORMED,
                    "Env file escapes the compose directory: " + repository.getEnvFile());
        }
        if (!Files.isRegularFile(encrypted)) {
            throw new SecretsException(SecretsFailureKind.MALFORMED, "Env file not found: " + encrypted);
        }

        if (!secretsPort.isEncrypted(encrypted)) {
            log.warn("Env file {} of {} is not SOPS-encrypted, copying it as-is", encrypted, repository.getId());
            context.log(getType(), "WARNING: " + encrypted.getFileName() + " is not encrypted, copying as-is");
            try {
                Files.copy(encrypted, decrypted, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new SecretsException(SecretsFailureKind.MALFORMED, "Cannot copy env file " + encrypted, e);
            }
            return;
        }

        context.log(getType(), "Decrypting " + encrypted.getFileName() + " -> " + decrypted.getFileName());
        secretsPort.decrypt(encrypted, decrypted);
        context.log(getType(), "Env file decrypted");
    }
}
