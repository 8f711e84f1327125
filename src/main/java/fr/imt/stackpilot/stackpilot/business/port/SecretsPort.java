package fr.imt.stackpilot.stackpilot.business.port;

import java.nio.file.Path;

public interface SecretsPort {

    boolean isEncrypted(Path file);

    /**
     * Decrypts {@code encrypted} into {@code destination}.
     *
     * @throws fr.imt.stackpilot.stackpilot.exception.SecretsException when decryption fails
     */
    void decrypt(Path encrypted, Path destination);
}
