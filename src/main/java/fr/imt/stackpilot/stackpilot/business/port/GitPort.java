package fr.imt.stackpilot.stackpilot.business.port;

import fr.imt.stackpilot.stackpilot.exception.GitOperationException;

import java.nio.file.Path;

/**
 * Git capabilities used by the deployment core. Every operation returns the resulting commit
 * hash and fails with a {@link GitOperationException} carrying the failure kind.
 * {@code credential} may be null for public repositories.
 */
public interface GitPort {

    String clone(String url, String branch, Path destination, String credential);

    String remoteHash(Path destination, String branch, String url, String credential);

    String localHash(Path destination);

    /**
     * Brings the working tree to the remote tip of {@code branch}, discarding local changes.
     */
    String pull(Path destination, String branch, String url, String credential);
}
