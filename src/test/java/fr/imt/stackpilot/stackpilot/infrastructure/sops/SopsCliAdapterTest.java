package fr.imt.stackpilot.stackpilot.infrastructure.sops;

import fr.imt.stackpilot.stackpilot.business.model.ProcessResult;
import fr.imt.stackpilot.stackpilot.configuration.StackpilotProperties;
import fr.imt.stackpilot.stackpilot.exception.SecretsException;
import fr.imt.stackpilot.stackpilot.exception.SecretsFailureKind;
import fr.imt.stackpilot.stackpilot.infrastructure.ProcessRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SopsCliAdapterTest {

    @TempDir
    Path workdir;

    private final ProcessRunner processRunner = mock(ProcessRunner.class);
    private SopsCliAdapter adapter;
    private Path encrypted;
    private Path destination;

    @BeforeEach
    void setUp() throws IOException {
        StackpilotProperties properties = new StackpilotProperties();
        properties.getSops().setAgeKeyFile("/etc/stackpilot/age.key");
        adapter = new SopsCliAdapter(processRunner, properties);
        encrypted = Files.writeString(workdir.resolve("secrets.enc.env"),
                "DB_PASSWORD=ENC[AES256_GCM,data:xx]\nsops_version=3.8.1\n");
        destination = workdir.resolve(".env");
    }

    @Test
    void detectsSopsMetadata() throws IOException {
        Path plain = Files.writeString(workdir.resolve("plain.env"), "DB_PASSWORD=hunter2\n");
        Path yaml = Files.writeString(workdir.resolve("secrets.yaml"), "password: ENC[...]\nsops:\n  age: []\n");

        assertThat(adapter.isEncrypted(encrypted)).isTrue();
        assertThat(adapter.isEncrypted(yaml)).isTrue();
        assertThat(adapter.isEncrypted(plain)).isFalse();
        assertThat(adapter.isEncrypted(workdir.resolve("missing.env"))).isFalse();
    }

    @Test
    void classifiesKeyProblems() {
        assertThat(SopsCliAdapter.classify("Failed to get the data key required to decrypt the SOPS file."))
                .isEqualTo(SecretsFailureKind.MISSING_KEY);
        assertThat(SopsCliAdapter.classify("Error unmarshalling input json: invalid character"))
                .isEqualTo(SecretsFailureKind.MALFORMED);
    }

    @Test
    void decryptsIntoDestination() throws IOException {
        when(processRunner.runToFile(anyList(), any(), any(), any(), any())).thenAnswer(invocation -> {
            Files.writeString(invocation.getArgument(4), "DB_PASSWORD=hunter2\n");
            return new ProcessResult(0, "", false);
        });

        adapter.decrypt(encrypted, destination);

        assertThat(Files.readString(destination)).isEqualTo("DB_PASSWORD=hunter2\n");
        verify(processRunner).runToFile(
                eq(List.of("sops", "--decrypt", "--input-type", "dotenv", "--output-type", "dotenv",
                        encrypted.toString())),
                eq(workdir), eq(Map.of("SOPS_AGE_KEY_FILE", "/etc/stackpilot/age.key")), any(), any());
    }

    @Test
    void failedDecryptionKeepsPreviousFile() throws IOException {
        Files.writeString(destination, "DB_PASSWORD=previous\n");
        when(processRunner.runToFile(anyList(), any(), any(), any(), any()))
                .thenReturn(new ProcessResult(128, "no key could decrypt the data key", false));

        assertThatThrownBy(() -> adapter.decrypt(encrypted, destination))
                .isInstanceOfSatisfying(SecretsException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SecretsFailureKind.MISSING_KEY));

        assertThat(Files.readString(destination)).isEqualTo("DB_PASSWORD=previous\n");
        try (var files = Files.list(workdir)) {
            assertThat(files.map(f -> f.getFileName().toString()))
                    .containsExactlyInAnyOrder("secrets.enc.env", ".env");
        }
    }

    @Test
    void timeoutAndMissingBinaryAreDistinguished() throws IOException {
        when(processRunner.runToFile(anyList(), any(), any(), any(), any()))
                .thenReturn(new ProcessResult(-1, "", true))
                .thenThrow(new IOException("error=2, No such file or directory"));

        assertThatThrownBy(() -> adapter.decrypt(encrypted, destination))
                .isInstanceOfSatisfying(SecretsException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SecretsFailureKind.TIMEOUT));
        assertThatThrownBy(() -> adapter.decrypt(encrypted, destination))
                .isInstanceOfSatisfying(SecretsException.class,
                        e -> assertThat(e.getKind()).isEqualTo(SecretsFailureKind.BINARY_UNAVAILABLE));
    }
}
