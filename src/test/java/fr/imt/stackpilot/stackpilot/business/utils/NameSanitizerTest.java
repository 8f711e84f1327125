package fr.imt.stackpilot.stackpilot.business.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NameSanitizerTest {

    @Test
    void replacesUnsafeCharacters() {
        assertThat(NameSanitizer.sanitizeDirectoryName("home/api v2")).isEqualTo("home_api_v2");
        assertThat(NameSanitizer.sanitizeDirectoryName("../etc")).isEqualTo("__etc");
    }

    @Test
    void masksUrlCredentials() {
        assertThat(NameSanitizer.maskCredentials("fatal: unable to access 'https://ghp_secret@github.com/acme/api.git/'"))
                .isEqualTo("fatal: unable to access 'https://***@github.com/acme/api.git/'");
        assertThat(NameSanitizer.maskCredentials("https://github.com/acme/api.git"))
                .isEqualTo("https://github.com/acme/api.git");
        assertThat(NameSanitizer.maskCredentials(null)).isNull();
    }
}
