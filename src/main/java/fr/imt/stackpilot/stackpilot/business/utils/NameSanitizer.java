package fr.imt.stackpilot.stackpilot.business.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class NameSanitizer {

    /**
     * Sanitize a name so it is safe as a directory or compose project name.
     */
    public static String sanitizeDirectoryName(String dirName) {
        return dirName
                .replaceAll("[^a-zA-Z0-9._-]", "_")
                .replaceAll("\\.\\.", "_");
    }

    /**
     * Mask credentials embedded in a URL before it is logged.
     */
    public static String maskCredentials(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceAll("(https?://)[^@/]+@", "$1***@");
    }

}
