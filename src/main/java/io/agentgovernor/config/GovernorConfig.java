package io.agentgovernor.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem locations of a governor runtime. Only the settings file, the audit log and its
 * signing key live on disk; all admission state is in memory.
 */
public final class GovernorConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "governor-settings.json";

    private final Path rootDir;

    public GovernorConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static GovernorConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new GovernorConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }
}
