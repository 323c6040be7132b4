package io.snapcheck.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SnapcheckConfig {
    public static final String DEFAULT_ROOT = ".snapcheck";
    public static final String SETTINGS_FILE = "snapcheck-settings.json";

    private final Path rootDir;
    private final Path sourceRoot;

    public SnapcheckConfig(Path rootDir, Path sourceRoot) {
        this.rootDir = rootDir;
        this.sourceRoot = sourceRoot;
    }

    public static SnapcheckConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    public static SnapcheckConfig fromRoot(String root, String sourceRoot) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path sources = sourceRoot == null || sourceRoot.isBlank()
                ? Paths.get("")
                : Paths.get(sourceRoot);
        return new SnapcheckConfig(
                resolved.toAbsolutePath().normalize(),
                sources.toAbsolutePath().normalize()
        );
    }

    public Path rootDir() {
        return rootDir;
    }

    /**
     * Directory that relative source paths in captures are resolved against.
     */
    public Path sourceRoot() {
        return sourceRoot;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path dbFile() {
        return rootDir.resolve("snapcheck.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path journalFile() {
        return auditRoot().resolve("decisions.log");
    }

    public Path resolveSource(String file) {
        Path path = Paths.get(file);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return sourceRoot.resolve(path).normalize();
    }
}
