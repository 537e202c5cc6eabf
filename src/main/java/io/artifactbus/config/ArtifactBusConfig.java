package io.artifactbus.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ArtifactBusConfig {
    public static final String SETTINGS_FILE = "artifactbus-settings.json";
    public static final String INCOMING_DIR = ".incoming";

    private final Path rootDir;
    private final BusSettings settings;

    public ArtifactBusConfig(Path rootDir, BusSettings settings) {
        this.rootDir = rootDir.toAbsolutePath().normalize();
        this.settings = settings == null ? BusSettings.defaults() : settings;
    }

    /**
     * Resolves the root directory and loads {@value #SETTINGS_FILE} from it, if present.
     */
    public static ArtifactBusConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new ArtifactBusConfig(base, BusSettings.load(base.resolve(SETTINGS_FILE)));
    }

    public ArtifactBusConfig withSettings(BusSettings replacement) {
        return new ArtifactBusConfig(rootDir, replacement);
    }

    public Path rootDir() {
        return rootDir;
    }

    public BusSettings settings() {
        return settings;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path catalogFile() {
        return rootDir.resolve("catalog.db");
    }

    public Path lockFile() {
        return rootDir.resolve("catalog.lock");
    }

    public Path inboxRoot() {
        return resolve(settings.inboxRoot());
    }

    public Path incomingDir() {
        return inboxRoot().resolve(INCOMING_DIR);
    }

    public Path rejectedRoot() {
        return rootDir.resolve("rejected");
    }

    public Path storeRoot() {
        return resolve(settings.storeRoot());
    }

    public Path markersRoot() {
        return rootDir.resolve("markers");
    }

    public Path exportRoot() {
        return resolve(settings.exportRoot());
    }

    public Path exportStatusFile() {
        return exportRoot().resolve("export-status.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    private Path resolve(String configured) {
        Path p = Paths.get(configured);
        return (p.isAbsolute() ? p : rootDir.resolve(p)).normalize();
    }
}
