package io.artifactbus.bus;

import io.artifactbus.config.ArtifactBusConfig;
import io.artifactbus.model.Manifest;
import io.artifactbus.util.Hashing;
import io.artifactbus.util.Jsons;
import io.artifactbus.util.MoreFiles;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Directory-backed {@link InboxStorage}. Each job is a directory under the inbox root holding
 * {@code manifest.json} and one data file; producers build it under {@code .incoming/} and rename
 * it into place, so anything visible at the top level was published as a unit.
 */
public final class FileSystemInbox implements InboxStorage {
    private static final String MARKER_SUFFIX = ".marker.json";

    private final ArtifactBusConfig config;

    public FileSystemInbox(ArtifactBusConfig config) {
        this.config = config;
    }

    @Override
    public void init() {
        try {
            Files.createDirectories(config.inboxRoot());
            Files.createDirectories(config.incomingDir());
            Files.createDirectories(config.rejectedRoot());
            Files.createDirectories(config.storeRoot());
            Files.createDirectories(config.markersRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize inbox directories", e);
        }
    }

    @Override
    public ScanResult scan(int limit) {
        List<String> complete = new ArrayList<>();
        List<String> incomplete = new ArrayList<>();
        List<String> empty = new ArrayList<>();
        for (Path dir : listJobDirs()) {
            if (complete.size() >= Math.max(1, limit)) {
                break;
            }
            String jobId = dir.getFileName().toString();
            List<Path> files = listFiles(dir);
            boolean hasManifest = files.stream().anyMatch(f -> Manifest.FILE_NAME.equals(f.getFileName().toString()));
            boolean hasData = files.stream().anyMatch(f -> isDataFile(f.getFileName().toString()));
            if (files.isEmpty()) {
                empty.add(jobId);
            } else if (hasManifest && hasData) {
                complete.add(jobId);
            } else {
                incomplete.add(jobId);
            }
        }
        return new ScanResult(complete, incomplete, empty);
    }

    @Override
    public Manifest readManifest(String jobId) throws IOException {
        return Jsons.read(jobDir(jobId).resolve(Manifest.FILE_NAME), Manifest.class);
    }

    @Override
    public Optional<DataStat> statData(String jobId, String dataFile) throws IOException {
        Path data = jobDir(jobId).resolve(dataFile).normalize();
        if (!data.getParent().equals(jobDir(jobId)) || !Files.isRegularFile(data)) {
            return Optional.empty();
        }
        return Optional.of(new DataStat(Files.size(data), Hashing.sha256Hex(data)));
    }

    @Override
    public Optional<String> storedHash(String key) throws IOException {
        Path stored = storePath(key);
        if (!Files.isRegularFile(stored)) {
            return Optional.empty();
        }
        return Optional.of(Hashing.sha256Hex(stored));
    }

    @Override
    public String locate(String key) {
        return storePath(key).toString();
    }

    @Override
    public boolean existsAt(String location) {
        return location != null && Files.isRegularFile(Path.of(location));
    }

    @Override
    public void commit(String jobId, String dataFile, String key) throws IOException {
        Path source = jobDir(jobId).resolve(dataFile);
        Path target = storePath(key);
        Files.createDirectories(target.getParent());
        MoreFiles.moveAtomically(source, target, false);
    }

    @Override
    public void reject(String jobId, Rejection rejection) throws IOException {
        // Sidecar first: a job never reaches rejected/ without its reason.
        Path source = jobDir(jobId);
        MoreFiles.writeStringAtomically(source.resolve(Rejection.FILE_NAME), Jsons.toJson(rejection));
        Files.createDirectories(config.rejectedRoot());
        MoreFiles.moveAtomically(source, config.rejectedRoot().resolve(jobId), false);
    }

    @Override
    public void remove(String jobId) throws IOException {
        MoreFiles.deleteRecursively(jobDir(jobId));
    }

    @Override
    public boolean jobExists(String jobId) {
        return Files.isDirectory(jobDir(jobId));
    }

    @Override
    public void writeMarker(CommitMarker marker) throws IOException {
        MoreFiles.writeStringAtomically(markerPath(marker.markerId()), Jsons.toJson(marker));
    }

    @Override
    public void clearMarker(String markerId) throws IOException {
        Files.deleteIfExists(markerPath(markerId));
    }

    @Override
    public Optional<CommitMarker> readMarker(String markerId) throws IOException {
        Path path = markerPath(markerId);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        return Optional.of(Jsons.read(path, CommitMarker.class));
    }

    @Override
    public List<CommitMarker> listMarkers() throws IOException {
        List<CommitMarker> out = new ArrayList<>();
        if (!Files.isDirectory(config.markersRoot())) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(config.markersRoot(), "*" + MARKER_SUFFIX)) {
            for (Path path : stream) {
                out.add(Jsons.read(path, CommitMarker.class));
            }
        }
        out.sort(Comparator.comparingLong(CommitMarker::writtenAtMs));
        return out;
    }

    @Override
    public List<String> listStoreKeys() throws IOException {
        Path root = config.storeRoot();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        }
    }

    @Override
    public List<Rejection> listRejections() throws IOException {
        List<Rejection> out = new ArrayList<>();
        for (Path dir : listDirs(config.rejectedRoot())) {
            Path sidecar = dir.resolve(Rejection.FILE_NAME);
            if (Files.isRegularFile(sidecar)) {
                out.add(Jsons.read(sidecar, Rejection.class));
            }
        }
        return out;
    }

    @Override
    public int countRejected() {
        return listDirs(config.rejectedRoot()).size();
    }

    private static boolean isDataFile(String name) {
        return !Manifest.FILE_NAME.equals(name) && !Rejection.FILE_NAME.equals(name) && !name.startsWith(".");
    }

    private Path jobDir(String jobId) {
        if (jobId == null || jobId.isBlank() || jobId.startsWith(".") || jobId.contains("/") || jobId.contains("\\")) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        return config.inboxRoot().resolve(jobId);
    }

    private Path storePath(String key) {
        Path root = config.storeRoot();
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Store key escapes store root: " + key);
        }
        return resolved;
    }

    private Path markerPath(String markerId) {
        return config.markersRoot().resolve(markerId + MARKER_SUFFIX);
    }

    private List<Path> listJobDirs() {
        List<Path> dirs = listDirs(config.inboxRoot());
        dirs.removeIf(p -> p.getFileName().toString().startsWith("."));
        return dirs;
    }

    private List<Path> listDirs(Path root) {
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path path : stream) {
                dirs.add(path);
            }
        } catch (NoSuchFileException e) {
            return dirs;
        } catch (IOException e) {
            throw new RuntimeException("Failed to list directory: " + root, e);
        }
        dirs.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return dirs;
    }

    private List<Path> listFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isRegularFile)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (NoSuchFileException e) {
            // Consumed between listing and reading; nothing to report.
            return files;
        } catch (IOException e) {
            throw new RuntimeException("Failed to list job directory: " + dir, e);
        }
        return files;
    }
}
