package io.artifactbus.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

public final class MoreFiles {
    private MoreFiles() {
    }

    /**
     * Writes {@code content} to a sibling temp file and renames it over {@code target}.
     * Readers observe either the previous file or the new one, never a partial write.
     */
    public static void writeStringAtomically(Path target, String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve("." + target.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            moveAtomically(temp, target, true);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Renames {@code source} to {@code target}. With {@code replace=false} an existing target is
     * refused up front; the rename itself is still a plain atomic rename, so callers that race on
     * the same target must serialize themselves.
     */
    public static void moveAtomically(Path source, Path target, boolean replace) throws IOException {
        if (!replace && Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            throw new IOException("Atomic move not supported between " + source + " and " + target
                    + " (inbox, store and exports must share a volume)", e);
        }
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.comparingInt(Path::getNameCount).reversed()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
