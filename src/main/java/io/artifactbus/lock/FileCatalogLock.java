package io.artifactbus.lock;

import io.artifactbus.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Advisory lock backed by a single lock file.
 *
 * <p>The file is published with a hard link from a fully written temp file, so it either
 * does not exist or carries a complete {@link LockOwner}. Waiters poll with exponential
 * backoff. A lease is reclaimed when its holder is a dead process on this host, or when it
 * is older than {@code staleAfter} (covers holders on other hosts, whose pid cannot be
 * checked).
 */
public final class FileCatalogLock implements CatalogLock {
    private static final Logger LOG = LoggerFactory.getLogger(FileCatalogLock.class);

    private final Path lockFile;
    private final long retryBaseMs;
    private final long retryMaxMs;
    private final long staleAfterMs;

    public FileCatalogLock(Path lockFile, long retryBaseMs, long retryMaxMs, long staleAfterMs) {
        this.lockFile = lockFile.toAbsolutePath().normalize();
        this.retryBaseMs = Math.max(1L, retryBaseMs);
        this.retryMaxMs = Math.max(this.retryBaseMs, retryMaxMs);
        this.staleAfterMs = Math.max(1L, staleAfterMs);
    }

    @Override
    public Lease acquire(Duration timeout) {
        long startNs = System.nanoTime();
        long deadlineNs = startNs + Math.max(0L, timeout.toNanos());
        long backoffMs = retryBaseMs;
        String token = "lock_" + UUID.randomUUID();
        while (true) {
            LockOwner owner = LockOwner.current(token, System.currentTimeMillis());
            if (tryCreate(owner)) {
                return new FileLease(owner);
            }
            Optional<LockOwner> holder = readOwner();
            if (holder.isPresent() && isStale(holder.get(), System.currentTimeMillis())) {
                reclaim(holder.get());
                continue;
            }
            long remainingNs = deadlineNs - System.nanoTime();
            if (remainingNs <= 0L) {
                throw new LockTimeoutException(Duration.ofNanos(System.nanoTime() - startNs), holder.orElse(null));
            }
            long sleepMs = Math.min(backoffMs, Math.max(1L, remainingNs / 1_000_000L));
            try {
                Thread.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(Duration.ofNanos(System.nanoTime() - startNs), holder.orElse(null));
            }
            backoffMs = Math.min(retryMaxMs, backoffMs * 2L);
        }
    }

    public Optional<LockOwner> currentOwner() {
        return readOwner();
    }

    boolean isStale(LockOwner holder, long nowMs) {
        if (holder.onThisHost() && !holder.processAlive()) {
            return true;
        }
        return nowMs - holder.acquiredAtMs() > staleAfterMs;
    }

    private boolean tryCreate(LockOwner owner) {
        Path parent = lockFile.getParent();
        Path temp = parent.resolve("." + lockFile.getFileName() + "." + owner.token() + ".tmp");
        try {
            Files.createDirectories(parent);
            Files.writeString(temp, Jsons.toCompactJson(owner), StandardCharsets.UTF_8);
            Files.createLink(lockFile, temp);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException e) {
            throw new RuntimeException("Failed to create lock file: " + lockFile, e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOG.warn("Could not remove lock temp file {}", temp, e);
            }
        }
    }

    private Optional<LockOwner> readOwner() {
        try {
            String raw = Files.readString(lockFile, StandardCharsets.UTF_8);
            if (raw.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(Jsons.mapper().readValue(raw, LockOwner.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read lock file: " + lockFile, e);
        }
    }

    /**
     * Moves the stale lock file aside, then checks that what was moved is the lease we judged
     * stale. If another waiter reclaimed and re-acquired in between, its fresh lock is put back.
     */
    private void reclaim(LockOwner stale) {
        Path aside = lockFile.resolveSibling(lockFile.getFileName() + ".stale-" + UUID.randomUUID());
        try {
            Files.move(lockFile, aside, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return;
        } catch (IOException e) {
            throw new RuntimeException("Failed to reclaim stale lock: " + lockFile, e);
        }
        try {
            LockOwner moved = Jsons.mapper().readValue(Files.readString(aside, StandardCharsets.UTF_8), LockOwner.class);
            if (!stale.token().equals(moved.token())) {
                try {
                    Files.createLink(lockFile, aside);
                } catch (FileAlreadyExistsException e) {
                    LOG.warn("Lock {} held by token {} was displaced during stale reclaim", lockFile, moved.token());
                }
                return;
            }
            LOG.warn("Reclaimed stale catalog lock held by pid={} host={} since {}",
                    stale.pid(), stale.host(), stale.acquiredAtMs());
        } catch (IOException e) {
            throw new RuntimeException("Failed to inspect reclaimed lock: " + aside, e);
        } finally {
            try {
                Files.deleteIfExists(aside);
            } catch (IOException e) {
                LOG.warn("Could not remove reclaimed lock file {}", aside, e);
            }
        }
    }

    private final class FileLease implements Lease {
        private final LockOwner owner;
        private boolean released;

        private FileLease(LockOwner owner) {
            this.owner = owner;
        }

        @Override
        public String token() {
            return owner.token();
        }

        @Override
        public synchronized void close() {
            if (released) {
                return;
            }
            released = true;
            Optional<LockOwner> holder = readOwner();
            if (holder.isEmpty() || !owner.token().equals(holder.get().token())) {
                LOG.warn("Catalog lock {} no longer held by token {}; leaving it untouched", lockFile, owner.token());
                return;
            }
            try {
                Files.deleteIfExists(lockFile);
            } catch (IOException e) {
                throw new RuntimeException("Failed to release catalog lock: " + lockFile, e);
            }
        }
    }
}
