package io.artifactbus.lock;

import java.time.Duration;

/**
 * Exclusive lease over catalog mutation. Only the span between {@link #acquire(Duration)} and
 * {@link Lease#close()} may write the catalog.
 */
public interface CatalogLock {

    /**
     * Blocks up to {@code timeout} for the lease.
     *
     * @throws LockTimeoutException when the lease is still held elsewhere at the deadline
     */
    Lease acquire(Duration timeout);

    interface Lease extends AutoCloseable {
        String token();

        @Override
        void close();
    }
}
