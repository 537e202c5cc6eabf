package io.artifactbus.lock;

import java.time.Duration;

public final class LockTimeoutException extends RuntimeException {
    private final Duration waited;
    private final LockOwner holder;

    public LockTimeoutException(Duration waited, LockOwner holder) {
        super("Timed out after " + waited.toMillis() + "ms waiting for catalog lock"
                + (holder == null ? "" : ", held by pid=" + holder.pid() + " host=" + holder.host()));
        this.waited = waited;
        this.holder = holder;
    }

    public Duration waited() {
        return waited;
    }

    public LockOwner holder() {
        return holder;
    }
}
