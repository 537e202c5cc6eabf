package io.artifactbus.lock;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Content of the lock file: who holds the lease and since when.
 */
public record LockOwner(long pid, String host, String token, long acquiredAtMs) {

    public static LockOwner current(String token, long nowMs) {
        return new LockOwner(ProcessHandle.current().pid(), localHost(), token, nowMs);
    }

    public static String localHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    public boolean onThisHost() {
        return localHost().equals(host);
    }

    public boolean processAlive() {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
