package io.artifactbus.bus;

import java.util.List;

/**
 * Snapshot of the inbox: complete jobs ready for validation, jobs still missing half of
 * their pair, and leftover empty job directories.
 */
public record ScanResult(List<String> complete, List<String> incomplete, List<String> empty) {
    public ScanResult {
        complete = List.copyOf(complete);
        incomplete = List.copyOf(incomplete);
        empty = List.copyOf(empty);
    }
}
