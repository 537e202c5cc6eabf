package io.artifactbus.daemon;

import java.util.List;

public record ScanOutcome(
        int markersReplayed,
        int scanned,
        int incompleteSkipped,
        int emptyRemoved,
        int committed,
        int alreadyCommitted,
        int rejected,
        int deferred,
        int exportsRefreshed,
        long durationMs,
        List<JobResult> jobs
) {
    public ScanOutcome {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    static ScanOutcome from(int markersReplayed, int scanned, int incomplete, int empty, int exports,
                            long durationMs, List<JobResult> jobs) {
        int committed = 0;
        int already = 0;
        int rejected = 0;
        int deferred = 0;
        for (JobResult job : jobs) {
            switch (job.outcome()) {
                case COMMITTED -> committed++;
                case ALREADY_COMMITTED -> already++;
                case REJECTED -> rejected++;
                case DEFERRED_LOCK_TIMEOUT, DEFERRED_PENDING_COMMIT, DEFERRED_IO -> deferred++;
            }
        }
        return new ScanOutcome(markersReplayed, scanned, incomplete, empty, committed, already, rejected,
                deferred, exports, durationMs, jobs);
    }
}
