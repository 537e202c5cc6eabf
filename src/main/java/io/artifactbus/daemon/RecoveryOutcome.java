package io.artifactbus.daemon;

import java.util.List;

/**
 * Result of a startup recovery pass.
 *
 * @param markersReplayed  stored-but-uncataloged commits whose catalog upsert was replayed
 * @param markersCleared   markers whose store move never happened; their jobs go back to the scan
 * @param markersPending   markers that could not be replayed yet (lock timeout)
 * @param corruptEntries   catalog rows whose store file is missing
 * @param orphanFiles      store keys with neither a catalog row nor a marker
 */
public record RecoveryOutcome(
        int markersReplayed,
        int markersCleared,
        int markersPending,
        List<String> corruptEntries,
        List<String> orphanFiles
) {
    public RecoveryOutcome {
        corruptEntries = corruptEntries == null ? List.of() : List.copyOf(corruptEntries);
        orphanFiles = orphanFiles == null ? List.of() : List.copyOf(orphanFiles);
    }

    public boolean clean() {
        return corruptEntries.isEmpty() && orphanFiles.isEmpty() && markersPending == 0;
    }
}
