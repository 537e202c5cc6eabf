package io.artifactbus.bus;

import io.artifactbus.model.Manifest;

/**
 * Two-phase commit marker. Written before the data file is moved into the store and
 * cleared once the catalog row exists, so a restart can tell "stored but not cataloged"
 * apart from "fully committed". Keyed by identity digest: while a marker is pending, other
 * jobs for the same identity wait for it to settle.
 */
public record CommitMarker(
        String markerId,
        String jobId,
        String canonicalKey,
        String canonicalLocation,
        Manifest manifest,
        long writtenAtMs
) {
}
