package io.artifactbus.bus;

import io.artifactbus.model.Manifest;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Storage seen by the daemon: the inbox of pending jobs, the {@code rejected/} area,
 * the write-once store and the commit markers. Store entries are addressed by a
 * store-relative key; {@link #locate(String)} turns a key into the location recorded in
 * the catalog.
 */
public interface InboxStorage {

    void init();

    ScanResult scan(int limit);

    Manifest readManifest(String jobId) throws IOException;

    /**
     * Size and SHA-256 of the job's data file, or empty when the file is absent.
     */
    Optional<DataStat> statData(String jobId, String dataFile) throws IOException;

    /**
     * SHA-256 of the stored artifact at {@code key}, or empty when nothing is stored there.
     */
    Optional<String> storedHash(String key) throws IOException;

    String locate(String key);

    boolean existsAt(String location);

    /**
     * Atomically moves the job's data file to {@code key} in the store.
     */
    void commit(String jobId, String dataFile, String key) throws IOException;

    void reject(String jobId, Rejection rejection) throws IOException;

    void remove(String jobId) throws IOException;

    boolean jobExists(String jobId);

    void writeMarker(CommitMarker marker) throws IOException;

    void clearMarker(String markerId) throws IOException;

    Optional<CommitMarker> readMarker(String markerId) throws IOException;

    List<CommitMarker> listMarkers() throws IOException;

    List<String> listStoreKeys() throws IOException;

    List<Rejection> listRejections() throws IOException;

    int countRejected();
}
