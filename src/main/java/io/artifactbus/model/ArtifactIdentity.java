package io.artifactbus.model;

import io.artifactbus.util.Hashing;

import java.util.regex.Pattern;

/**
 * Identity of one artifact. Each component doubles as a path segment in the store,
 * so all four are restricted to a conservative character set.
 */
public record ArtifactIdentity(String runId, String producer, String kind, String artifactId) {
    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    public static ArtifactIdentity of(String runId, String producer, String kind, String artifactId) {
        ArtifactIdentity identity = new ArtifactIdentity(runId, producer, kind, artifactId);
        String problem = identity.problem();
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        return identity;
    }

    /**
     * Returns a description of the first malformed component, or {@code null} when well formed.
     */
    public String problem() {
        String p = segmentProblem("runId", runId);
        if (p == null) p = segmentProblem("producer", producer);
        if (p == null) p = segmentProblem("kind", kind);
        if (p == null) p = segmentProblem("artifactId", artifactId);
        return p;
    }

    public String digest() {
        return Hashing.sha256Hex(runId + "\n" + producer + "\n" + kind + "\n" + artifactId);
    }

    public String label() {
        return runId + "/" + producer + "/" + kind + "/" + artifactId;
    }

    public static boolean isValidSegment(String value) {
        return value != null && SEGMENT.matcher(value).matches() && !value.contains("..");
    }

    private static String segmentProblem(String field, String value) {
        if (value == null || value.isBlank()) {
            return field + " is required";
        }
        if (!isValidSegment(value)) {
            return field + " has invalid characters: " + value;
        }
        return null;
    }
}
