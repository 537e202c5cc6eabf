package io.artifactbus.export;

import java.util.List;

public record ExportRunOutcome(int refreshed, int skipped, int failed, List<ExportStatus> entries) {
    public ExportRunOutcome {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
