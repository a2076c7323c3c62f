package com.nursingjobs.pipeline.ingest.model;

import java.util.List;

public record TombstoneImportSummary(
    int rowsRead,
    int tombstoned,
    List<String> errors
) {
}
