package com.pandora.orchestrator.sync;

import java.util.List;
import java.util.Map;

/**
 * What a connector pull produced.
 *
 * @param warnings non-fatal problems, e.g. records skipped during normalisation
 * @param summary  connector-specific counts, passed on to post-sync skills
 */
public record ConnectorSyncResult(long recordsSynced, List<String> warnings, Map<String, Object> summary) {

    public ConnectorSyncResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        summary  = summary == null ? Map.of() : Map.copyOf(summary);
    }
}
