package com.pandora.orchestrator.evidence;

import java.time.Instant;

/**
 * Which connector contributed to an evidence bundle, including sources that
 * are not connected so the reader knows what the analysis could not see.
 */
public record DataSourceDescriptor(
        String  source,
        boolean connected,
        Instant lastSync,
        long    recordsAvailable,
        long    recordsUsed,
        String  note) {

    public static DataSourceDescriptor connected(String source, Instant lastSync, long records) {
        return new DataSourceDescriptor(source, true, lastSync, records, records, null);
    }

    public static DataSourceDescriptor disconnected(String source, String note) {
        return new DataSourceDescriptor(source, false, null, 0, 0, note);
    }
}
