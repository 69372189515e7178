package com.depgraph.engine.graph;

import java.time.Instant;

/**
 * A tracked source file. The path is the unique key and doubles as the file id.
 * Tombstoned files keep their identity but are excluded from active queries.
 */
public record SourceFile(String path, String language, String digest, Instant lastSynced, boolean tombstoned) {

    public String id() {
        return path;
    }

    public SourceFile tombstone() {
        return new SourceFile(path, language, digest, lastSynced, true);
    }
}
