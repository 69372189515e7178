package com.depgraph.engine.graph;

import java.util.Collection;

/**
 * Write operations scoped to one source file. Everything done through a transaction commits
 * together or not at all; reads see the transaction's own uncommitted writes.
 */
public interface FileTransaction extends GraphReader {

    String fileId();

    SourceFile upsertFile(SourceFile file);

    /** Inserts or replaces symbols owned by this file; a tombstoned symbol with the same id is revived. */
    void upsertSymbols(Collection<Symbol> symbols);

    /**
     * Tombstones symbols of this file. Their outgoing edges are deleted; edges from other symbols
     * that targeted them are kept and re-tagged {@link Confidence#EXTERNAL}.
     */
    void tombstoneSymbols(Collection<String> symbolIds);

    /**
     * Inserts edges whose source belongs to this file. An edge whose key already exists replaces
     * the stored one and its observation count becomes the stored count plus one.
     */
    void upsertEdges(Collection<Edge> edges);

    void deleteEdges(Collection<EdgeKey> keys);

    /** Tombstones the file and cascades to all of its symbols. */
    void tombstoneFile();
}
