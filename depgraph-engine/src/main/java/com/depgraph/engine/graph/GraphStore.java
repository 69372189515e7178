package com.depgraph.engine.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Repository of files, symbols and edges.
 *
 * <p>All writes go through {@link #inTransaction}: a file's symbol and edge set commits atomically.
 * {@link #query} runs a read under a shared lock; readers do not block each other, but commits wait
 * until every running query has finished.
 */
public interface GraphStore extends GraphReader {

    /**
     * Store-level transactional failure. Nothing of the failed transaction is visible afterwards.
     */
    class CommitException extends RuntimeException {
        public CommitException(String message) { super(message); }
        public CommitException(String message, Throwable cause) { super(message, cause); }
    }

    /**
     * An engine invariant was violated, e.g. an edge references a symbol id that does not exist.
     * Signals a bug in the delta logic rather than bad input.
     */
    class ConsistencyException extends RuntimeException {
        public ConsistencyException(String message) { super(message); }
    }

    /**
     * Runs {@code work} as one atomic transaction for {@code fileId}.
     *
     * @throws ConsistencyException if the work violates a graph invariant (transaction rolled back)
     * @throws CommitException      for any other failure (transaction rolled back)
     */
    <T> T inTransaction(String fileId, Function<FileTransaction, T> work);

    /** Runs {@code work} against a consistent view of the graph, blocking commits until it returns. */
    <T> T query(Function<GraphReader, T> work);

    default void upsertFile(SourceFile file) {
        inTransaction(file.id(), tx -> tx.upsertFile(file));
    }

    default void upsertSymbols(String fileId, Collection<Symbol> symbols) {
        inTransaction(fileId, tx -> {
            tx.upsertSymbols(symbols);
            return null;
        });
    }

    /** Upserts edges, one transaction per owning file of the edge sources. */
    default void upsertEdges(Collection<Edge> edges) {
        Map<String, List<Edge>> byFile = new LinkedHashMap<>();
        for (Edge edge : edges) {
            byFile.computeIfAbsent(SymbolIds.fileOf(edge.sourceId()), k -> new ArrayList<>()).add(edge);
        }
        byFile.forEach((fileId, fileEdges) -> inTransaction(fileId, tx -> {
            tx.upsertEdges(fileEdges);
            return null;
        }));
    }

    default void tombstoneFile(String fileId) {
        inTransaction(fileId, tx -> {
            tx.tombstoneFile();
            return null;
        });
    }
}
