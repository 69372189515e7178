package com.depgraph.engine.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Heap-backed {@link GraphStore}. Persistence is handled by snapshotting the whole store
 * (see {@code GraphSnapshotSerializer}).
 *
 * <p>Every mutation made inside a transaction pushes an undo action onto a journal; a failing
 * transaction replays the journal in reverse, so a half-applied file is never observable.
 * Commits hold the write lock because tombstoning re-tags edges owned by other files.
 */
public class InMemoryGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    static final Comparator<Edge> EDGE_ORDER = Comparator.comparing(Edge::sourceId)
            .thenComparing(e -> e.target().key())
            .thenComparing(Edge::kind);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, SourceFile> files = new HashMap<>();
    private final Map<String, Symbol> symbols = new HashMap<>();
    private final Map<String, Set<String>> symbolsByFile = new HashMap<>();
    private final Map<String, Set<String>> liveBySimpleName = new HashMap<>();
    private final Map<EdgeKey, Edge> edges = new HashMap<>();
    private final Map<String, Set<EdgeKey>> outgoing = new HashMap<>();
    private final Map<String, Set<EdgeKey>> incoming = new HashMap<>();
    private final Map<String, Set<EdgeKey>> byTargetName = new HashMap<>();

    // Undo journal of the running transaction; null outside a transaction.
    private Deque<Runnable> undo;

    /**
     * Rebuilds a store from previously persisted entities.
     *
     * @throws ConsistencyException if an edge references a missing or tombstoned symbol
     */
    public static InMemoryGraphStore restore(Collection<SourceFile> files,
                                             Collection<Symbol> symbols,
                                             Collection<Edge> edges) {
        InMemoryGraphStore store = new InMemoryGraphStore();
        for (SourceFile f : files) store.files.put(f.path(), f);
        for (Symbol s : symbols) store.writeSymbol(null, s);
        for (Edge e : edges) {
            store.checkEdgeEndpoints(e);
            store.writeEdge(null, e);
        }
        return store;
    }

    // -----------------------------------------------------------------------
    // Transactions
    // -----------------------------------------------------------------------

    @Override
    public <T> T inTransaction(String fileId, Function<FileTransaction, T> work) {
        lock.writeLock().lock();
        try {
            if (undo != null) {
                throw new IllegalStateException("Nested transaction for " + fileId);
            }
            undo = new ArrayDeque<>();
            Tx tx = new Tx(fileId);
            try {
                T result = work.apply(tx);
                tx.refreshLeaves();
                log.debug("Committed {} ({} journal entries)", fileId, undo.size());
                return result;
            } catch (ConsistencyException | CommitException e) {
                rollback(fileId);
                throw e;
            } catch (RuntimeException e) {
                rollback(fileId);
                throw new CommitException("Commit failed for " + fileId + ": " + e.getMessage(), e);
            } finally {
                undo = null;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> T query(Function<GraphReader, T> work) {
        lock.readLock().lock();
        try {
            return work.apply(this);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void rollback(String fileId) {
        log.warn("Rolling back transaction for {} ({} journal entries)", fileId, undo.size());
        while (!undo.isEmpty()) {
            undo.pop().run();
        }
    }

    private void journal(Runnable action) {
        if (undo != null) undo.push(action);
    }

    // -----------------------------------------------------------------------
    // Reads
    // -----------------------------------------------------------------------

    @Override
    public Optional<SourceFile> getFile(String path) {
        return read(() -> Optional.ofNullable(files.get(path)));
    }

    @Override
    public List<SourceFile> files() {
        return read(() -> {
            List<SourceFile> out = new ArrayList<>(files.values());
            out.sort(Comparator.comparing(SourceFile::path));
            return out;
        });
    }

    @Override
    public Optional<Symbol> getSymbol(String id) {
        return read(() -> Optional.ofNullable(symbols.get(id)));
    }

    @Override
    public List<Symbol> symbolsIn(String fileId) {
        return read(() -> liveSymbols(symbolsByFile.getOrDefault(fileId, Set.of())));
    }

    @Override
    public List<Symbol> allSymbolsIn(String fileId) {
        return read(() -> {
            List<Symbol> out = new ArrayList<>();
            for (String id : symbolsByFile.getOrDefault(fileId, Set.of())) out.add(symbols.get(id));
            out.sort(Comparator.comparing(Symbol::id));
            return out;
        });
    }

    @Override
    public List<Symbol> liveSymbols() {
        return read(() -> liveSymbols(symbols.keySet()));
    }

    @Override
    public List<Symbol> symbolsNamed(String simpleName) {
        return read(() -> liveSymbols(liveBySimpleName.getOrDefault(simpleName, Set.of())));
    }

    @Override
    public List<Edge> edgesFrom(String symbolId) {
        return read(() -> edgesFor(outgoing.getOrDefault(symbolId, Set.of())));
    }

    @Override
    public List<Edge> edgesTo(String symbolId) {
        return read(() -> edgesFor(incoming.getOrDefault(symbolId, Set.of())));
    }

    @Override
    public List<Edge> edgesNamed(String simpleName) {
        return read(() -> edgesFor(byTargetName.getOrDefault(simpleName, Set.of())));
    }

    @Override
    public List<Edge> edges() {
        return read(() -> edgesFor(edges.keySet()));
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Symbol> liveSymbols(Collection<String> ids) {
        List<Symbol> out = new ArrayList<>();
        for (String id : ids) {
            Symbol s = symbols.get(id);
            if (s != null && !s.tombstoned()) out.add(s);
        }
        out.sort(Comparator.comparing(Symbol::id));
        return out;
    }

    private List<Edge> edgesFor(Collection<EdgeKey> keys) {
        List<Edge> out = new ArrayList<>(keys.size());
        for (EdgeKey key : keys) {
            Edge e = edges.get(key);
            if (e != null) out.add(e);
        }
        out.sort(EDGE_ORDER);
        return out;
    }

    // -----------------------------------------------------------------------
    // Journaled primitives
    // -----------------------------------------------------------------------

    private void putFile(SourceFile file) {
        SourceFile previous = files.put(file.path(), file);
        journal(() -> {
            if (previous == null) files.remove(file.path());
            else files.put(previous.path(), previous);
        });
    }

    private void putSymbol(Symbol symbol) {
        Symbol previous = symbols.get(symbol.id());
        writeSymbol(previous, symbol);
        journal(() -> writeSymbol(symbol, previous));
    }

    private void putEdge(Edge edge) {
        Edge previous = edges.get(edge.key());
        writeEdge(previous, edge);
        journal(() -> writeEdge(edge, previous));
    }

    private void removeEdge(EdgeKey key) {
        Edge previous = edges.get(key);
        if (previous == null) return;
        writeEdge(previous, null);
        journal(() -> writeEdge(null, previous));
    }

    /** Replaces {@code from} with {@code to} in the symbol table and its indexes; either may be null. */
    private void writeSymbol(Symbol from, Symbol to) {
        if (from != null) {
            symbols.remove(from.id());
            unindex(symbolsByFile, from.fileId(), from.id());
            if (!from.tombstoned()) unindex(liveBySimpleName, from.simpleName(), from.id());
        }
        if (to != null) {
            symbols.put(to.id(), to);
            symbolsByFile.computeIfAbsent(to.fileId(), k -> new HashSet<>()).add(to.id());
            if (!to.tombstoned()) {
                liveBySimpleName.computeIfAbsent(to.simpleName(), k -> new HashSet<>()).add(to.id());
            }
        }
    }

    /** Replaces {@code from} with {@code to} in the edge table and its indexes; either may be null. */
    private void writeEdge(Edge from, Edge to) {
        if (from != null) {
            EdgeKey key = from.key();
            edges.remove(key);
            unindex(outgoing, from.sourceId(), key);
            if (from.target().isInternal()) unindex(incoming, from.target().symbolId(), key);
            unindex(byTargetName, SymbolIds.simpleName(from.targetName()), key);
        }
        if (to != null) {
            EdgeKey key = to.key();
            edges.put(key, to);
            outgoing.computeIfAbsent(to.sourceId(), k -> new HashSet<>()).add(key);
            if (to.target().isInternal()) {
                incoming.computeIfAbsent(to.target().symbolId(), k -> new HashSet<>()).add(key);
            }
            byTargetName.computeIfAbsent(SymbolIds.simpleName(to.targetName()), k -> new HashSet<>()).add(key);
        }
    }

    private static <K, V> void unindex(Map<K, Set<V>> index, K key, V value) {
        Set<V> values = index.get(key);
        if (values == null) return;
        values.remove(value);
        if (values.isEmpty()) index.remove(key);
    }

    private void checkEdgeEndpoints(Edge edge) {
        Symbol source = symbols.get(edge.sourceId());
        if (source == null || source.tombstoned()) {
            throw new ConsistencyException("Edge source does not exist or is tombstoned: " + edge.key());
        }
        if (edge.target().isInternal()) {
            Symbol target = symbols.get(edge.target().symbolId());
            if (target == null || target.tombstoned()) {
                throw new ConsistencyException("Edge target does not exist or is tombstoned: " + edge.key());
            }
        }
    }

    // -----------------------------------------------------------------------
    // Transaction view
    // -----------------------------------------------------------------------

    private final class Tx implements FileTransaction {

        private final String fileId;
        private final Set<String> touchedSources = new HashSet<>();

        Tx(String fileId) {
            this.fileId = Objects.requireNonNull(fileId, "fileId");
        }

        @Override public String fileId() { return fileId; }

        @Override
        public SourceFile upsertFile(SourceFile file) {
            if (!fileId.equals(file.path())) {
                throw new ConsistencyException("Transaction for " + fileId + " cannot write file " + file.path());
            }
            putFile(file);
            return file;
        }

        @Override
        public void upsertSymbols(Collection<Symbol> toWrite) {
            for (Symbol symbol : toWrite) {
                requireOwned(symbol.fileId(), symbol.id());
                putSymbol(symbol.withTombstoned(false));
                touchedSources.add(symbol.id());
            }
        }

        @Override
        public void tombstoneSymbols(Collection<String> symbolIds) {
            for (String id : symbolIds) {
                Symbol symbol = symbols.get(id);
                if (symbol == null) {
                    throw new ConsistencyException("Cannot tombstone unknown symbol " + id);
                }
                requireOwned(symbol.fileId(), id);
                if (symbol.tombstoned()) continue;

                for (EdgeKey key : List.copyOf(outgoing.getOrDefault(id, Set.of()))) {
                    removeEdge(key);
                }
                for (EdgeKey key : List.copyOf(incoming.getOrDefault(id, Set.of()))) {
                    Edge inbound = edges.get(key);
                    removeEdge(key);
                    mergeEdge(inbound.asExternal());
                    touchedSources.add(inbound.sourceId());
                }
                putSymbol(symbol.withTombstoned(true));
            }
        }

        @Override
        public void upsertEdges(Collection<Edge> toWrite) {
            for (Edge edge : toWrite) {
                checkEdgeEndpoints(edge);
                requireOwned(symbols.get(edge.sourceId()).fileId(), edge.sourceId());
                Edge existing = edges.get(edge.key());
                long count = existing == null ? Math.max(1, edge.observationCount()) : existing.observationCount() + 1;
                putEdge(edge.withObservationCount(count));
                touchedSources.add(edge.sourceId());
            }
        }

        @Override
        public void deleteEdges(Collection<EdgeKey> keys) {
            for (EdgeKey key : keys) {
                Edge edge = edges.get(key);
                if (edge == null) continue;
                requireOwned(SymbolIds.fileOf(edge.sourceId()), edge.sourceId());
                removeEdge(key);
                touchedSources.add(edge.sourceId());
            }
        }

        @Override
        public void tombstoneFile() {
            SourceFile file = files.get(fileId);
            if (file == null) {
                log.debug("Tombstone requested for untracked file {}", fileId);
                return;
            }
            List<String> live = new ArrayList<>();
            Set<String> owned = symbolsByFile.getOrDefault(fileId, Set.of());
            for (Symbol s : InMemoryGraphStore.this.liveSymbols(owned)) live.add(s.id());
            tombstoneSymbols(live);
            putFile(file.tombstone());
        }

        /** Re-tagged edges can collide with an existing external edge; counts are summed. */
        private void mergeEdge(Edge edge) {
            Edge existing = edges.get(edge.key());
            putEdge(existing == null ? edge : edge.withObservationCount(existing.observationCount() + edge.observationCount()));
        }

        private void requireOwned(String ownerFileId, String symbolId) {
            if (!fileId.equals(ownerFileId)) {
                throw new ConsistencyException("Transaction for " + fileId + " cannot write " + symbolId);
            }
        }

        void refreshLeaves() {
            for (String id : touchedSources) {
                Symbol s = symbols.get(id);
                if (s == null || s.tombstoned()) continue;
                boolean leaf = true;
                for (EdgeKey key : outgoing.getOrDefault(id, Set.of())) {
                    if (edges.get(key).confidence() == Confidence.RESOLVED) {
                        leaf = false;
                        break;
                    }
                }
                if (s.leaf() != leaf) putSymbol(s.withLeaf(leaf));
            }
        }

        // Reads inside the transaction see its own writes; the write lock already excludes other threads.
        @Override public Optional<SourceFile> getFile(String path) { return InMemoryGraphStore.this.getFile(path); }
        @Override public List<SourceFile> files() { return InMemoryGraphStore.this.files(); }
        @Override public Optional<Symbol> getSymbol(String id) { return InMemoryGraphStore.this.getSymbol(id); }
        @Override public List<Symbol> symbolsIn(String id) { return InMemoryGraphStore.this.symbolsIn(id); }
        @Override public List<Symbol> allSymbolsIn(String id) { return InMemoryGraphStore.this.allSymbolsIn(id); }
        @Override public List<Symbol> liveSymbols() { return InMemoryGraphStore.this.liveSymbols(); }
        @Override public List<Symbol> symbolsNamed(String name) { return InMemoryGraphStore.this.symbolsNamed(name); }
        @Override public List<Edge> edgesFrom(String id) { return InMemoryGraphStore.this.edgesFrom(id); }
        @Override public List<Edge> edgesTo(String id) { return InMemoryGraphStore.this.edgesTo(id); }
        @Override public List<Edge> edgesNamed(String name) { return InMemoryGraphStore.this.edgesNamed(name); }
        @Override public List<Edge> edges() { return InMemoryGraphStore.this.edges(); }
    }
}
