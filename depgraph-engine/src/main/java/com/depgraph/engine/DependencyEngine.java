package com.depgraph.engine;

import com.depgraph.engine.analysis.Cycle;
import com.depgraph.engine.analysis.CycleDetector;
import com.depgraph.engine.analysis.ImpactAnalyzer;
import com.depgraph.engine.analysis.ImpactEntry;
import com.depgraph.engine.checksum.ChecksumIndex;
import com.depgraph.engine.config.EngineConfig;
import com.depgraph.engine.graph.*;
import com.depgraph.engine.persist.GraphSnapshotSerializer;
import com.depgraph.engine.scan.ScannerRegistry;
import com.depgraph.engine.scan.SourceInput;
import com.depgraph.engine.sync.CancellationToken;
import com.depgraph.engine.sync.ConfidenceAnnotator;
import com.depgraph.engine.sync.GraphBuilder;
import com.depgraph.engine.sync.SyncReport;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Query API of the dependency graph. Wires a {@link GraphStore}, its {@link ChecksumIndex}, the
 * {@link GraphBuilder} and the analyzers together.
 *
 * <p>Syncs run one at a time; queries may run concurrently with each other and with a sync, and
 * always observe whole files. Close the engine to stop the scanner pool.
 */
public class DependencyEngine implements AutoCloseable {

    private final InMemoryGraphStore store;
    private final ChecksumIndex index;
    private final GraphBuilder builder;
    private final CycleDetector cycleDetector;
    private final ImpactAnalyzer impactAnalyzer;

    DependencyEngine(InMemoryGraphStore store, ChecksumIndex index, ScannerRegistry scanners, EngineConfig config) {
        this.store = store;
        this.index = index;
        this.builder = new GraphBuilder(store, index, scanners,
                new ConfidenceAnnotator(config.getMaxDynamicCandidates()),
                config.getScannerThreads(), config.getCommitRetries());
        this.cycleDetector = new CycleDetector(store, config.getCycleBudgetFactor());
        this.impactAnalyzer = new ImpactAnalyzer(store, config.getDefaultImpactDepth(),
                config.getMaxFanOut(), config.getMaxImpactResults());
    }

    /** An empty engine with the built-in scanners. */
    public static DependencyEngine create(EngineConfig config) {
        return create(config, ScannerRegistry.withDefaults());
    }

    public static DependencyEngine create(EngineConfig config, ScannerRegistry scanners) {
        return new DependencyEngine(new InMemoryGraphStore(), new ChecksumIndex(), scanners, config);
    }

    /**
     * Loads the engine from a snapshot written by {@link #save}; a missing file yields an empty
     * engine.
     *
     * @throws GraphSnapshotSerializer.SnapshotException if the snapshot exists but cannot be loaded
     */
    public static DependencyEngine open(Path snapshotPath, EngineConfig config) {
        if (!Files.exists(snapshotPath)) {
            return create(config);
        }
        GraphSnapshotSerializer.Loaded loaded = new GraphSnapshotSerializer().read(snapshotPath);
        return new DependencyEngine(loaded.store(), loaded.index(), ScannerRegistry.withDefaults(), config);
    }

    public void save(Path snapshotPath) {
        new GraphSnapshotSerializer().write(store, index, snapshotPath);
    }

    // -----------------------------------------------------------------------
    // Sync
    // -----------------------------------------------------------------------

    /**
     * Brings the graph in line with {@code files}, the complete, already-filtered file set of the
     * tree. Known paths missing from the set are treated as removed.
     *
     * @throws GraphStore.ConsistencyException if the sync hit an engine invariant violation
     */
    public SyncReport sync(Collection<SourceInput> files) {
        return builder.sync(files);
    }

    public SyncReport sync(Collection<SourceInput> files, CancellationToken cancellation) {
        return builder.sync(files, cancellation);
    }

    public GraphBuilder.Phase phase() {
        return builder.phase();
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    public List<Cycle> findCycles() {
        return cycleDetector.findCycles();
    }

    /** Lazy, restartable view of the cycles. */
    public Iterable<Cycle> cycles() {
        return cycleDetector.cycles();
    }

    public List<ImpactEntry> impactOf(String symbolId) {
        return impactAnalyzer.impactOf(symbolId);
    }

    public List<ImpactEntry> impactOf(String symbolId, int maxDepth) {
        return impactAnalyzer.impactOf(symbolId, maxDepth);
    }

    /** Live symbols of a file, module pseudo-symbol included; empty for unknown or removed files. */
    public List<Symbol> symbolsIn(String fileId) {
        return store.symbolsIn(fileId);
    }

    public Optional<Symbol> getSymbol(String symbolId) {
        return store.getSymbol(symbolId);
    }

    public List<Edge> edgesFrom(String symbolId) {
        return store.edgesFrom(symbolId);
    }

    public List<Edge> edgesTo(String symbolId) {
        return store.edgesTo(symbolId);
    }

    /** Tracked files that are not tombstoned. */
    public List<SourceFile> sourceFiles() {
        List<SourceFile> live = new ArrayList<>();
        for (SourceFile file : store.files()) {
            if (!file.tombstoned()) live.add(file);
        }
        return live;
    }

    /** Live symbols, other than module pseudo-symbols, that nothing in the tree refers to. */
    public List<Symbol> orphans() {
        return store.query(reader -> {
            List<Symbol> orphans = new ArrayList<>();
            for (Symbol s : reader.liveSymbols()) {
                if (!s.isModule() && reader.edgesTo(s.id()).isEmpty()) orphans.add(s);
            }
            return orphans;
        });
    }

    /** Edges whose target could not be pinned statically. */
    public List<Edge> uncertainEdges() {
        return store.query(reader -> {
            List<Edge> uncertain = new ArrayList<>();
            for (Edge e : reader.edges()) {
                if (e.confidence() == Confidence.DYNAMIC) uncertain.add(e);
            }
            return uncertain;
        });
    }

    /** Snapshot of the checksum index, sorted by path. */
    public SortedMap<String, String> checksums() {
        return index.entries();
    }

    @Override
    public void close() {
        builder.close();
    }
}
