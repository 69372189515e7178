package com.depgraph.engine.sync;

import com.depgraph.engine.checksum.ChangeKind;
import com.depgraph.engine.checksum.ChecksumIndex;
import com.depgraph.engine.graph.*;
import com.depgraph.engine.graph.GraphStore.CommitException;
import com.depgraph.engine.graph.GraphStore.ConsistencyException;
import com.depgraph.engine.scan.*;
import com.depgraph.engine.sync.ConfidenceAnnotator.SymbolLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * The sync engine. A run classifies every input against the {@link ChecksumIndex}, scans changed
 * files on a worker pool, and commits each file's delta in its own store transaction, in path
 * order. Removed files are tombstoned first.
 *
 * <p>Per-file failures are collected in the {@link SyncReport}; a {@link ConsistencyException}
 * aborts the run. After the commits, edges anywhere in the graph that name a symbol created or
 * tombstoned by the run are re-annotated.
 */
public class GraphBuilder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    public enum Phase { IDLE, SCANNING, DIFFING, COMMITTING }

    private final GraphStore store;
    private final ChecksumIndex index;
    private final ScannerRegistry scanners;
    private final ConfidenceAnnotator annotator;
    private final int commitRetries;
    private final ExecutorService workers;

    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.IDLE);
    // One run at a time; queries are unaffected.
    private final Object runLock = new Object();

    public GraphBuilder(GraphStore store, ChecksumIndex index, ScannerRegistry scanners,
                        ConfidenceAnnotator annotator, int scannerThreads, int commitRetries) {
        this.store = store;
        this.index = index;
        this.scanners = scanners;
        this.annotator = annotator;
        this.commitRetries = Math.max(0, commitRetries);
        this.workers = Executors.newFixedThreadPool(Math.max(1, scannerThreads), scanThreadFactory());
    }

    public Phase phase() {
        return phase.get();
    }

    public SyncReport sync(Collection<SourceInput> inputs) {
        return sync(inputs, CancellationToken.none());
    }

    public SyncReport sync(Collection<SourceInput> inputs, CancellationToken cancellation) {
        synchronized (runLock) {
            try {
                return new Run(inputs, cancellation).execute();
            } finally {
                phase.set(Phase.IDLE);
            }
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static ThreadFactory scanThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "depgraph-scan-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // -----------------------------------------------------------------------
    // One run
    // -----------------------------------------------------------------------

    /** A changed file awaiting scan and commit; {@code previousDigest} is restored if it fails. */
    private record Change(SourceInput input, ChangeKind kind, String previousDigest) {
        String path() { return input.path(); }
    }

    private record ScanOutcome(ScanResult result, boolean scanned, ScanError error) {}

    private record FileDelta(List<String> created, List<String> tombstoned,
                             int edgesWritten, int edgesDeleted, int symbolsUpdated) {}

    /** Identity of a scanned reference: edges with the same origin are re-annotated together. */
    private record Origin(String sourceId, RelationKind kind, ReferenceForm form, String targetName, int targetArity) {
        static Origin of(Edge e) {
            return new Origin(e.sourceId(), e.kind(), e.form(), e.targetName(), e.targetArity());
        }
    }

    private static final class CommitsExhausted extends Exception {
        final CommitError error;

        CommitsExhausted(CommitError error) {
            super(error.reason());
            this.error = error;
        }
    }

    private final class Run {

        private final List<SourceInput> inputs;
        private final CancellationToken cancellation;
        private final long startNanos = System.nanoTime();

        private int added;
        private int modified;
        private int removed;
        private int unchanged;
        private int failed;
        private boolean cancelled;
        private final List<ScanError> scanErrors = new ArrayList<>();
        private final List<CommitError> commitErrors = new ArrayList<>();
        private final List<String> created = new ArrayList<>();
        private final List<String> tombstoned = new ArrayList<>();
        private final Set<String> touchedNames = new TreeSet<>();

        // Changes classified but not yet finished; their index entries are restored on abort.
        private final Map<String, Change> unfinished = new LinkedHashMap<>();
        private final Map<String, Future<ScanOutcome>> scans = new HashMap<>();

        Run(Collection<SourceInput> inputs, CancellationToken cancellation) {
            List<SourceInput> sorted = new ArrayList<>(inputs);
            sorted.sort(Comparator.comparing(SourceInput::path));
            this.inputs = sorted;
            this.cancellation = cancellation;
        }

        SyncReport execute() {
            log.info("Sync started: {} input files", inputs.size());
            try {
                classify();
                List<String> removals = index.pendingRemovals();
                submitScans();
                tombstoneRemoved(removals);
                commitChanges();
                relink();
            } catch (ConsistencyException e) {
                abort();
                log.error("Consistency violation, sync aborted: {}", e.getMessage(), e);
                throw e;
            }

            long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            SyncReport report = new SyncReport(added, modified, removed, unchanged, failed,
                    scanErrors, commitErrors, created, tombstoned, cancelled, millis);
            log.info("Sync finished in {} ms: {} added, {} modified, {} removed, {} unchanged, {} failed{}",
                    millis, added, modified, removed, unchanged, failed, cancelled ? " (cancelled)" : "");
            return report;
        }

        private void classify() {
            index.beginWalk();
            Set<String> seen = new HashSet<>();
            for (SourceInput input : inputs) {
                String path = input.path();
                if (!seen.add(path)) {
                    log.warn("Duplicate input path {}; keeping the first", path);
                    continue;
                }
                if (!input.isReadable()) {
                    index.markUnreadable(path);
                    scanErrors.add(ScanError.unreadable(path, input.readError()));
                    failed++;
                    log.warn("Cannot read {}: {}", path, input.readError());
                    continue;
                }
                String previous = index.digestOf(path).orElse(null);
                ChangeKind kind = index.record(path, input.digest());
                log.debug("{}: {}", path, kind);
                if (kind == ChangeKind.UNCHANGED) {
                    unchanged++;
                } else {
                    unfinished.put(path, new Change(input, kind, previous));
                }
            }
        }

        private void submitScans() {
            if (unfinished.isEmpty() || cancellation.isCancelled()) return;
            phase.set(Phase.SCANNING);
            for (Change change : unfinished.values()) {
                scans.put(change.path(), workers.submit(() -> scan(change.input())));
            }
        }

        private ScanOutcome scan(SourceInput input) {
            Optional<SourceScanner> scanner = scanners.forPath(input.path());
            if (scanner.isEmpty()) {
                return new ScanOutcome(ScanResult.empty(languageOf(input)), false, null);
            }
            try {
                return new ScanOutcome(scanner.get().scan(input.path(), input.content()), true, null);
            } catch (SourceScanner.ScanException e) {
                return new ScanOutcome(null, true, ScanError.unparseable(input.path(), e.getMessage()));
            } catch (RuntimeException e) {
                return new ScanOutcome(null, true, ScanError.unparseable(input.path(),
                        "scanner failure: " + e));
            }
        }

        private void tombstoneRemoved(List<String> removals) {
            for (String path : removals) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    return;
                }
                phase.set(Phase.COMMITTING);
                List<Symbol> live = store.symbolsIn(path);
                try {
                    commitWithRetry(path, tx -> {
                        tx.tombstoneFile();
                        return null;
                    });
                } catch (CommitsExhausted e) {
                    // The path stays in the index, so the next run detects the removal again.
                    commitErrors.add(e.error);
                    failed++;
                    continue;
                }
                index.confirmRemoved(path);
                removed++;
                for (Symbol s : live) {
                    if (s.isModule()) continue;
                    tombstoned.add(s.id());
                    touchedNames.add(s.simpleName());
                }
                log.debug("{}: tombstoned with {} symbols", path, live.size());
            }
        }

        private void commitChanges() {
            for (Change change : new ArrayList<>(unfinished.values())) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    break;
                }
                ScanOutcome outcome = awaitScan(change);
                if (outcome == null) {
                    cancelled = true;
                    break;
                }
                if (outcome.error() != null) {
                    index.restore(change.path(), change.previousDigest());
                    unfinished.remove(change.path());
                    scanErrors.add(outcome.error());
                    failed++;
                    log.warn("Cannot parse {}: {}", change.path(), outcome.error().reason());
                    continue;
                }

                FileDelta delta;
                try {
                    delta = commitWithRetry(change.path(), tx -> applyScan(tx, change, outcome));
                } catch (CommitsExhausted e) {
                    index.restore(change.path(), change.previousDigest());
                    unfinished.remove(change.path());
                    commitErrors.add(e.error);
                    failed++;
                    continue;
                }
                unfinished.remove(change.path());
                if (change.kind() == ChangeKind.ADDED) added++;
                else modified++;
                created.addAll(delta.created());
                tombstoned.addAll(delta.tombstoned());
                log.debug("{}: {} symbols created, {} updated, {} tombstoned; {} edges written, {} deleted",
                        change.path(), delta.created().size(), delta.symbolsUpdated(), delta.tombstoned().size(),
                        delta.edgesWritten(), delta.edgesDeleted());
            }
            if (cancelled) abort();
        }

        private ScanOutcome awaitScan(Change change) {
            Future<ScanOutcome> future = scans.get(change.path());
            if (future == null) return null;
            try {
                return future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            } catch (ExecutionException e) {
                return new ScanOutcome(null, true, ScanError.unparseable(change.path(),
                        "scanner failure: " + e.getCause()));
            }
        }

        /** Cancels outstanding scans and restores the index entries of unfinished files. */
        private void abort() {
            for (Future<ScanOutcome> future : scans.values()) future.cancel(true);
            for (Change change : unfinished.values()) {
                index.restore(change.path(), change.previousDigest());
            }
            if (!unfinished.isEmpty()) {
                log.info("{} changed files left for the next sync", unfinished.size());
            }
            unfinished.clear();
        }

        // --- per-file delta ---

        private FileDelta applyScan(FileTransaction tx, Change change, ScanOutcome outcome) {
            phase.set(Phase.DIFFING);
            String path = change.path();
            ScanResult result = outcome.result();

            Map<String, Symbol> oldSymbols = new LinkedHashMap<>();
            for (Symbol s : tx.symbolsIn(path)) oldSymbols.put(s.id(), s);

            Map<String, Symbol> newSymbols = new LinkedHashMap<>();
            if (outcome.scanned()) {
                String moduleId = SymbolIds.module(path);
                int lines = Math.max(1, change.input().content().split("\n", -1).length);
                newSymbols.put(moduleId, withOldLeaf(new Symbol(moduleId, path, SymbolIds.MODULE_NAME,
                        SymbolIds.MODULE_NAME, 0, 1, lines, true, false), oldSymbols));
            }
            for (SymbolDraft draft : result.symbols()) {
                String id = SymbolIds.of(path, draft.name(), draft.arity());
                if (newSymbols.containsKey(id)) {
                    log.warn("{}: duplicate symbol {}; keeping the first", path, id);
                    continue;
                }
                newSymbols.put(id, withOldLeaf(new Symbol(id, path, draft.name(), draft.signature(), draft.arity(),
                        draft.lineStart(), draft.lineEnd(), true, false), oldSymbols));
            }

            List<Symbol> upserts = new ArrayList<>();
            List<String> createdIds = new ArrayList<>();
            int updated = 0;
            for (Symbol s : newSymbols.values()) {
                Symbol old = oldSymbols.get(s.id());
                if (old == null) {
                    upserts.add(s);
                    if (!s.isModule()) createdIds.add(s.id());
                } else if (old.declarationDiffers(s)) {
                    upserts.add(s);
                    updated++;
                }
            }
            List<String> removedIds = new ArrayList<>();
            for (String id : oldSymbols.keySet()) {
                if (!newSymbols.containsKey(id)) removedIds.add(id);
            }

            // Resolve against the graph as it will look once this file is committed.
            SymbolLookup lookup = simpleName -> {
                List<Symbol> visible = new ArrayList<>();
                for (Symbol s : tx.symbolsNamed(simpleName)) {
                    if (!s.fileId().equals(path)) visible.add(s);
                }
                for (Symbol s : newSymbols.values()) {
                    if (s.simpleName().equals(simpleName)) visible.add(s);
                }
                return visible;
            };

            Map<EdgeKey, Edge> fresh = new LinkedHashMap<>();
            String moduleId = SymbolIds.module(path);
            for (ReferenceDraft ref : result.references()) {
                String sourceId = SymbolIds.of(path, ref.callerName(), ref.callerArity());
                if (!newSymbols.containsKey(sourceId)) sourceId = moduleId;
                if (!newSymbols.containsKey(sourceId)) continue;
                for (Edge edge : annotator.annotate(sourceId, ref.targetName(), ref.targetArity(),
                        ref.kind(), ref.form(), lookup)) {
                    fresh.merge(edge.key(), edge, GraphBuilder::mostCertain);
                }
            }

            List<EdgeKey> vanished = new ArrayList<>();
            for (String id : oldSymbols.keySet()) {
                if (removedIds.contains(id)) continue;
                for (Edge e : tx.edgesFrom(id)) {
                    if (!fresh.containsKey(e.key())) vanished.add(e.key());
                }
            }

            phase.set(Phase.COMMITTING);
            tx.upsertFile(new SourceFile(path, result.language(), change.input().digest(), Instant.now(), false));
            tx.upsertSymbols(upserts);
            tx.deleteEdges(vanished);
            tx.tombstoneSymbols(removedIds);
            tx.upsertEdges(fresh.values());

            List<String> tombstonedIds = new ArrayList<>();
            for (String id : removedIds) {
                Symbol old = oldSymbols.get(id);
                if (old.isModule()) continue;
                tombstonedIds.add(id);
                touchedNames.add(old.simpleName());
            }
            for (String id : createdIds) touchedNames.add(newSymbols.get(id).simpleName());
            return new FileDelta(createdIds, tombstonedIds, fresh.size(), vanished.size(), updated);
        }

        // --- relink ---

        private void relink() {
            if (touchedNames.isEmpty()) return;
            phase.set(Phase.DIFFING);

            // sourceFile -> (edges to delete, edges to write)
            Map<String, List<Edge>> deletions = new TreeMap<>();
            Map<String, List<Edge>> writes = new TreeMap<>();
            store.query(reader -> {
                SymbolLookup lookup = reader::symbolsNamed;
                for (String name : touchedNames) {
                    Map<Origin, List<Edge>> byOrigin = new LinkedHashMap<>();
                    for (Edge e : reader.edgesNamed(name)) {
                        byOrigin.computeIfAbsent(Origin.of(e), k -> new ArrayList<>()).add(e);
                    }
                    byOrigin.forEach((origin, current) -> {
                        List<Edge> recomputed = annotator.annotate(origin.sourceId(), origin.targetName(),
                                origin.targetArity(), origin.kind(), origin.form(), lookup);
                        if (sameEdges(current, recomputed)) return;
                        long count = 1;
                        for (Edge e : current) count = Math.max(count, e.observationCount());
                        String file = SymbolIds.fileOf(origin.sourceId());
                        deletions.computeIfAbsent(file, k -> new ArrayList<>()).addAll(current);
                        List<Edge> target = writes.computeIfAbsent(file, k -> new ArrayList<>());
                        for (Edge e : recomputed) target.add(e.withObservationCount(count));
                    });
                }
                return null;
            });
            if (deletions.isEmpty()) return;

            phase.set(Phase.COMMITTING);
            for (String file : deletions.keySet()) {
                List<EdgeKey> keys = new ArrayList<>();
                for (Edge e : deletions.get(file)) keys.add(e.key());
                Map<EdgeKey, Edge> merged = new LinkedHashMap<>();
                for (Edge e : writes.get(file)) merged.merge(e.key(), e, GraphBuilder::mostCertain);
                try {
                    commitWithRetry(file, tx -> {
                        tx.deleteEdges(keys);
                        tx.upsertEdges(merged.values());
                        return null;
                    });
                    log.debug("{}: re-linked {} edges", file, merged.size());
                } catch (CommitsExhausted e) {
                    if (!alreadyFailed(file)) failed++;
                    commitErrors.add(e.error);
                }
            }
        }

        private boolean alreadyFailed(String path) {
            for (ScanError e : scanErrors) {
                if (e.path().equals(path)) return true;
            }
            for (CommitError e : commitErrors) {
                if (e.path().equals(path)) return true;
            }
            return false;
        }

        private boolean sameEdges(List<Edge> current, List<Edge> recomputed) {
            if (current.size() != recomputed.size()) return false;
            Map<EdgeKey, Confidence> existing = new HashMap<>();
            for (Edge e : current) existing.put(e.key(), e.confidence());
            for (Edge e : recomputed) {
                if (existing.get(e.key()) != e.confidence()) return false;
            }
            return true;
        }

        private <T> T commitWithRetry(String path, Function<FileTransaction, T> work) throws CommitsExhausted {
            int attempts = 1 + commitRetries;
            CommitException last = null;
            for (int attempt = 1; attempt <= attempts; attempt++) {
                try {
                    return store.inTransaction(path, work);
                } catch (CommitException e) {
                    last = e;
                    log.warn("Commit of {} failed (attempt {}/{}): {}", path, attempt, attempts, e.getMessage());
                }
            }
            throw new CommitsExhausted(new CommitError(path, last.getMessage(), attempts));
        }
    }

    private static Symbol withOldLeaf(Symbol fresh, Map<String, Symbol> oldSymbols) {
        Symbol old = oldSymbols.get(fresh.id());
        return old == null ? fresh : fresh.withLeaf(old.leaf());
    }

    /** Two scanned references produced the same edge; the more certain classification wins. */
    private static Edge mostCertain(Edge a, Edge b) {
        return Confidence.mostCertain(a.confidence(), b.confidence()) == a.confidence() ? a : b;
    }

    private static String languageOf(SourceInput input) {
        String ext = input.extension();
        return ext.isEmpty() ? "unknown" : ext;
    }
}
