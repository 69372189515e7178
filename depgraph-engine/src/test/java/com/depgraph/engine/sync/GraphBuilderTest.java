package com.depgraph.engine.sync;

import com.depgraph.engine.checksum.ChecksumIndex;
import com.depgraph.engine.graph.*;
import com.depgraph.engine.scan.ScannerRegistry;
import com.depgraph.engine.scan.SourceInput;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GraphBuilderTest {

    private static final String APP = "from util import helper\n\ndef run():\n    helper()\n";
    private static final String UTIL = "def helper():\n    pass\n";

    private static final String RUN = SymbolIds.of("app.py", "run", 0);
    private static final String HELPER = SymbolIds.of("util.py", "helper", 0);

    private InMemoryGraphStore store;
    private ChecksumIndex index;
    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        index = new ChecksumIndex();
        builder = builderOver(store);
    }

    @AfterEach
    void tearDown() {
        builder.close();
    }

    private GraphBuilder builderOver(GraphStore target) {
        return new GraphBuilder(target, index, ScannerRegistry.withDefaults(), new ConfidenceAnnotator(8), 2, 1);
    }

    private static List<SourceInput> tree(String app, String util) {
        return List.of(SourceInput.of("app.py", app), SourceInput.of("util.py", util));
    }

    private Edge callFromRun() {
        return store.edgesFrom(RUN).stream()
                .filter(e -> e.kind() == RelationKind.CALL && e.targetName().equals("helper"))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void firstSyncAddsFilesAndResolvesAcrossThem() {
        SyncReport report = builder.sync(tree(APP, UTIL));

        assertEquals(2, report.added());
        assertEquals(0, report.failed());
        assertEquals(List.of(RUN, HELPER), report.createdSymbols());
        assertEquals(Confidence.RESOLVED, callFromRun().confidence());
        assertEquals(HELPER, callFromRun().target().symbolId());

        Edge importEdge = store.edgesFrom(SymbolIds.module("app.py")).get(0);
        assertEquals(RelationKind.IMPORT, importEdge.kind());
        assertEquals(HELPER, importEdge.target().symbolId());
        assertFalse(store.getSymbol(RUN).orElseThrow().leaf());
        assertEquals(GraphBuilder.Phase.IDLE, builder.phase());
    }

    @Test
    void unchangedTreeIsANoOp() {
        builder.sync(tree(APP, UTIL));
        List<Edge> edges = store.edges();
        List<Symbol> symbols = store.liveSymbols();

        SyncReport second = builder.sync(tree(APP, UTIL));

        assertEquals(2, second.unchanged());
        assertFalse(second.hasChanges());
        assertEquals(edges, store.edges());
        assertEquals(symbols, store.liveSymbols());
    }

    @Test
    void removedDeclarationIsTombstonedAndCallersTurnExternal() {
        builder.sync(tree(APP, UTIL));

        SyncReport report = builder.sync(tree(APP, "def helper2():\n    pass\n"));

        assertEquals(1, report.modified());
        assertEquals(List.of(HELPER), report.tombstonedSymbols());
        assertEquals(List.of(SymbolIds.of("util.py", "helper2", 0)), report.createdSymbols());
        assertTrue(store.getSymbol(HELPER).orElseThrow().tombstoned());

        Edge call = callFromRun();
        assertEquals(Confidence.EXTERNAL, call.confidence());
        assertEquals("helper/0", call.target().descriptor());
        assertTrue(store.getSymbol(RUN).orElseThrow().leaf());
    }

    @Test
    void restoredDeclarationIsRelinked() {
        builder.sync(tree(APP, UTIL));
        builder.sync(tree(APP, "def helper2():\n    pass\n"));

        builder.sync(tree(APP, UTIL));

        assertFalse(store.getSymbol(HELPER).orElseThrow().tombstoned());
        assertEquals(Confidence.RESOLVED, callFromRun().confidence());
    }

    @Test
    void missingFileIsRemoved() {
        builder.sync(tree(APP, UTIL));

        SyncReport report = builder.sync(List.of(SourceInput.of("app.py", APP)));

        assertEquals(1, report.removed());
        assertEquals(List.of(HELPER), report.tombstonedSymbols());
        assertTrue(store.getFile("util.py").orElseThrow().tombstoned());
        assertTrue(store.symbolsIn("util.py").isEmpty());
        assertTrue(index.digestOf("util.py").isEmpty());
        assertEquals(Confidence.EXTERNAL, callFromRun().confidence());
    }

    @Test
    void renameIsARemovalPlusAnAddition() {
        builder.sync(tree(APP, UTIL));

        SyncReport report = builder.sync(List.of(SourceInput.of("app.py", APP), SourceInput.of("tools.py", UTIL)));

        assertEquals(1, report.removed());
        assertEquals(1, report.added());
        String moved = SymbolIds.of("tools.py", "helper", 0);
        assertTrue(store.getSymbol(HELPER).orElseThrow().tombstoned());
        assertEquals(moved, callFromRun().target().symbolId());
    }

    @Test
    void unparseableFileKeepsItsPreviousGraph() {
        builder.sync(tree(APP, UTIL));
        String broken = "def run():\n    s = \"\"\"never closed\n";

        SyncReport report = builder.sync(tree(broken, UTIL));

        assertEquals(1, report.failed());
        assertEquals(1, report.scanErrors().size());
        assertEquals(ScanError.Kind.UNPARSEABLE, report.scanErrors().get(0).kind());
        assertFalse(store.getSymbol(RUN).orElseThrow().tombstoned());
        assertEquals(Confidence.RESOLVED, callFromRun().confidence());

        assertEquals(1, builder.sync(tree(broken, UTIL)).scanErrors().size(), "still modified, scanned again");
        assertEquals(2, builder.sync(tree(APP, UTIL)).unchanged());
    }

    @Test
    void unreadableFileIsIsolated() {
        builder.sync(tree(APP, UTIL));

        SyncReport report = builder.sync(List.of(
                SourceInput.unreadable("app.py", "permission denied"),
                SourceInput.of("util.py", UTIL)));

        assertEquals(List.of(ScanError.unreadable("app.py", "permission denied")), report.scanErrors());
        assertEquals(0, report.removed());
        assertEquals(1, report.unchanged());
        assertFalse(store.getSymbol(RUN).orElseThrow().tombstoned());
        assertTrue(index.digestOf("app.py").isPresent());
    }

    @Test
    void failedCommitIsRetriedOnce() {
        FlakyGraphStore flaky = new FlakyGraphStore(store).failCommits("util.py", 1);
        builder.close();
        builder = builderOver(flaky);

        SyncReport report = builder.sync(tree(APP, UTIL));

        assertTrue(report.commitErrors().isEmpty());
        assertEquals(2, report.added());
        assertEquals(2, flaky.attempts("util.py"));
        assertTrue(store.getSymbol(HELPER).isPresent());
    }

    @Test
    void exhaustedRetriesLeaveTheFileForTheNextSync() {
        FlakyGraphStore flaky = new FlakyGraphStore(store).failCommits("util.py", 2);
        builder.close();
        builder = builderOver(flaky);

        SyncReport report = builder.sync(tree(APP, UTIL));

        assertEquals(1, report.commitErrors().size());
        CommitError error = report.commitErrors().get(0);
        assertEquals("util.py", error.path());
        assertEquals(2, error.attempts());
        assertEquals(1, report.added());
        assertEquals(1, report.failed());
        assertTrue(store.getFile("util.py").isEmpty());
        assertTrue(index.digestOf("util.py").isEmpty());

        SyncReport retry = builder.sync(tree(APP, UTIL));
        assertEquals(1, retry.added());
        assertEquals(Confidence.RESOLVED, callFromRun().confidence());
    }

    @Test
    void failedRelinkCommitIsCountedAsAFailure() {
        builder.sync(List.of(SourceInput.of("app.py", APP)));
        assertEquals(Confidence.EXTERNAL, callFromRun().confidence());
        FlakyGraphStore flaky = new FlakyGraphStore(store).failCommits("app.py", 2);
        builder.close();
        builder = builderOver(flaky);

        SyncReport report = builder.sync(tree(APP, UTIL));

        assertEquals(1, report.added());
        assertEquals(1, report.unchanged());
        assertEquals(1, report.commitErrors().size());
        assertEquals("app.py", report.commitErrors().get(0).path());
        assertEquals(1, report.failed());
        assertEquals(Confidence.EXTERNAL, callFromRun().confidence());
    }

    @Test
    void consistencyViolationAbortsTheRun() {
        FlakyGraphStore flaky = new FlakyGraphStore(store).breakInvariant("util.py");
        builder.close();
        builder = builderOver(flaky);

        assertThrows(GraphStore.ConsistencyException.class, () -> builder.sync(tree(APP, UTIL)));

        assertTrue(index.digestOf("app.py").isPresent(), "committed before the violation");
        assertTrue(index.digestOf("util.py").isEmpty(), "left for the next sync");
        assertEquals(GraphBuilder.Phase.IDLE, builder.phase());
    }

    @Test
    void cancelledRunCommitsNothingAndForgetsNothing() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        SyncReport report = builder.sync(tree(APP, UTIL), token);

        assertTrue(report.cancelled());
        assertEquals(0, report.added());
        assertTrue(store.files().isEmpty());
        assertTrue(index.entries().isEmpty());

        assertEquals(2, builder.sync(tree(APP, UTIL)).added());
    }

    @Test
    void duplicatePathsKeepTheFirstInput() {
        SyncReport report = builder.sync(List.of(
                SourceInput.of("util.py", UTIL),
                SourceInput.of("util.py", "def other():\n    pass\n")));

        assertEquals(1, report.added());
        assertTrue(store.getSymbol(HELPER).isPresent());
        assertTrue(store.getSymbol(SymbolIds.of("util.py", "other", 0)).isEmpty());
    }

    @Test
    void fileWithoutScannerIsTrackedWithoutSymbols() {
        SyncReport report = builder.sync(List.of(SourceInput.of("docs/README.md", "# Notes\n")));

        assertEquals(1, report.added());
        SourceFile readme = store.getFile("docs/README.md").orElseThrow();
        assertEquals("md", readme.language());
        assertTrue(store.symbolsIn("docs/README.md").isEmpty());
    }

    @Test
    void reobservedEdgeCountsUp() {
        builder.sync(tree(APP, UTIL));
        assertEquals(1, callFromRun().observationCount());

        builder.sync(tree(APP + "\n# touched\n", UTIL));

        assertEquals(2, callFromRun().observationCount());
    }

    @Test
    void editedBodyDropsVanishedEdges() {
        builder.sync(tree(APP, UTIL));

        builder.sync(tree("from util import helper\n\ndef run():\n    print()\n", UTIL));

        List<String> targets = store.edgesFrom(RUN).stream().map(Edge::targetName).collect(Collectors.toList());
        assertEquals(List.of("print"), targets);
        assertTrue(store.edgesTo(HELPER).stream().allMatch(e -> e.kind() == RelationKind.IMPORT));
    }
}
