package com.depgraph.engine;

import com.depgraph.engine.analysis.Cycle;
import com.depgraph.engine.analysis.ImpactEntry;
import com.depgraph.engine.config.EngineConfig;
import com.depgraph.engine.graph.Confidence;
import com.depgraph.engine.graph.Edge;
import com.depgraph.engine.graph.Symbol;
import com.depgraph.engine.graph.SymbolIds;
import com.depgraph.engine.scan.SourceInput;
import com.depgraph.engine.sync.ScanError;
import com.depgraph.engine.sync.SyncReport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DependencyEngineTest {

    private static final String A = "def a():\n    b()\n";
    private static final String B = "def b():\n    c()\n";
    private static final String C = "def c():\n    a()\n";
    private static final String CHAIN = String.join("\n",
            "def a():",
            "    pass",
            "",
            "def b():",
            "    a()",
            "",
            "def c():",
            "    b()",
            "",
            "def d():",
            "    c()",
            "");

    private static final String A_ID = SymbolIds.of("a.py", "a", 0);
    private static final String B_ID = SymbolIds.of("b.py", "b", 0);

    @TempDir
    Path tmp;

    private DependencyEngine engine;

    @BeforeEach
    void setUp() {
        engine = DependencyEngine.create(EngineConfig.defaults().withScannerThreads(2));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static List<SourceInput> files(String... pathsAndContents) {
        List<SourceInput> inputs = new ArrayList<>();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            inputs.add(SourceInput.of(pathsAndContents[i], pathsAndContents[i + 1]));
        }
        return inputs;
    }

    private static List<String> ids(List<ImpactEntry> entries) {
        return entries.stream().map(e -> e.symbol().name() + "@" + e.depth()).collect(Collectors.toList());
    }

    @Test
    void syncingTheSameTreeTwiceChangesNothing() {
        List<SourceInput> tree = files("a.py", A, "b.py", B, "c.py", C);
        engine.sync(tree);
        List<Edge> edges = new ArrayList<>();
        for (Symbol s : engine.symbolsIn("a.py")) edges.addAll(engine.edgesFrom(s.id()));
        List<Cycle> cycles = engine.findCycles();

        SyncReport second = engine.sync(tree);

        assertFalse(second.hasChanges());
        assertEquals(3, second.unchanged());
        List<Edge> after = new ArrayList<>();
        for (Symbol s : engine.symbolsIn("a.py")) after.addAll(engine.edgesFrom(s.id()));
        assertEquals(edges, after);
        assertEquals(cycles, engine.findCycles());
    }

    @Test
    void deletedFileLeavesNoDependents() {
        engine.sync(files("a.py", A, "b.py", B, "c.py", C));
        assertFalse(engine.impactOf(B_ID).isEmpty());

        SyncReport report = engine.sync(files("a.py", A, "c.py", C));

        assertEquals(1, report.removed());
        assertTrue(engine.impactOf(B_ID).isEmpty());
        assertTrue(engine.symbolsIn("b.py").isEmpty());
        assertTrue(engine.findCycles().isEmpty());
        assertEquals(List.of("a.py", "c.py"),
                engine.sourceFiles().stream().map(f -> f.path()).collect(Collectors.toList()));
    }

    @Test
    void threeFileLoopIsOneCycleAndATailDoesNotAddOne() {
        engine.sync(files("a.py", A, "b.py", B, "c.py", C));

        List<Cycle> cycles = engine.findCycles();
        assertEquals(1, cycles.size());
        assertEquals(List.of(A_ID, B_ID, SymbolIds.of("c.py", "c", 0)), cycles.get(0).symbolIds());

        engine.sync(files("a.py", A, "b.py", B, "c.py", C, "d.py", "def d():\n    a()\n"));
        assertEquals(1, engine.findCycles().size());
    }

    @Test
    void dynamicDispatchNeverClosesACycle() {
        String dynamicC = "import mod\n\ndef c():\n    getattr(mod, \"a\")()\n";
        engine.sync(files("a.py", A, "b.py", B, "c.py", dynamicC));

        assertTrue(engine.findCycles().isEmpty());
        List<Edge> uncertain = engine.uncertainEdges();
        assertEquals(1, uncertain.size());
        assertEquals(Confidence.DYNAMIC, uncertain.get(0).confidence());
        assertEquals(A_ID, uncertain.get(0).target().symbolId());
    }

    @Test
    void impactIsBoundedByDepth() {
        engine.sync(files("chain.py", CHAIN));
        String a = SymbolIds.of("chain.py", "a", 0);

        assertEquals(List.of("b@1", "c@2"), ids(engine.impactOf(a, 2)));
        assertEquals(List.of("b@1", "c@2", "d@3"), ids(engine.impactOf(a)));
        assertEquals(List.of("d"), engine.orphans().stream().map(Symbol::name).collect(Collectors.toList()));
    }

    @Test
    void unreadableFileIsReportedOnceAndKeepsItsSymbols() {
        engine.sync(files("a.py", A, "b.py", B, "c.py", C));

        SyncReport report = engine.sync(List.of(
                SourceInput.of("a.py", A),
                SourceInput.unreadable("b.py", "Permission denied"),
                SourceInput.of("c.py", C)));

        assertEquals(1, report.scanErrors().size());
        assertEquals(ScanError.Kind.UNREADABLE, report.scanErrors().get(0).kind());
        assertEquals(List.of(SymbolIds.module("b.py"), B_ID),
                engine.symbolsIn("b.py").stream().map(Symbol::id).collect(Collectors.toList()));
        assertEquals(1, engine.findCycles().size());
    }

    @Test
    void unreadableFileDoesNotHoldBackAnotherFileChangedInTheSameRun() {
        engine.sync(files("a.py", A, "b.py", B, "c.py", C));
        String grownA = A + "\ndef a2():\n    pass\n";

        SyncReport report = engine.sync(List.of(
                SourceInput.of("a.py", grownA),
                SourceInput.unreadable("b.py", "permission denied"),
                SourceInput.of("c.py", C)));

        assertEquals(1, report.modified());
        assertEquals(1, report.unchanged());
        assertEquals(1, report.failed());
        assertEquals(1, report.scanErrors().size());
        assertEquals("b.py", report.scanErrors().get(0).path());
        String a2 = SymbolIds.of("a.py", "a2", 0);
        assertEquals(List.of(a2), report.createdSymbols());
        assertFalse(engine.getSymbol(a2).orElseThrow().tombstoned());
        assertEquals(List.of(SymbolIds.module("b.py"), B_ID),
                engine.symbolsIn("b.py").stream().map(Symbol::id).collect(Collectors.toList()));
        assertEquals(1, engine.findCycles().size());
    }

    @Test
    void renamedFileIsARemovalAndAnAddition() {
        engine.sync(files("a.py", A, "b.py", B, "c.py", C));

        SyncReport report = engine.sync(files("a.py", A, "b2.py", B, "c.py", C));

        assertEquals(1, report.removed());
        assertEquals(1, report.added());
        assertTrue(engine.getSymbol(B_ID).orElseThrow().tombstoned());
        Cycle cycle = engine.findCycles().get(0);
        assertTrue(cycle.contains(SymbolIds.of("b2.py", "b", 0)));
    }

    @Test
    void savedEngineReopensWithTheSameGraph() {
        List<SourceInput> tree = files("a.py", A, "b.py", B, "c.py", C);
        engine.sync(tree);
        Path snapshot = tmp.resolve("state").resolve("graph_snapshot.json");
        engine.save(snapshot);

        try (DependencyEngine reopened = DependencyEngine.open(snapshot, EngineConfig.defaults().withScannerThreads(1))) {
            assertEquals(engine.findCycles(), reopened.findCycles());
            assertEquals(engine.checksums(), reopened.checksums());
            assertEquals(engine.symbolsIn("b.py"), reopened.symbolsIn("b.py"));
            assertEquals(3, reopened.sync(tree).unchanged());
        }
    }

    @Test
    void openingWithoutSnapshotGivesAnEmptyEngine() {
        try (DependencyEngine fresh = DependencyEngine.open(tmp.resolve("none.json"), EngineConfig.defaults())) {
            assertTrue(fresh.sourceFiles().isEmpty());
            assertTrue(fresh.checksums().isEmpty());
            assertTrue(fresh.findCycles().isEmpty());
        }
    }
}
