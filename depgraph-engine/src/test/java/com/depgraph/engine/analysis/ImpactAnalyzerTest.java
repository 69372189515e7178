package com.depgraph.engine.analysis;

import com.depgraph.engine.graph.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.depgraph.engine.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ImpactAnalyzerTest {

    private InMemoryGraphStore store;
    private Symbol a;
    private Symbol b;
    private Symbol c;
    private Symbol d;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        a = symbol("a.py", "a", 0);
        b = symbol("b.py", "b", 0);
        c = symbol("c.py", "c", 0);
        d = symbol("d.py", "d", 0);
        for (Symbol s : List.of(a, b, c, d)) put(store, s.fileId(), List.of(s), List.of());
    }

    private ImpactAnalyzer analyzer() {
        return new ImpactAnalyzer(store, 5, 250, 1000);
    }

    private static List<String> describe(List<ImpactEntry> entries) {
        return entries.stream()
                .map(e -> e.symbol().name() + "@" + e.depth() + ":" + e.certainty())
                .collect(Collectors.toList());
    }

    @Test
    void depthBoundsTheChain() {
        store.upsertEdges(List.of(resolved(b, a), resolved(c, b), resolved(d, c)));

        assertEquals(List.of("b@1:CERTAIN", "c@2:CERTAIN"), describe(analyzer().impactOf(a.id(), 2)));
        assertEquals(List.of("b@1:CERTAIN"), describe(analyzer().impactOf(a.id(), 1)));
        assertTrue(analyzer().impactOf(a.id(), 0).isEmpty());
        assertEquals(3, analyzer().impactOf(a.id()).size());
    }

    @Test
    void uncertainEdgeMakesEverythingBehindItPossible() {
        store.upsertEdges(List.of(edge(b, a, Confidence.DYNAMIC), resolved(c, b)));

        assertEquals(List.of("b@1:POSSIBLE", "c@2:POSSIBLE"), describe(analyzer().impactOf(a.id(), 3)));
    }

    @Test
    void anyResolvedShortestPathIsEnoughForCertainty() {
        store.upsertEdges(List.of(resolved(b, a), edge(c, a, Confidence.CONDITIONAL), resolved(d, b), resolved(d, c)));

        assertEquals(List.of("b@1:CERTAIN", "c@1:POSSIBLE", "d@2:CERTAIN"),
                describe(analyzer().impactOf(a.id(), 3)));
    }

    @Test
    void cyclesAreVisitedOnce() {
        store.upsertEdges(List.of(resolved(b, a), resolved(a, b), resolved(c, b)));

        assertEquals(List.of("b@1:CERTAIN", "c@2:CERTAIN"), describe(analyzer().impactOf(a.id(), 10)));
    }

    @Test
    void unknownAndTombstonedSymbolsHaveNoImpact() {
        store.upsertEdges(List.of(resolved(b, a)));

        assertTrue(analyzer().impactOf("nowhere.py#x/0", 3).isEmpty());
        store.tombstoneFile("a.py");
        assertTrue(analyzer().impactOf(a.id(), 3).isEmpty());
    }

    @Test
    void negativeDepthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> analyzer().impactOf(a.id(), -1));
    }

    @Test
    void fanOutAndResultLimitsTruncate() {
        store.upsertEdges(List.of(resolved(b, a), resolved(c, a), resolved(d, a)));

        assertEquals(List.of("b@1:CERTAIN", "c@1:CERTAIN"),
                describe(new ImpactAnalyzer(store, 5, 2, 1000).impactOf(a.id())));
        assertEquals(1, new ImpactAnalyzer(store, 5, 250, 1).impactOf(a.id()).size());
    }
}
