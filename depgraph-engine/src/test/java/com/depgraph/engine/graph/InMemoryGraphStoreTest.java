package com.depgraph.engine.graph;

import com.depgraph.engine.graph.GraphStore.CommitException;
import com.depgraph.engine.graph.GraphStore.ConsistencyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.depgraph.engine.graph.GraphFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;
    private Symbol run;
    private Symbol helper;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        helper = symbol("util.py", "helper", 1);
        run = symbol("app.py", "run", 0);
        put(store, "util.py", List.of(helper), List.of());
        put(store, "app.py", List.of(run), List.of(resolved(run, helper), external(run, "print")));
    }

    @Test
    void indexesEdgesBothWays() {
        assertEquals(2, store.edgesFrom(run.id()).size());
        assertEquals(List.of(resolved(run, helper)), store.edgesTo(helper.id()));
        assertEquals(1, store.edgesNamed("print").size());
        assertEquals(List.of(helper.id()), store.symbolsNamed("helper").stream().map(Symbol::id).toList());
    }

    @Test
    void leafFlagFollowsResolvedOutgoingEdges() {
        assertFalse(store.getSymbol(run.id()).orElseThrow().leaf());
        assertTrue(store.getSymbol(helper.id()).orElseThrow().leaf());
    }

    @Test
    void reobservedEdgeIncrementsItsCount() {
        store.upsertEdges(List.of(resolved(run, helper)));
        store.upsertEdges(List.of(resolved(run, helper)));

        assertEquals(3, store.edgesTo(helper.id()).get(0).observationCount());
        assertEquals(2, store.edgesFrom(run.id()).size());
    }

    @Test
    void tombstonedTargetTurnsIncomingEdgesExternal() {
        store.inTransaction("util.py", tx -> {
            tx.tombstoneSymbols(List.of(helper.id()));
            return null;
        });

        assertTrue(store.symbolsIn("util.py").isEmpty());
        assertTrue(store.getSymbol(helper.id()).orElseThrow().tombstoned());
        assertTrue(store.edgesTo(helper.id()).isEmpty());

        Edge retagged = store.edgesNamed("helper").get(0);
        assertFalse(retagged.target().isInternal());
        assertEquals("helper/1", retagged.target().descriptor());
        assertEquals(Confidence.EXTERNAL, retagged.confidence());
        assertTrue(store.getSymbol(run.id()).orElseThrow().leaf(), "no resolved edge left");
    }

    @Test
    void tombstonedSymbolIsRevivedByUpsert() {
        store.tombstoneFile("util.py");
        assertTrue(store.getFile("util.py").orElseThrow().tombstoned());

        store.upsertSymbols("util.py", List.of(helper));

        assertFalse(store.getSymbol(helper.id()).orElseThrow().tombstoned());
        assertEquals(List.of(helper.id()), store.symbolsIn("util.py").stream().map(Symbol::id).toList());
    }

    @Test
    void failedWorkRollsBackEverything() {
        Symbol extra = symbol("app.py", "extra", 0);

        CommitException e = assertThrows(CommitException.class, () -> store.inTransaction("app.py", tx -> {
            tx.upsertSymbols(List.of(extra));
            tx.deleteEdges(List.of(resolved(run, helper).key()));
            throw new IllegalStateException("disk full");
        }));

        assertTrue(e.getMessage().contains("disk full"));
        assertTrue(store.getSymbol(extra.id()).isEmpty());
        assertEquals(1, store.edgesTo(helper.id()).size());
        assertFalse(store.getSymbol(run.id()).orElseThrow().leaf());
    }

    @Test
    void edgeToUnknownSymbolIsAConsistencyError() {
        Symbol ghost = symbol("ghost.py", "ghost", 0);

        assertThrows(ConsistencyException.class,
                () -> store.upsertEdges(List.of(resolved(run, ghost))));
        assertEquals(2, store.edgesFrom(run.id()).size());
    }

    @Test
    void transactionOnlyWritesItsOwnFile() {
        Symbol foreign = symbol("util.py", "other", 0);

        assertThrows(ConsistencyException.class, () -> store.inTransaction("app.py", tx -> {
            tx.upsertSymbols(List.of(foreign));
            return null;
        }));
        assertTrue(store.getSymbol(foreign.id()).isEmpty());
    }

    @Test
    void restoreRejectsDanglingEdges() {
        Symbol ghost = symbol("ghost.py", "ghost", 0);

        assertThrows(ConsistencyException.class, () -> InMemoryGraphStore.restore(
                List.of(file("app.py")), List.of(run), List.of(resolved(run, ghost))));

        InMemoryGraphStore restored = InMemoryGraphStore.restore(
                List.of(file("app.py"), file("util.py")), List.of(run, helper), List.of(resolved(run, helper)));
        assertEquals(1, restored.edgesTo(helper.id()).size());
    }
}
