package com.depgraph.engine.sync;

import com.depgraph.engine.graph.*;
import com.depgraph.engine.sync.ConfidenceAnnotator.SymbolLookup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.depgraph.engine.graph.GraphFixtures.symbol;
import static org.junit.jupiter.api.Assertions.*;

class ConfidenceAnnotatorTest {

    private static final String CALLER = SymbolIds.of("app/main.py", "main", 0);

    private final ConfidenceAnnotator annotator = new ConfidenceAnnotator(8);

    private static SymbolLookup lookup(Symbol... symbols) {
        List<Symbol> all = List.of(symbols);
        return name -> all.stream().filter(s -> s.simpleName().equals(name)).collect(Collectors.toList());
    }

    private List<Edge> annotate(String target, int arity, ReferenceForm form, SymbolLookup lookup) {
        return annotator.annotate(CALLER, target, arity, RelationKind.CALL, form, lookup);
    }

    @Test
    void uniqueDirectReferenceIsResolved() {
        Symbol helper = symbol("app/util.py", "helper", 1);

        List<Edge> edges = annotate("helper", 1, ReferenceForm.DIRECT, lookup(helper));

        assertEquals(1, edges.size());
        assertEquals(Confidence.RESOLVED, edges.get(0).confidence());
        assertEquals(helper.id(), edges.get(0).target().symbolId());
        assertEquals(1, edges.get(0).observationCount());
    }

    @Test
    void unknownNameIsExternal() {
        List<Edge> edges = annotate("json.dumps", 1, ReferenceForm.DIRECT, lookup());

        assertEquals(1, edges.size());
        assertEquals(Confidence.EXTERNAL, edges.get(0).confidence());
        assertEquals("json.dumps/1", edges.get(0).target().descriptor());
    }

    @Test
    void ambiguousNameFansOutAsDynamic() {
        Symbol a = symbol("app/a.py", "save", 1);
        Symbol b = symbol("app/b.py", "save", 1);

        List<Edge> edges = annotate("save", 1, ReferenceForm.DIRECT, lookup(b, a));

        assertEquals(List.of(a.id(), b.id()), targets(edges));
        assertTrue(edges.stream().allMatch(e -> e.confidence() == Confidence.DYNAMIC));
    }

    @Test
    void arityAndSameFileNarrowCandidates() {
        Symbol oneArg = symbol("app/a.py", "save", 1);
        Symbol twoArgs = symbol("app/b.py", "save", 2);
        assertEquals(List.of(twoArgs.id()),
                targets(annotate("save", 2, ReferenceForm.DIRECT, lookup(oneArg, twoArgs))));

        Symbol local = symbol("app/main.py", "save", 1);
        List<Edge> edges = annotate("save", 1, ReferenceForm.DIRECT, lookup(oneArg, local));
        assertEquals(List.of(local.id()), targets(edges));
        assertEquals(Confidence.RESOLVED, edges.get(0).confidence());
    }

    @Test
    void typeQualifiedNameMustMatchTheType() {
        Symbol repoSave = symbol("app/repo.py", "Repo.save", 1);
        Symbol cacheSave = symbol("app/cache.py", "Cache.save", 1);

        List<Edge> edges = annotate("Repo.save", 1, ReferenceForm.DIRECT, lookup(repoSave, cacheSave));

        assertEquals(List.of(repoSave.id()), targets(edges));
        assertEquals(Confidence.RESOLVED, edges.get(0).confidence());
    }

    @Test
    void tombstonedAndModuleSymbolsNeverMatch() {
        Symbol gone = symbol("app/a.py", "helper", 0).withTombstoned(true);
        Symbol module = symbol("app/a.py", SymbolIds.MODULE_NAME, 0);

        List<Edge> edges = annotate("helper", 0, ReferenceForm.DIRECT, lookup(gone, module));

        assertEquals(Confidence.EXTERNAL, edges.get(0).confidence());
    }

    @Test
    void branchReferencesAreConditionalWhetherOrNotTheyResolve() {
        Symbol notify = symbol("app/a.py", "notify", 1);

        Edge internal = annotate("notify", 1, ReferenceForm.CONDITIONAL, lookup(notify)).get(0);
        assertEquals(Confidence.CONDITIONAL, internal.confidence());
        assertTrue(internal.target().isInternal());

        Edge external = annotate("requests.post", 1, ReferenceForm.CONDITIONAL, lookup()).get(0);
        assertEquals(Confidence.CONDITIONAL, external.confidence());
        assertFalse(external.target().isInternal());
    }

    @Test
    void stringDispatchIsAlwaysDynamic() {
        Symbol place = symbol("app/a.py", "place", 1);

        Edge edge = annotate("place", -1, ReferenceForm.DYNAMIC, lookup(place)).get(0);
        assertEquals(Confidence.DYNAMIC, edge.confidence());
        assertEquals(place.id(), edge.target().symbolId());

        Edge unknown = annotate("missing", -1, ReferenceForm.DYNAMIC, lookup()).get(0);
        assertEquals(Confidence.DYNAMIC, unknown.confidence());
        assertEquals("missing", unknown.target().descriptor());
    }

    @Test
    void fanOutIsCapped() {
        ConfidenceAnnotator capped = new ConfidenceAnnotator(2);
        SymbolLookup lookup = lookup(symbol("a.py", "run", 0), symbol("b.py", "run", 0), symbol("c.py", "run", 0));

        List<Edge> edges = capped.annotate(CALLER, "run", 0, RelationKind.CALL, ReferenceForm.DIRECT, lookup);

        assertEquals(List.of(SymbolIds.of("a.py", "run", 0), SymbolIds.of("b.py", "run", 0)), targets(edges));
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceAnnotator(0));
    }

    private static List<String> targets(List<Edge> edges) {
        return edges.stream().map(e -> e.target().symbolId()).collect(Collectors.toList());
    }
}
