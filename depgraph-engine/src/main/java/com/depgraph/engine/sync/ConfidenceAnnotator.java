package com.depgraph.engine.sync;

import com.depgraph.engine.graph.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a scanned reference into edges, classifying each one in a fixed order:
 * string-based dispatch is {@code dynamic}; a reference inside a runtime branch is
 * {@code conditional}; a reference that names exactly one in-tree symbol is {@code resolved};
 * a name found nowhere in the tree is {@code external}.
 *
 * <p>A name that matches several in-tree symbols cannot be pinned statically: it yields one
 * {@code dynamic} edge per candidate, up to {@code maxDynamicCandidates}.
 */
public class ConfidenceAnnotator {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceAnnotator.class);

    /** Live symbols visible to resolution, looked up by simple name. */
    @FunctionalInterface
    public interface SymbolLookup {
        List<Symbol> symbolsNamed(String simpleName);
    }

    public enum Match { NONE, UNIQUE, AMBIGUOUS }

    public record Resolution(Match match, List<Symbol> candidates) {}

    private final int maxDynamicCandidates;

    public ConfidenceAnnotator(int maxDynamicCandidates) {
        if (maxDynamicCandidates < 1) {
            throw new IllegalArgumentException("maxDynamicCandidates must be >= 1");
        }
        this.maxDynamicCandidates = maxDynamicCandidates;
    }

    /**
     * Finds the in-tree symbols a reference can mean. Names qualified by a type must match that
     * type; other names match on their last segment. Candidates are narrowed by arity when any
     * has the referenced arity, then to the referencing file when several remain.
     */
    public Resolution resolve(String targetName, int targetArity, String fromFileId, SymbolLookup lookup) {
        List<Symbol> candidates = new ArrayList<>();
        boolean typeQualified = SymbolIds.isTypeQualified(targetName);
        for (Symbol s : lookup.symbolsNamed(SymbolIds.simpleName(targetName))) {
            if (s.isModule() || s.tombstoned()) continue;
            if (typeQualified && !qualifiedMatch(s.name(), targetName)) continue;
            candidates.add(s);
        }

        if (targetArity >= 0 && candidates.size() > 1) {
            List<Symbol> sameArity = new ArrayList<>();
            for (Symbol s : candidates) {
                if (s.arity() == targetArity) sameArity.add(s);
            }
            if (!sameArity.isEmpty()) candidates = sameArity;
        }
        if (candidates.size() > 1) {
            List<Symbol> sameFile = new ArrayList<>();
            for (Symbol s : candidates) {
                if (s.fileId().equals(fromFileId)) sameFile.add(s);
            }
            if (!sameFile.isEmpty()) candidates = sameFile;
        }

        candidates.sort(Comparator.comparing(Symbol::id));
        Match match = candidates.isEmpty() ? Match.NONE : candidates.size() == 1 ? Match.UNIQUE : Match.AMBIGUOUS;
        return new Resolution(match, candidates);
    }

    /** Edges for one reference from {@code sourceId}, each with an observation count of 1. */
    public List<Edge> annotate(String sourceId, String targetName, int targetArity,
                               RelationKind kind, ReferenceForm form, SymbolLookup lookup) {
        Resolution resolution = resolve(targetName, targetArity, SymbolIds.fileOf(sourceId), lookup);
        List<Edge> edges = new ArrayList<>();

        switch (form) {
            case DYNAMIC -> {
                if (resolution.match() == Match.NONE) {
                    edges.add(external(sourceId, targetName, targetArity, kind, form, Confidence.DYNAMIC));
                } else {
                    fanOut(sourceId, targetName, targetArity, kind, form, resolution, edges);
                }
            }
            case CONDITIONAL -> {
                switch (resolution.match()) {
                    case UNIQUE -> edges.add(internal(sourceId, resolution.candidates().get(0), targetName,
                            targetArity, kind, form, Confidence.CONDITIONAL));
                    case AMBIGUOUS -> fanOut(sourceId, targetName, targetArity, kind, form, resolution, edges);
                    case NONE -> edges.add(external(sourceId, targetName, targetArity, kind, form,
                            Confidence.CONDITIONAL));
                }
            }
            case DIRECT -> {
                switch (resolution.match()) {
                    case UNIQUE -> edges.add(internal(sourceId, resolution.candidates().get(0), targetName,
                            targetArity, kind, form, Confidence.RESOLVED));
                    case AMBIGUOUS -> fanOut(sourceId, targetName, targetArity, kind, form, resolution, edges);
                    case NONE -> edges.add(external(sourceId, targetName, targetArity, kind, form,
                            Confidence.EXTERNAL));
                }
            }
        }
        return edges;
    }

    private void fanOut(String sourceId, String targetName, int targetArity, RelationKind kind,
                        ReferenceForm form, Resolution resolution, List<Edge> edges) {
        List<Symbol> candidates = resolution.candidates();
        if (candidates.size() > maxDynamicCandidates) {
            log.warn("{} -> {} matches {} symbols; keeping the first {}",
                    sourceId, targetName, candidates.size(), maxDynamicCandidates);
            candidates = candidates.subList(0, maxDynamicCandidates);
        }
        for (Symbol candidate : candidates) {
            edges.add(internal(sourceId, candidate, targetName, targetArity, kind, form, Confidence.DYNAMIC));
        }
    }

    private static Edge internal(String sourceId, Symbol target, String targetName, int targetArity,
                                 RelationKind kind, ReferenceForm form, Confidence confidence) {
        return new Edge(sourceId, EdgeTarget.internal(target.id()), kind, confidence, form,
                targetName, targetArity, 1);
    }

    private static Edge external(String sourceId, String targetName, int targetArity,
                                 RelationKind kind, ReferenceForm form, Confidence confidence) {
        return new Edge(sourceId, EdgeTarget.external(Edge.externalDescriptor(targetName, targetArity)),
                kind, confidence, form, targetName, targetArity, 1);
    }

    /** {@code Inner.run} matches {@code Outer.Inner.run}; {@code app.models.Order.save} matches {@code Order.save}. */
    static boolean qualifiedMatch(String symbolName, String targetName) {
        return symbolName.equals(targetName)
                || symbolName.endsWith("." + targetName)
                || targetName.endsWith("." + symbolName);
    }
}
