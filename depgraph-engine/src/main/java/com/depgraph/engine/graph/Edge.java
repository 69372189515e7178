package com.depgraph.engine.graph;

import java.util.Objects;

/**
 * A directed relation derived from source. Edges are only ever produced by a scan and merged by
 * the sync engine; {@code targetName}, {@code targetArity} and {@code form} record what the scanner
 * saw so the confidence can be recomputed when the tree changes.
 */
public record Edge(
        String sourceId,
        EdgeTarget target,
        RelationKind kind,
        Confidence confidence,
        ReferenceForm form,
        String targetName,
        int targetArity,
        long observationCount
) {

    public Edge {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(confidence, "confidence");
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(targetName, "targetName");
    }

    public EdgeKey key() {
        return new EdgeKey(sourceId, target.key(), kind);
    }

    public Edge withObservationCount(long count) {
        return new Edge(sourceId, target, kind, confidence, form, targetName, targetArity, count);
    }

    /**
     * The same reference, pointed at an out-of-tree descriptor. Used when the edge's target symbol
     * is tombstoned: the caller still calls something, so the edge is kept.
     */
    public Edge asExternal() {
        return new Edge(sourceId, EdgeTarget.external(externalDescriptor(targetName, targetArity)),
                kind, Confidence.EXTERNAL, form, targetName, targetArity, observationCount);
    }

    /** Whether this edge came from the same scanned reference as {@code other}. */
    public boolean sameOrigin(Edge other) {
        return sourceId.equals(other.sourceId)
                && kind == other.kind
                && form == other.form
                && targetArity == other.targetArity
                && targetName.equals(other.targetName);
    }

    public static String externalDescriptor(String targetName, int targetArity) {
        return targetArity < 0 ? targetName : targetName + "/" + targetArity;
    }
}
