package com.depgraph.engine.graph;

/**
 * A callable unit declared in a source file.
 *
 * <p>Identity is (file, name, arity); see {@link SymbolIds}. The {@code leaf} flag is maintained by
 * the store: true iff the symbol has no outgoing {@link Confidence#RESOLVED} edge.
 */
public record Symbol(
        String id,
        String fileId,
        String name,
        String signature,
        int arity,
        int lineStart,
        int lineEnd,
        boolean leaf,
        boolean tombstoned
) {

    public boolean isModule() {
        return SymbolIds.MODULE_NAME.equals(name);
    }

    public String simpleName() {
        return SymbolIds.simpleName(name);
    }

    public Symbol withLeaf(boolean leaf) {
        return new Symbol(id, fileId, name, signature, arity, lineStart, lineEnd, leaf, tombstoned);
    }

    public Symbol withTombstoned(boolean tombstoned) {
        return new Symbol(id, fileId, name, signature, arity, lineStart, lineEnd, leaf, tombstoned);
    }

    /** True when the declaration itself differs; leaf and tombstone state are ignored. */
    public boolean declarationDiffers(Symbol other) {
        return arity != other.arity
                || lineStart != other.lineStart
                || lineEnd != other.lineEnd
                || !name.equals(other.name)
                || !signature.equals(other.signature);
    }
}
