package com.depgraph.engine.graph;

import java.util.Objects;

/**
 * Either an in-tree Symbol id or an opaque descriptor for a library / unknown target.
 * Exactly one of the two fields is non-null.
 */
public record EdgeTarget(String symbolId, String descriptor) {

    public EdgeTarget {
        if ((symbolId == null) == (descriptor == null)) {
            throw new IllegalArgumentException("EdgeTarget needs exactly one of symbolId / descriptor");
        }
    }

    public static EdgeTarget internal(String symbolId) {
        return new EdgeTarget(Objects.requireNonNull(symbolId, "symbolId"), null);
    }

    public static EdgeTarget external(String descriptor) {
        return new EdgeTarget(null, Objects.requireNonNull(descriptor, "descriptor"));
    }

    public boolean isInternal() {
        return symbolId != null;
    }

    /** Stable string form used in edge keys and snapshot ordering. */
    public String key() {
        return isInternal() ? "sym:" + symbolId : "ext:" + descriptor;
    }

    @Override
    public String toString() {
        return key();
    }
}
