package com.depgraph.engine.graph;

import com.google.gson.annotations.SerializedName;

/**
 * Syntactic shape of a reference as the scanner saw it, before any resolution against the tree.
 * Kept on the stored edge so the edge can be re-annotated when the set of in-tree symbols changes.
 */
public enum ReferenceForm {
    /** Plain call or reference, always reached when the caller runs. */
    @SerializedName("direct")      DIRECT,
    /** Inside an if/else, switch case, ternary branch, catch block or short-circuit operand. */
    @SerializedName("conditional") CONDITIONAL,
    /** String- or literal-based indirect dispatch (reflection, getattr, computed member access). */
    @SerializedName("dynamic")     DYNAMIC
}
