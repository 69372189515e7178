package com.depgraph.engine.graph;

import com.google.gson.annotations.SerializedName;

/**
 * How certain the engine is about an edge's target, ordered from most to least certain.
 * Every edge carries exactly one class.
 */
public enum Confidence {

    /** Static, unambiguous in-tree target. */
    @SerializedName("resolved")    RESOLVED,
    /** Reachable only under a runtime branch. */
    @SerializedName("conditional") CONDITIONAL,
    /** Target decided by data not visible statically (reflection, computed dispatch, ambiguous name). */
    @SerializedName("dynamic")     DYNAMIC,
    /** Target outside the scanned tree. */
    @SerializedName("external")    EXTERNAL;

    /** Only resolved and conditional edges can take part in a provable cycle. */
    public boolean isCycleEligible() {
        return this == RESOLVED || this == CONDITIONAL;
    }

    public String wireName() {
        return name().toLowerCase();
    }

    /** Returns whichever of the two classes is more certain. */
    public static Confidence mostCertain(Confidence a, Confidence b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }
}
