package com.depgraph.engine.analysis;

import com.google.gson.annotations.SerializedName;

/** Whether a dependent is affected on every execution path or only on some. */
public enum Certainty {

    /** Reached through resolved edges only. */
    @SerializedName("certain")  CERTAIN,
    /** Reached only through at least one conditional or dynamic edge. */
    @SerializedName("possible") POSSIBLE
}
