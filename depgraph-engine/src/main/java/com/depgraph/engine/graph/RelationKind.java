package com.depgraph.engine.graph;

import com.google.gson.annotations.SerializedName;

public enum RelationKind {
    @SerializedName("call")    CALL,
    @SerializedName("import")  IMPORT,
    @SerializedName("compose") COMPOSE;

    public String wireName() {
        return name().toLowerCase();
    }
}
