package com.depgraph.engine.graph;

/** Identity of an edge: at most one edge exists per (source, target, kind). */
public record EdgeKey(String sourceId, String targetKey, RelationKind kind) {}
