package com.depgraph.engine.scan;

/** A declaration as reported by a scanner, before it is given an id. */
public record SymbolDraft(String name, String signature, int arity, int lineStart, int lineEnd) {
}
