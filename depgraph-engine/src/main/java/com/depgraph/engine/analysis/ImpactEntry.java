package com.depgraph.engine.analysis;

import com.depgraph.engine.graph.Symbol;

/**
 * A symbol that transitively depends on the queried one.
 *
 * @param depth shortest number of edges from this symbol to the queried one
 */
public record ImpactEntry(Symbol symbol, int depth, Certainty certainty) {

    public String symbolId() {
        return symbol.id();
    }
}
