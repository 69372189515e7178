package com.depgraph.engine.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * An elementary dependency cycle, rotated so that its smallest symbol id comes first.
 *
 * @param symbolIds   the cycle's members in edge order; the last one depends on the first
 * @param conditional true when at least one edge on the cycle is only conditionally taken
 */
public record Cycle(List<String> symbolIds, boolean conditional) {

    public Cycle {
        symbolIds = List.copyOf(symbolIds);
    }

    public int length() {
        return symbolIds.size();
    }

    public boolean contains(String symbolId) {
        return symbolIds.contains(symbolId);
    }

    /** The members with the first one repeated at the end, e.g. {@code [a, b, c, a]}. */
    public List<String> closedWalk() {
        List<String> walk = new ArrayList<>(symbolIds);
        walk.add(symbolIds.get(0));
        return walk;
    }

    @Override
    public String toString() {
        return String.join(" -> ", closedWalk());
    }
}
