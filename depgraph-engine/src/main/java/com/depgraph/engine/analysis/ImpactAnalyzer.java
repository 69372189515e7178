package com.depgraph.engine.analysis;

import com.depgraph.engine.graph.Confidence;
import com.depgraph.engine.graph.Edge;
import com.depgraph.engine.graph.GraphReader;
import com.depgraph.engine.graph.GraphStore;
import com.depgraph.engine.graph.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Answers "what depends on this symbol" by breadth-first search over incoming edges.
 *
 * <p>Each dependent is reported once, at the depth it is first reached. It is
 * {@link Certainty#CERTAIN certain} when some shortest path to it uses resolved edges only, and
 * {@link Certainty#POSSIBLE possible} otherwise. The search runs under the store's read lock.
 */
public class ImpactAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ImpactAnalyzer.class);

    private final GraphStore store;
    private final int defaultDepth;
    private final int maxFanOut;
    private final int maxResults;

    public ImpactAnalyzer(GraphStore store, int defaultDepth, int maxFanOut, int maxResults) {
        if (defaultDepth < 0 || maxFanOut < 1 || maxResults < 1) {
            throw new IllegalArgumentException("Invalid impact limits: depth=" + defaultDepth
                    + ", fanOut=" + maxFanOut + ", results=" + maxResults);
        }
        this.store = store;
        this.defaultDepth = defaultDepth;
        this.maxFanOut = maxFanOut;
        this.maxResults = maxResults;
    }

    public List<ImpactEntry> impactOf(String symbolId) {
        return impactOf(symbolId, defaultDepth);
    }

    /**
     * Dependents of {@code symbolId} up to {@code maxDepth} edges away, ordered by depth and then id.
     * Unknown and tombstoned symbols have no dependents.
     *
     * @throws IllegalArgumentException if {@code maxDepth} is negative
     */
    public List<ImpactEntry> impactOf(String symbolId, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        return store.query(reader -> search(reader, symbolId, maxDepth));
    }

    private List<ImpactEntry> search(GraphReader reader, String symbolId, int maxDepth) {
        Optional<Symbol> start = reader.getSymbol(symbolId);
        if (start.isEmpty() || start.get().tombstoned()) {
            log.debug("No live symbol {}", symbolId);
            return List.of();
        }

        List<ImpactEntry> results = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(symbolId);
        // frontier: symbol id -> whether it was reached through resolved edges only
        Map<String, Boolean> frontier = new TreeMap<>();
        frontier.put(symbolId, true);

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            Map<String, Boolean> next = new TreeMap<>();
            for (Map.Entry<String, Boolean> node : frontier.entrySet()) {
                List<Edge> incoming = reader.edgesTo(node.getKey());
                if (incoming.size() > maxFanOut) {
                    log.warn("{} has {} dependents; expanding the first {}",
                            node.getKey(), incoming.size(), maxFanOut);
                    incoming = incoming.subList(0, maxFanOut);
                }
                for (Edge e : incoming) {
                    String dependent = e.sourceId();
                    if (visited.contains(dependent)) continue;
                    boolean certain = node.getValue() && e.confidence() == Confidence.RESOLVED;
                    next.merge(dependent, certain, Boolean::logicalOr);
                }
            }

            for (Map.Entry<String, Boolean> reached : next.entrySet()) {
                if (results.size() >= maxResults) {
                    log.warn("Impact of {} truncated at {} results (depth {})", symbolId, maxResults, depth);
                    return results;
                }
                Optional<Symbol> symbol = reader.getSymbol(reached.getKey());
                if (symbol.isEmpty() || symbol.get().tombstoned()) continue;
                visited.add(reached.getKey());
                results.add(new ImpactEntry(symbol.get(), depth,
                        reached.getValue() ? Certainty.CERTAIN : Certainty.POSSIBLE));
            }
            next.keySet().retainAll(visited);
            frontier = next;
        }
        return results;
    }
}
