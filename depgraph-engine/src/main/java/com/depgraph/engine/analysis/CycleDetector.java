package com.depgraph.engine.analysis;

import com.depgraph.engine.graph.Confidence;
import com.depgraph.engine.graph.Edge;
import com.depgraph.engine.graph.GraphStore;
import com.depgraph.engine.graph.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Finds dependency cycles over {@link Confidence#RESOLVED resolved} and
 * {@link Confidence#CONDITIONAL conditional} edges. Dynamic and external edges never close a cycle,
 * and a symbol calling itself is not reported.
 *
 * <p>Every elementary cycle is reported once, rotated to start at its smallest symbol id. Work is
 * capped at {@code node count x budgetFactor} steps. {@link #cycles()} is lazy and restartable:
 * each iteration reads a fresh snapshot of the graph under the store's read lock and never writes.
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    private final GraphStore store;
    private final int budgetFactor;

    public CycleDetector(GraphStore store, int budgetFactor) {
        if (budgetFactor < 1) {
            throw new IllegalArgumentException("budgetFactor must be >= 1");
        }
        this.store = store;
        this.budgetFactor = budgetFactor;
    }

    /** All cycles of the current graph, materialized. */
    public List<Cycle> findCycles() {
        List<Cycle> cycles = new ArrayList<>();
        for (Cycle cycle : cycles()) cycles.add(cycle);
        log.debug("Found {} cycles", cycles.size());
        return cycles;
    }

    /** Lazy view; each call to {@code iterator()} starts over on the graph as it is then. */
    public Iterable<Cycle> cycles() {
        return () -> new CycleIterator(snapshot());
    }

    // -----------------------------------------------------------------------
    // Snapshot
    // -----------------------------------------------------------------------

    /** Cycle-eligible adjacency. {@code conditionalArcs} holds arcs backed by no resolved edge. */
    private record Snapshot(Map<String, List<String>> adjacency, Set<String> conditionalArcs, int nodeCount) {}

    private Snapshot snapshot() {
        return store.query(reader -> {
            Map<String, Set<String>> arcs = new TreeMap<>();
            Map<String, Boolean> conditional = new HashMap<>();
            for (Edge e : reader.edges()) {
                if (!e.target().isInternal() || !e.confidence().isCycleEligible()) continue;
                String to = e.target().symbolId();
                if (to.equals(e.sourceId())) continue;
                arcs.computeIfAbsent(e.sourceId(), k -> new TreeSet<>()).add(to);
                conditional.merge(arc(e.sourceId(), to), e.confidence() == Confidence.CONDITIONAL, Boolean::logicalAnd);
            }
            Map<String, List<String>> adjacency = new LinkedHashMap<>();
            arcs.forEach((from, targets) -> adjacency.put(from, new ArrayList<>(targets)));
            Set<String> conditionalArcs = new HashSet<>();
            conditional.forEach((arc, onlyConditional) -> {
                if (onlyConditional) conditionalArcs.add(arc);
            });
            List<Symbol> live = reader.liveSymbols();
            return new Snapshot(adjacency, conditionalArcs, live.size());
        });
    }

    private static String arc(String from, String to) {
        return from + "\n" + to;
    }

    // -----------------------------------------------------------------------
    // Iteration
    // -----------------------------------------------------------------------

    /**
     * Two passes over the snapshot. Tarjan's algorithm first groups symbols into strongly
     * connected components; then, for each symbol {@code s} of a non-trivial component in id order,
     * a depth-first search restricted to that component and to ids greater than {@code s} reports
     * every elementary path that returns to {@code s}. Each elementary cycle is therefore met
     * exactly once, starting from its smallest id.
     */
    private final class CycleIterator implements Iterator<Cycle> {

        private final Snapshot graph;
        private final Deque<Cycle> pending = new ArrayDeque<>();
        private final Set<List<String>> reported = new HashSet<>();
        private long budget;
        private boolean done;

        private Map<String, Integer> component;
        private Iterator<String> starts;
        private String start;
        private final Deque<Frame> path = new ArrayDeque<>();
        private final Set<String> onPath = new HashSet<>();

        CycleIterator(Snapshot graph) {
            this.graph = graph;
            this.budget = (long) Math.max(1, graph.nodeCount()) * budgetFactor;
        }

        @Override
        public boolean hasNext() {
            advance();
            return !pending.isEmpty();
        }

        @Override
        public Cycle next() {
            if (!hasNext()) throw new NoSuchElementException();
            return pending.poll();
        }

        private void advance() {
            if (component == null && !done) {
                component = components();
                if (component == null) return;
                starts = new TreeSet<>(component.keySet()).iterator();
            }
            while (pending.isEmpty() && !done) {
                if (path.isEmpty()) {
                    if (!starts.hasNext()) {
                        done = true;
                        return;
                    }
                    start = starts.next();
                    push(start);
                    continue;
                }
                Frame top = path.peek();
                List<String> neighbors = neighbors(top.node);
                if (top.next >= neighbors.size()) {
                    path.pop();
                    onPath.remove(top.node);
                    continue;
                }
                if (!spend(1)) return;
                String neighbor = neighbors.get(top.next++);
                if (neighbor.equals(start)) {
                    List<String> members = new ArrayList<>(path.size());
                    path.descendingIterator().forEachRemaining(frame -> members.add(frame.node));
                    report(members);
                } else if (!onPath.contains(neighbor)
                        && component.get(start).equals(component.get(neighbor))
                        && neighbor.compareTo(start) > 0) {
                    push(neighbor);
                }
            }
        }

        private void push(String node) {
            onPath.add(node);
            path.push(new Frame(node));
        }

        private List<String> neighbors(String node) {
            return graph.adjacency().getOrDefault(node, List.of());
        }

        /** Component number of every symbol in a component of two or more; null when the budget ran out. */
        private Map<String, Integer> components() {
            Map<String, Integer> index = new HashMap<>();
            Map<String, Integer> low = new HashMap<>();
            Deque<String> members = new ArrayDeque<>();
            Set<String> onMembers = new HashSet<>();
            Deque<Frame> work = new ArrayDeque<>();
            Map<String, Integer> result = new HashMap<>();
            int counter = 0;
            int components = 0;

            for (String root : graph.adjacency().keySet()) {
                if (index.containsKey(root)) continue;
                if (!spend(1)) return null;
                index.put(root, counter);
                low.put(root, counter++);
                members.push(root);
                onMembers.add(root);
                work.push(new Frame(root));

                while (!work.isEmpty()) {
                    Frame top = work.peek();
                    List<String> neighbors = neighbors(top.node);
                    if (top.next < neighbors.size()) {
                        if (!spend(1)) return null;
                        String next = neighbors.get(top.next++);
                        if (!index.containsKey(next)) {
                            index.put(next, counter);
                            low.put(next, counter++);
                            members.push(next);
                            onMembers.add(next);
                            work.push(new Frame(next));
                        } else if (onMembers.contains(next)) {
                            low.put(top.node, Math.min(low.get(top.node), index.get(next)));
                        }
                        continue;
                    }
                    work.pop();
                    if (!work.isEmpty()) {
                        String parent = work.peek().node;
                        low.put(parent, Math.min(low.get(parent), low.get(top.node)));
                    }
                    if (low.get(top.node).equals(index.get(top.node))) {
                        List<String> scc = new ArrayList<>();
                        String member;
                        do {
                            member = members.pop();
                            onMembers.remove(member);
                            scc.add(member);
                        } while (!member.equals(top.node));
                        if (scc.size() > 1) {
                            for (String s : scc) result.put(s, components);
                            components++;
                        }
                    }
                }
            }
            return result;
        }

        private void report(List<String> members) {
            List<String> canonical = rotateToMinimum(members);
            if (!reported.add(canonical)) return;
            boolean conditional = false;
            for (int i = 0; i < canonical.size(); i++) {
                String from = canonical.get(i);
                String to = canonical.get((i + 1) % canonical.size());
                if (graph.conditionalArcs().contains(arc(from, to))) conditional = true;
            }
            pending.add(new Cycle(canonical, conditional));
        }

        private boolean spend(long steps) {
            if (budget >= steps) {
                budget -= steps;
                return true;
            }
            log.warn("Cycle search stopped after {} steps over {} symbols; results may be incomplete",
                    (long) Math.max(1, graph.nodeCount()) * budgetFactor, graph.nodeCount());
            done = true;
            return false;
        }
    }

    private static final class Frame {
        final String node;
        int next;

        Frame(String node) {
            this.node = node;
        }
    }

    /** Same cycle from any starting member gives the same list. */
    static List<String> rotateToMinimum(List<String> cycle) {
        String min = Collections.min(cycle);
        int start = cycle.indexOf(min);
        List<String> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((start + i) % cycle.size()));
        }
        return rotated;
    }
}
