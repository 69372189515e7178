package com.depgraph.engine.sync;

import com.depgraph.engine.graph.*;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/** Store decorator that fails chosen transactions before they reach the wrapped store. */
class FlakyGraphStore implements GraphStore {

    private final GraphStore delegate;
    private final Map<String, Integer> commitFailures = new HashMap<>();
    private final Set<String> brokenInvariants = new HashSet<>();
    private final Map<String, Integer> attempts = new HashMap<>();

    FlakyGraphStore(GraphStore delegate) {
        this.delegate = delegate;
    }

    /** The next {@code times} transactions for {@code fileId} fail with a {@link CommitException}. */
    FlakyGraphStore failCommits(String fileId, int times) {
        commitFailures.put(fileId, times);
        return this;
    }

    /** Every transaction for {@code fileId} fails with a {@link ConsistencyException}. */
    FlakyGraphStore breakInvariant(String fileId) {
        brokenInvariants.add(fileId);
        return this;
    }

    int attempts(String fileId) {
        return attempts.getOrDefault(fileId, 0);
    }

    @Override
    public <T> T inTransaction(String fileId, Function<FileTransaction, T> work) {
        attempts.merge(fileId, 1, Integer::sum);
        if (brokenInvariants.contains(fileId)) {
            throw new ConsistencyException("edge of " + fileId + " points nowhere");
        }
        int remaining = commitFailures.getOrDefault(fileId, 0);
        if (remaining > 0) {
            commitFailures.put(fileId, remaining - 1);
            throw new CommitException("simulated commit failure for " + fileId);
        }
        return delegate.inTransaction(fileId, work);
    }

    @Override
    public <T> T query(Function<GraphReader, T> work) {
        return delegate.query(work);
    }

    @Override public Optional<SourceFile> getFile(String path) { return delegate.getFile(path); }
    @Override public List<SourceFile> files() { return delegate.files(); }
    @Override public Optional<Symbol> getSymbol(String id) { return delegate.getSymbol(id); }
    @Override public List<Symbol> symbolsIn(String fileId) { return delegate.symbolsIn(fileId); }
    @Override public List<Symbol> allSymbolsIn(String fileId) { return delegate.allSymbolsIn(fileId); }
    @Override public List<Symbol> liveSymbols() { return delegate.liveSymbols(); }
    @Override public List<Symbol> symbolsNamed(String simpleName) { return delegate.symbolsNamed(simpleName); }
    @Override public List<Edge> edgesFrom(String symbolId) { return delegate.edgesFrom(symbolId); }
    @Override public List<Edge> edgesTo(String symbolId) { return delegate.edgesTo(symbolId); }
    @Override public List<Edge> edgesNamed(String simpleName) { return delegate.edgesNamed(simpleName); }
    @Override public List<Edge> edges() { return delegate.edges(); }
}
