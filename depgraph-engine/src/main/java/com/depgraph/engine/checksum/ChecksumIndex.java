package com.depgraph.engine.checksum;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps each known path to the digest recorded at its last successful sync.
 *
 * <p>A sync starts with {@link #beginWalk()}, reports every path it sees via {@link #record} or
 * {@link #markUnreadable}, and then asks for {@link #pendingRemovals()}: known paths the walk
 * did not see. Removals are only dropped from the index once the store has tombstoned them
 * ({@link #confirmRemoved}). If a later step fails, {@link #restore} puts the previous digest back
 * so the file is classified again on the next sync.
 */
public class ChecksumIndex {

    private final Map<String, String> digests = new ConcurrentHashMap<>();
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    public static ChecksumIndex of(Map<String, String> entries) {
        ChecksumIndex index = new ChecksumIndex();
        index.digests.putAll(entries);
        return index;
    }

    public void beginWalk() {
        seen.clear();
    }

    /**
     * Records the digest for a path seen in the current walk and classifies it against the
     * previous digest.
     */
    public ChangeKind record(String path, String digest) {
        Objects.requireNonNull(digest, "digest");
        seen.add(path);
        String previous = digests.put(path, digest);
        if (previous == null) return ChangeKind.ADDED;
        return previous.equals(digest) ? ChangeKind.UNCHANGED : ChangeKind.MODIFIED;
    }

    /** The path exists but could not be read: it is not a removal and its old digest is kept. */
    public void markUnreadable(String path) {
        seen.add(path);
    }

    /** Known paths not seen since {@link #beginWalk()}, sorted. */
    public List<String> pendingRemovals() {
        List<String> removed = new ArrayList<>();
        for (String path : digests.keySet()) {
            if (!seen.contains(path)) removed.add(path);
        }
        Collections.sort(removed);
        return removed;
    }

    public void confirmRemoved(String path) {
        digests.remove(path);
    }

    /** Rolls a path back to {@code previousDigest}; {@code null} forgets the path entirely. */
    public void restore(String path, String previousDigest) {
        if (previousDigest == null) {
            digests.remove(path);
        } else {
            digests.put(path, previousDigest);
        }
    }

    public Optional<String> digestOf(String path) {
        return Optional.ofNullable(digests.get(path));
    }

    /** Snapshot of all entries, sorted by path. */
    public SortedMap<String, String> entries() {
        return new TreeMap<>(digests);
    }
}
