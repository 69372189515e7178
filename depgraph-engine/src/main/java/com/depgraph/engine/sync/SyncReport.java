package com.depgraph.engine.sync;

import java.util.List;

/**
 * Outcome of one sync run. File counts only include files whose change was fully applied;
 * a file that failed is counted in {@code failed} and listed in one of the error lists.
 * Symbol lists hold ids and leave out module pseudo-symbols.
 */
public record SyncReport(
        int added,
        int modified,
        int removed,
        int unchanged,
        int failed,
        List<ScanError> scanErrors,
        List<CommitError> commitErrors,
        List<String> createdSymbols,
        List<String> tombstonedSymbols,
        boolean cancelled,
        long durationMillis
) {

    public SyncReport {
        scanErrors = List.copyOf(scanErrors);
        commitErrors = List.copyOf(commitErrors);
        createdSymbols = List.copyOf(createdSymbols);
        tombstonedSymbols = List.copyOf(tombstonedSymbols);
    }

    public int succeeded() {
        return added + modified + removed;
    }

    public boolean hasChanges() {
        return succeeded() > 0;
    }
}
