package com.depgraph.engine.checksum;

/** Classification of a path relative to the last recorded walk. */
public enum ChangeKind {
    UNCHANGED,
    ADDED,
    MODIFIED,
    REMOVED
}
