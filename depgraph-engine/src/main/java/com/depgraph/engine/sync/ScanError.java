package com.depgraph.engine.sync;

/**
 * A file that could not be scanned in a sync run. Non-fatal: the file's previously stored
 * symbols and edges are left as they were.
 */
public record ScanError(String path, Kind kind, String reason) {

    public enum Kind { UNREADABLE, UNPARSEABLE }

    public static ScanError unreadable(String path, String reason) {
        return new ScanError(path, Kind.UNREADABLE, reason);
    }

    public static ScanError unparseable(String path, String reason) {
        return new ScanError(path, Kind.UNPARSEABLE, reason);
    }
}
