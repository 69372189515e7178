package com.depgraph.engine.scan;

import com.depgraph.engine.checksum.Digests;

import java.util.Objects;

/**
 * One path handed to a sync: either its content and digest, or the reason it could not be read.
 */
public record SourceInput(String path, String content, String digest, String readError) {

    public SourceInput {
        Objects.requireNonNull(path, "path");
        if (readError == null) {
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(digest, "digest");
        }
    }

    public static SourceInput of(String path, String content) {
        return new SourceInput(path, content, Digests.sha256(content), null);
    }

    public static SourceInput of(String path, String content, String digest) {
        return new SourceInput(path, content, digest, null);
    }

    public static SourceInput unreadable(String path, String reason) {
        return new SourceInput(path, null, null, reason);
    }

    public boolean isReadable() {
        return readError == null;
    }

    /** Lower-cased extension without the dot, or empty. */
    public String extension() {
        return extensionOf(path);
    }

    public static String extensionOf(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1) return "";
        return path.substring(dot + 1).toLowerCase();
    }
}
