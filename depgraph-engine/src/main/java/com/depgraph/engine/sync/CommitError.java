package com.depgraph.engine.sync;

/** A file whose commit kept failing after all retries. Nothing of it was applied. */
public record CommitError(String path, String reason, int attempts) {
}
