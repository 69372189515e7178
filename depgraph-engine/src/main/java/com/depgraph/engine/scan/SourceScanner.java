package com.depgraph.engine.scan;

import java.util.Set;

/**
 * Extracts declarations and references from the content of one file. Implementations are
 * stateless and may be called from several scan workers at once.
 *
 * <p>Additional scanners can be contributed through {@link java.util.ServiceLoader}.
 */
public interface SourceScanner {

    class ScanException extends Exception {
        public ScanException(String message) { super(message); }
        public ScanException(String message, Throwable cause) { super(message, cause); }
    }

    String language();

    /** Lower-case extensions without the dot, e.g. {@code "py"}. */
    Set<String> fileExtensions();

    /**
     * @throws ScanException if the content cannot be parsed; the file is then left untouched in the graph
     */
    ScanResult scan(String path, String content) throws ScanException;
}
