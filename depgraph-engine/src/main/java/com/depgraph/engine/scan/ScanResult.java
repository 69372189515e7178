package com.depgraph.engine.scan;

import java.util.List;

/** Output of scanning one file. */
public record ScanResult(String language, List<SymbolDraft> symbols, List<ReferenceDraft> references) {

    public ScanResult {
        symbols = List.copyOf(symbols);
        references = List.copyOf(references);
    }

    public static ScanResult empty(String language) {
        return new ScanResult(language, List.of(), List.of());
    }
}
