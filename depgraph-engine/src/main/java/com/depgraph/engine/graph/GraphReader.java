package com.depgraph.engine.graph;

import java.util.List;
import java.util.Optional;

/**
 * Point queries over the stored graph. Unless stated otherwise only live (non-tombstoned) entities
 * are returned; lists are sorted for deterministic output.
 */
public interface GraphReader {

    Optional<SourceFile> getFile(String path);

    /** All files, tombstoned ones included. */
    List<SourceFile> files();

    /** Lookup by id; tombstoned symbols are returned so callers can tell "gone" from "unknown". */
    Optional<Symbol> getSymbol(String id);

    List<Symbol> symbolsIn(String fileId);

    /** Symbols of a file including tombstoned ones. */
    List<Symbol> allSymbolsIn(String fileId);

    List<Symbol> liveSymbols();

    /** Live symbols whose simple name ({@link SymbolIds#simpleName}) equals {@code simpleName}. */
    List<Symbol> symbolsNamed(String simpleName);

    List<Edge> edgesFrom(String symbolId);

    /** Edges whose internal target is {@code symbolId}. */
    List<Edge> edgesTo(String symbolId);

    /** Edges whose scanned target name has the given simple name, whatever they resolved to. */
    List<Edge> edgesNamed(String simpleName);

    List<Edge> edges();
}
