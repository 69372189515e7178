package com.depgraph.engine.persist;

import com.depgraph.engine.checksum.ChecksumIndex;
import com.depgraph.engine.graph.*;
import com.depgraph.engine.persist.GraphSnapshot.*;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;

/**
 * Writes a {@link GraphStore} together with its {@link ChecksumIndex} to graph_snapshot.json and
 * reads it back. Output is deterministic: every array is sorted by id before writing.
 */
public class GraphSnapshotSerializer {

    public static final String FILE_NAME = "graph_snapshot.json";

    private static final Logger log = LoggerFactory.getLogger(GraphSnapshotSerializer.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static class SnapshotException extends RuntimeException {
        public SnapshotException(String msg) { super(msg); }
        public SnapshotException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** A snapshot loaded from disk. */
    public record Loaded(InMemoryGraphStore store, ChecksumIndex index) {}

    /**
     * Writes the store and index to {@code snapshotPath}, replacing any previous snapshot.
     * The graph is read under the store's read lock so the snapshot is consistent.
     */
    public void write(GraphStore store, ChecksumIndex index, Path snapshotPath) {
        SnapshotRoot root = store.query(reader -> toSnapshot(reader, index));
        Path parent = snapshotPath.toAbsolutePath().getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SnapshotException("Could not create directory: " + parent, e);
        }

        Path tmp = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
        try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            GSON.toJson(root, w);
        } catch (IOException e) {
            throw new SnapshotException("Failed to write " + tmp + ": " + e.getMessage(), e);
        }
        try {
            move(tmp, snapshotPath);
        } catch (IOException e) {
            throw new SnapshotException("Failed to replace " + snapshotPath + ": " + e.getMessage(), e);
        }
        log.info("Snapshot written: {} ({} files, {} symbols, {} edges)",
                snapshotPath, root.files.size(), root.symbols.size(), root.edges.size());
    }

    /**
     * Loads a snapshot written by {@link #write}.
     *
     * @throws SnapshotException    if the file is missing, unreadable or malformed
     * @throws GraphStore.ConsistencyException if an edge references a symbol the snapshot lacks
     */
    public Loaded read(Path snapshotPath) {
        if (!Files.exists(snapshotPath)) {
            throw new SnapshotException("Snapshot not found: " + snapshotPath);
        }
        SnapshotRoot root;
        try (Reader r = Files.newBufferedReader(snapshotPath, StandardCharsets.UTF_8)) {
            root = GSON.fromJson(r, SnapshotRoot.class);
        } catch (JsonParseException e) {
            throw new SnapshotException("Malformed snapshot " + snapshotPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SnapshotException("Failed to read snapshot " + snapshotPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new SnapshotException("Snapshot is empty: " + snapshotPath);
        }
        if (root.formatVersion != GraphSnapshot.FORMAT_VERSION) {
            throw new SnapshotException("Unsupported snapshot format " + root.formatVersion + " in " + snapshotPath);
        }

        List<SourceFile> files = new ArrayList<>();
        List<Symbol> symbols = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        try {
            for (SnapshotFile f : nonNull(root.files)) files.add(fromSnapshot(f));
            for (SnapshotSymbol s : nonNull(root.symbols)) symbols.add(fromSnapshot(s));
            for (SnapshotEdge e : nonNull(root.edges)) edges.add(fromSnapshot(e));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new SnapshotException("Malformed snapshot " + snapshotPath + ": " + e.getMessage(), e);
        }

        InMemoryGraphStore store = InMemoryGraphStore.restore(files, symbols, edges);
        ChecksumIndex index = ChecksumIndex.of(root.checksums == null ? new TreeMap<>() : root.checksums);
        log.info("Snapshot loaded: {} ({} files, {} symbols, {} edges)",
                snapshotPath, files.size(), symbols.size(), edges.size());
        return new Loaded(store, index);
    }

    // -----------------------------------------------------------------------
    // Mapping
    // -----------------------------------------------------------------------

    private static SnapshotRoot toSnapshot(GraphReader reader, ChecksumIndex index) {
        SnapshotRoot root = new SnapshotRoot();
        root.formatVersion = GraphSnapshot.FORMAT_VERSION;
        root.savedAt = Instant.now().toString();

        root.files = new ArrayList<>();
        List<Symbol> allSymbols = new ArrayList<>();
        for (SourceFile file : reader.files()) {
            root.files.add(toSnapshot(file));
        }
        // Tombstoned symbols are kept so their identity survives a reload.
        for (SourceFile file : reader.files()) {
            allSymbols.addAll(reader.allSymbolsIn(file.path()));
        }
        allSymbols.sort(Comparator.comparing(Symbol::id));
        root.symbols = new ArrayList<>();
        for (Symbol s : allSymbols) root.symbols.add(toSnapshot(s));

        root.edges = new ArrayList<>();
        for (Edge e : reader.edges()) root.edges.add(toSnapshot(e));
        root.edges.sort(Comparator.comparing((SnapshotEdge e) -> e.source)
                .thenComparing(e -> e.targetSymbol != null ? "sym:" + e.targetSymbol : "ext:" + e.targetExternal)
                .thenComparing(e -> e.kind));

        root.checksums = new TreeMap<>(index.entries());
        return root;
    }

    private static SnapshotFile toSnapshot(SourceFile f) {
        SnapshotFile out = new SnapshotFile();
        out.path = f.path();
        out.language = f.language();
        out.digest = f.digest();
        out.lastSynced = f.lastSynced() != null ? f.lastSynced().toString() : null;
        out.tombstoned = f.tombstoned();
        return out;
    }

    private static SnapshotSymbol toSnapshot(Symbol s) {
        SnapshotSymbol out = new SnapshotSymbol();
        out.id = s.id();
        out.fileId = s.fileId();
        out.name = s.name();
        out.signature = s.signature();
        out.arity = s.arity();
        out.lineStart = s.lineStart();
        out.lineEnd = s.lineEnd();
        out.leaf = s.leaf();
        out.tombstoned = s.tombstoned();
        return out;
    }

    private static SnapshotEdge toSnapshot(Edge e) {
        SnapshotEdge out = new SnapshotEdge();
        out.source = e.sourceId();
        out.targetSymbol = e.target().symbolId();
        out.targetExternal = e.target().descriptor();
        out.kind = e.kind();
        out.confidence = e.confidence();
        out.form = e.form();
        out.targetName = e.targetName();
        out.targetArity = e.targetArity();
        out.observationCount = e.observationCount();
        return out;
    }

    private static SourceFile fromSnapshot(SnapshotFile f) {
        require(f.path, "file path");
        Instant synced = f.lastSynced != null ? Instant.parse(f.lastSynced) : null;
        return new SourceFile(f.path, f.language, f.digest, synced, f.tombstoned);
    }

    private static Symbol fromSnapshot(SnapshotSymbol s) {
        require(s.id, "symbol id");
        require(s.fileId, "symbol file_id");
        require(s.name, "symbol name");
        return new Symbol(s.id, s.fileId, s.name, s.signature != null ? s.signature : s.name,
                s.arity, s.lineStart, s.lineEnd, s.leaf, s.tombstoned);
    }

    private static Edge fromSnapshot(SnapshotEdge e) {
        EdgeTarget target = e.targetSymbol != null
                ? EdgeTarget.internal(e.targetSymbol)
                : EdgeTarget.external(require(e.targetExternal, "edge target"));
        return new Edge(require(e.source, "edge source"), target, require(e.kind, "edge kind"),
                require(e.confidence, "edge confidence"), require(e.form, "edge form"),
                require(e.targetName, "edge target_name"), e.targetArity, e.observationCount);
    }

    private static <T> T require(T value, String what) {
        if (value == null) throw new IllegalArgumentException("missing " + what);
        return value;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? list : List.of();
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing non-atomically", to);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
