package com.depgraph.cli;

import com.depgraph.engine.checksum.Digests;
import com.depgraph.engine.scan.SourceInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Collects the source files under a root directory as {@link SourceInput}s with paths relative to
 * the root. Build output, dependency caches, VCS metadata and binary assets are skipped. A file
 * that cannot be read becomes an unreadable input rather than failing the walk.
 */
public class SourceTreeWalker {

    private static final Logger log = LoggerFactory.getLogger(SourceTreeWalker.class);

    public static final Set<String> DEFAULT_EXCLUDED_DIRS = Set.of(
            "node_modules", "venv", ".venv", "env", ".env", "__pycache__",
            ".git", ".svn", ".hg", "target", "build", "dist", ".tox",
            ".mypy_cache", ".pytest_cache", "vendor", ".next", ".nuxt",
            "coverage", ".coverage", "htmlcov");

    public static final Set<String> DEFAULT_EXCLUDED_EXTENSIONS = Set.of(
            "pyc", "pyo", "so", "dll", "dylib", "class", "o", "obj", "exe",
            "lock", "log", "png", "jpg", "jpeg", "gif", "svg", "ico",
            "woff", "woff2", "ttf", "eot", "zip", "tar", "gz", "bz2");

    private final Set<String> excludedDirs = new HashSet<>(DEFAULT_EXCLUDED_DIRS);
    private final Set<String> excludedExtensions = new HashSet<>(DEFAULT_EXCLUDED_EXTENSIONS);
    private final Set<Path> skippedFiles = new HashSet<>();

    public SourceTreeWalker(Collection<String> extraDirs, Collection<String> extraExtensions) {
        excludedDirs.addAll(extraDirs);
        for (String ext : extraExtensions) {
            String e = ext.startsWith(".") ? ext.substring(1) : ext;
            excludedExtensions.add(e.toLowerCase());
        }
    }

    /** Never report {@code file}, e.g. the graph state written into the walked tree. */
    public SourceTreeWalker skipping(Path file) {
        skippedFiles.add(file.toAbsolutePath().normalize());
        return this;
    }

    /**
     * Walks {@code root} and returns its inputs sorted by path.
     *
     * @throws IOException if {@code root} itself cannot be walked
     */
    public List<SourceInput> walk(Path root) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            throw new NoSuchFileException(base.toString(), null, "not a directory");
        }
        List<SourceInput> inputs = new ArrayList<>();
        Files.walkFileTree(base, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(base)) return FileVisitResult.CONTINUE;
                String name = dir.getFileName().toString();
                return excludedDirs.contains(name) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile() || skippedFiles.contains(file)) return FileVisitResult.CONTINUE;
                String relative = relativize(base, file);
                if (excludedExtensions.contains(SourceInput.extensionOf(relative))) return FileVisitResult.CONTINUE;
                inputs.add(read(file, relative));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                String relative = relativize(base, file);
                log.warn("Cannot access {}: {}", relative, e.getMessage());
                inputs.add(SourceInput.unreadable(relative, describe(e)));
                return FileVisitResult.CONTINUE;
            }
        });
        inputs.sort(Comparator.comparing(SourceInput::path));
        log.info("Found {} files under {}", inputs.size(), base);
        return inputs;
    }

    private static SourceInput read(Path file, String relative) {
        try {
            byte[] bytes = Files.readAllBytes(file);
            return SourceInput.of(relative, new String(bytes, StandardCharsets.UTF_8), Digests.sha256(bytes));
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", relative, e.getMessage());
            return SourceInput.unreadable(relative, describe(e));
        }
    }

    private static String relativize(Path base, Path file) {
        return base.relativize(file).toString().replace('\\', '/');
    }

    private static String describe(IOException e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }
}
