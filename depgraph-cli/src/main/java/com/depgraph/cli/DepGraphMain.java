package com.depgraph.cli;

import com.depgraph.engine.DependencyEngine;
import com.depgraph.engine.analysis.ImpactEntry;
import com.depgraph.engine.config.EngineConfig;
import com.depgraph.engine.config.EngineConfigReader;
import com.depgraph.engine.scan.SourceInput;
import com.depgraph.engine.sync.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * Usage:
 *   depgraph sync    --root <dir> --state <file> [--config <file>]
 *   depgraph cycles  --state <file> [--config <file>]
 *   depgraph impact  --state <file> --symbol <id> [--depth N] [--config <file>]
 *   depgraph symbols --state <file> --file <path> [--config <file>]
 *
 * Results go to stdout as JSON; logging goes to stderr.
 */
public class DepGraphMain {

    private static final Logger log = LoggerFactory.getLogger(DepGraphMain.class);

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: depgraph sync    --root <dir> --state <file> [--config <file>]",
            "       depgraph cycles  --state <file> [--config <file>]",
            "       depgraph impact  --state <file> --symbol <id> [--depth N] [--config <file>]",
            "       depgraph symbols --state <file> --file <path> [--config <file>]");

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[depgraph] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            log.error("Fatal: {}", e.getMessage(), e);
            System.err.println("[depgraph] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No command specified");
        }
        String command = args[0];
        Map<String, String> flags = parseFlags(args);
        ReportWriter writer = new ReportWriter(out);

        switch (command) {
            case "sync" -> sync(flags, writer);
            case "cycles" -> cycles(flags, writer);
            case "impact" -> impact(flags, writer);
            case "symbols" -> symbols(flags, writer);
            default -> throw new UsageException("Unknown command: " + command);
        }
    }

    // -----------------------------------------------------------------------
    // Commands
    // -----------------------------------------------------------------------

    private static void sync(Map<String, String> flags, ReportWriter writer) {
        allowOnly(flags, "--root", "--state", "--config");
        Path root = Paths.get(require(flags, "--root"));
        Path state = Paths.get(require(flags, "--state"));
        if (!Files.isDirectory(root)) {
            throw new UsageException("--root is not a directory: " + root);
        }
        Path configPath = flags.containsKey("--config")
                ? Paths.get(flags.get("--config"))
                : root.resolve(EngineConfigReader.DEFAULT_FILE_NAME);
        EngineConfig config = new EngineConfigReader().read(configPath);

        SourceTreeWalker walker = new SourceTreeWalker(config.getExcludedDirs(), config.getExcludedExtensions())
                .skipping(state)
                .skipping(state.resolveSibling(state.getFileName() + ".tmp"))
                .skipping(configPath);
        List<SourceInput> inputs;
        try {
            inputs = walker.walk(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot walk " + root + ": " + e.getMessage(), e);
        }

        try (DependencyEngine engine = DependencyEngine.open(state, config)) {
            SyncReport report = engine.sync(inputs);
            engine.save(state);
            writer.sync(report);
        }
    }

    private static void cycles(Map<String, String> flags, ReportWriter writer) {
        allowOnly(flags, "--state", "--config");
        try (DependencyEngine engine = openExisting(flags)) {
            writer.cycles(engine.findCycles());
        }
    }

    private static void impact(Map<String, String> flags, ReportWriter writer) {
        allowOnly(flags, "--state", "--symbol", "--depth", "--config");
        String symbol = require(flags, "--symbol");
        EngineConfig config = readConfig(flags);
        int depth = config.getDefaultImpactDepth();
        if (flags.containsKey("--depth")) {
            try {
                depth = Integer.parseInt(flags.get("--depth"));
            } catch (NumberFormatException e) {
                throw new UsageException("--depth must be an integer: " + flags.get("--depth"));
            }
            if (depth < 0) throw new UsageException("--depth must be >= 0");
        }
        try (DependencyEngine engine = openExisting(flags, config)) {
            List<ImpactEntry> entries = engine.impactOf(symbol, depth);
            writer.impact(symbol, depth, entries);
        }
    }

    private static void symbols(Map<String, String> flags, ReportWriter writer) {
        allowOnly(flags, "--state", "--file", "--config");
        String file = require(flags, "--file");
        try (DependencyEngine engine = openExisting(flags)) {
            writer.symbols(file, engine.symbolsIn(file));
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static DependencyEngine openExisting(Map<String, String> flags) {
        return openExisting(flags, readConfig(flags));
    }

    private static DependencyEngine openExisting(Map<String, String> flags, EngineConfig config) {
        Path state = Paths.get(require(flags, "--state"));
        if (!Files.exists(state)) {
            throw new UsageException("No graph state at " + state + "; run sync first");
        }
        return DependencyEngine.open(state, config.withScannerThreads(1));
    }

    private static EngineConfig readConfig(Map<String, String> flags) {
        return flags.containsKey("--config")
                ? new EngineConfigReader().read(Paths.get(flags.get("--config")))
                : EngineConfig.defaults();
    }

    private static Map<String, String> parseFlags(String[] args) {
        Map<String, String> flags = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String flag = args[i];
            if (!flag.startsWith("--")) {
                throw new UsageException("Unexpected argument: " + flag);
            }
            flags.put(flag, requireNext(args, i++, flag));
        }
        return flags;
    }

    private static void allowOnly(Map<String, String> flags, String... allowed) {
        for (String flag : flags.keySet()) {
            if (!List.of(allowed).contains(flag)) {
                throw new UsageException("Unknown flag: " + flag);
            }
        }
    }

    private static String require(Map<String, String> flags, String flag) {
        String value = flags.get(flag);
        if (value == null) throw new UsageException(flag + " is required");
        return value;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
