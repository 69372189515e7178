package com.depgraph.cli;

import com.depgraph.engine.analysis.Cycle;
import com.depgraph.engine.analysis.ImpactEntry;
import com.depgraph.engine.graph.Symbol;
import com.depgraph.engine.sync.SyncReport;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.PrintStream;
import java.util.List;

/** Renders command results as pretty-printed JSON with snake_case keys. */
public class ReportWriter {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private final PrintStream out;

    public ReportWriter(PrintStream out) {
        this.out = out;
    }

    public void sync(SyncReport report) {
        print(report);
    }

    public void cycles(List<Cycle> cycles) {
        print(new CyclesView(cycles.size(), cycles));
    }

    public void impact(String symbolId, int depth, List<ImpactEntry> entries) {
        print(new ImpactView(symbolId, depth, entries.size(), entries));
    }

    public void symbols(String fileId, List<Symbol> symbols) {
        print(new SymbolsView(fileId, symbols));
    }

    private void print(Object view) {
        out.println(GSON.toJson(view));
        out.flush();
    }

    private record CyclesView(int count, List<Cycle> cycles) {}

    private record ImpactView(String symbolId, int maxDepth, int count, List<ImpactEntry> dependents) {}

    private record SymbolsView(String file, List<Symbol> symbols) {}
}
