package com.depgraph.engine.config;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of depgraph.json. Every key is optional; getters supply the defaults.
 */
public class EngineConfig {

    @SerializedName("scanner_threads")
    private Integer scannerThreads;

    /** Depth cap for impact queries that do not give one (default: 5). */
    @SerializedName("default_impact_depth")
    private Integer defaultImpactDepth;

    @SerializedName("max_impact_results")
    private Integer maxImpactResults;

    /** Incoming edges expanded per symbol during an impact search (default: 250). */
    @SerializedName("max_fan_out")
    private Integer maxFanOut;

    /** Cycle search stops after node count times this many steps (default: 64). */
    @SerializedName("cycle_budget_factor")
    private Integer cycleBudgetFactor;

    /** Candidates kept when a name is ambiguous and fans out to dynamic edges (default: 8). */
    @SerializedName("max_dynamic_candidates")
    private Integer maxDynamicCandidates;

    @SerializedName("commit_retries")
    private Integer commitRetries;

    /** Directory names skipped by the directory walker, on top of the built-in list. */
    @SerializedName("excluded_dirs")
    private List<String> excludedDirs;

    /** File extensions (with or without the dot) skipped by the directory walker. */
    @SerializedName("excluded_extensions")
    private List<String> excludedExtensions;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public int getScannerThreads() {
        return scannerThreads != null && scannerThreads > 0
                ? scannerThreads
                : Runtime.getRuntime().availableProcessors();
    }
    public int getDefaultImpactDepth()   { return defaultImpactDepth != null ? defaultImpactDepth : 5; }
    public int getMaxImpactResults()     { return maxImpactResults != null ? maxImpactResults : 1000; }
    public int getMaxFanOut()            { return maxFanOut != null ? maxFanOut : 250; }
    public int getCycleBudgetFactor()    { return cycleBudgetFactor != null ? cycleBudgetFactor : 64; }
    public int getMaxDynamicCandidates() { return maxDynamicCandidates != null ? maxDynamicCandidates : 8; }
    public int getCommitRetries()        { return commitRetries != null ? commitRetries : 1; }
    public List<String> getExcludedDirs() {
        return excludedDirs != null ? excludedDirs : Collections.emptyList();
    }
    public List<String> getExcludedExtensions() {
        return excludedExtensions != null ? excludedExtensions : Collections.emptyList();
    }

    public EngineConfig withScannerThreads(int threads) {
        EngineConfig copy = copy();
        copy.scannerThreads = threads;
        return copy;
    }

    public EngineConfig withCommitRetries(int retries) {
        EngineConfig copy = copy();
        copy.commitRetries = retries;
        return copy;
    }

    public EngineConfig withCycleBudgetFactor(int factor) {
        EngineConfig copy = copy();
        copy.cycleBudgetFactor = factor;
        return copy;
    }

    private EngineConfig copy() {
        EngineConfig copy = new EngineConfig();
        copy.scannerThreads = scannerThreads;
        copy.defaultImpactDepth = defaultImpactDepth;
        copy.maxImpactResults = maxImpactResults;
        copy.maxFanOut = maxFanOut;
        copy.cycleBudgetFactor = cycleBudgetFactor;
        copy.maxDynamicCandidates = maxDynamicCandidates;
        copy.commitRetries = commitRetries;
        copy.excludedDirs = excludedDirs;
        copy.excludedExtensions = excludedExtensions;
        return copy;
    }
}
