package com.flinspect.core.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the ingestion config file. Absent fields fall back to defaults.
 */
public class ForestConfig {

    /** File-name suffix the front end gives its dumps (default: "_ptree"). */
    @SerializedName("dump_suffix")
    private String dumpSuffix;

    /** Whether directory ingestion descends into sub-directories (default: false). */
    @SerializedName("recursive")
    private Boolean recursive;

    /** Size of the per-file ingestion pool (default: available processors). */
    @SerializedName("worker_threads")
    private Integer workerThreads;

    /** Directory the graph is written to when none is given explicitly. */
    @SerializedName("output_dir")
    private String outputDir;

    public static ForestConfig defaults() {
        return new ForestConfig();
    }

    public String getDumpSuffix()  { return dumpSuffix != null ? dumpSuffix : "_ptree"; }
    public boolean isRecursive()   { return recursive != null && recursive; }
    public String getOutputDir()   { return outputDir; }

    public int getWorkerThreads() {
        if (workerThreads != null && workerThreads > 0) return workerThreads;
        return Runtime.getRuntime().availableProcessors();
    }

    public ForestConfig withWorkerThreads(int threads) {
        ForestConfig copy = copy();
        copy.workerThreads = threads;
        return copy;
    }

    public ForestConfig withRecursive(boolean value) {
        ForestConfig copy = copy();
        copy.recursive = value;
        return copy;
    }

    public ForestConfig withOutputDir(String dir) {
        ForestConfig copy = copy();
        copy.outputDir = dir;
        return copy;
    }

    private ForestConfig copy() {
        ForestConfig copy = new ForestConfig();
        copy.dumpSuffix = dumpSuffix;
        copy.recursive = recursive;
        copy.workerThreads = workerThreads;
        copy.outputDir = outputDir;
        return copy;
    }
}
