package com.flinspect.core.forest;

import com.flinspect.core.config.ForestConfig;
import com.flinspect.core.graph.CodeGraph;
import com.flinspect.core.model.Diagnostic;
import com.flinspect.core.model.DiagnosticKind;
import com.flinspect.core.parse_tree.ParseTreeReader.ParseTreeReadException;
import com.flinspect.core.registry.NodeRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The graph of a whole codebase, grown one batch of dump files at a time.
 *
 * Files are read and extracted on a fixed worker pool, each into a private registry; the
 * results are then absorbed into the forest registry as one batch on the calling thread.
 * Ingesting a file a second time replaces everything it contributed before, and a file that
 * reads successfully drops the read failure recorded for it earlier.
 * Not safe for concurrent {@code ingest} calls.
 */
public class ParseForest {

    private final ForestConfig config;
    private final FileIngestor ingestor = new FileIngestor();
    private final Map<String, NodeRegistry> fileGraphs = new LinkedHashMap<>();
    private final Map<String, Diagnostic> failures = new LinkedHashMap<>();
    private NodeRegistry merged = NodeRegistry.merged();

    public ParseForest() {
        this(ForestConfig.defaults());
    }

    public ParseForest(ForestConfig config) {
        this.config = config;
    }

    public IngestReport ingest(List<Path> dumpFiles) {
        if (dumpFiles.isEmpty()) return new IngestReport(List.of());
        int threads = Math.max(1, Math.min(config.getWorkerThreads(), dumpFiles.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<NodeRegistry>> futures = new ArrayList<>();
            for (Path file : dumpFiles) {
                futures.add(pool.submit(() -> ingestor.ingest(file)));
            }

            GraphUnion union = new GraphUnion(pool);
            List<IngestReport.FileOutcome> outcomes = new ArrayList<>();
            List<NodeRegistry> incoming = new ArrayList<>();
            boolean replaced = false;
            for (int i = 0; i < dumpFiles.size(); i++) {
                Path file = dumpFiles.get(i);
                String fileKey = file.getFileName().toString();
                NodeRegistry fileGraph;
                try {
                    fileGraph = futures.get(i).get();
                } catch (ExecutionException e) {
                    if (!(e.getCause() instanceof ParseTreeReadException)) {
                        throw new IllegalStateException("Ingestion of " + file + " failed: " + e.getCause(), e.getCause());
                    }
                    String message = e.getCause().getMessage();
                    System.err.println("[flinspect] WARNING: " + fileKey + " skipped: " + message);
                    Diagnostic failure = new Diagnostic(DiagnosticKind.IO_FAILURE, fileKey, 0, null, message);
                    Diagnostic earlier = failures.put(fileKey, failure);
                    if (earlier != null) merged.removeDiagnostic(earlier);
                    outcomes.add(IngestReport.FileOutcome.failure(fileKey, message));
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while ingesting " + file, e);
                }

                Diagnostic earlier = failures.remove(fileKey);
                if (earlier != null) merged.removeDiagnostic(earlier);
                if (fileGraphs.put(fileKey, fileGraph) != null) {
                    replaced = true;
                } else {
                    incoming.add(fileGraph);
                }
                outcomes.add(IngestReport.FileOutcome.success(fileKey, fileGraph.unitCount(), fileGraph.callSites().size()));
            }
            if (replaced) {
                rebuild(union);
            } else if (!incoming.isEmpty()) {
                union.absorbAll(merged, incoming);
            }
            for (Diagnostic failure : failures.values()) merged.recordDiagnostic(failure);

            IngestReport report = new IngestReport(outcomes);
            System.err.println("[flinspect] Ingested " + report.succeeded().size() + " of " + dumpFiles.size()
                    + " files; " + merged.unitCount() + " units in forest");
            return report;
        } finally {
            pool.shutdown();
        }
    }

    /** Ingests every dump file under {@code dir} whose name ends in the configured suffix, sorted. */
    public IngestReport ingestDirectory(Path dir) {
        int depth = config.isRecursive() ? Integer.MAX_VALUE : 1;
        String suffix = config.getDumpSuffix();
        try (Stream<Path> paths = Files.walk(dir, depth)) {
            List<Path> dumps = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .collect(Collectors.toList());
            return ingest(dumps);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list dump files under " + dir, e);
        }
    }

    private void rebuild(GraphUnion union) {
        NodeRegistry fresh = NodeRegistry.merged();
        union.absorbAll(fresh, new ArrayList<>(fileGraphs.values()));
        merged = fresh;
    }

    /** The merged registry; treat as read-only. */
    public NodeRegistry registry() {
        return merged;
    }

    /** A read-only view over the current merged graph. */
    public CodeGraph graph() {
        return new CodeGraph(merged);
    }

    public List<String> files() {
        return new ArrayList<>(fileGraphs.keySet());
    }
}
