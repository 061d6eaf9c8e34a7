package com.flinspect.core.forest;

import com.flinspect.core.extract.ConstructExtractor;
import com.flinspect.core.model.ResolutionStatus;
import com.flinspect.core.parse_tree.ParseTreeReader;
import com.flinspect.core.registry.NodeRegistry;
import com.flinspect.core.resolve.CallResolver;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runs the per-file pipeline: read the dump, extract constructs into a private registry,
 * resolve the calls that can be resolved within the file.
 *
 * Each call builds its own registry, so files can be ingested on parallel workers.
 */
public class FileIngestor {

    /**
     * @throws ParseTreeReader.ParseTreeReadException if the dump cannot be read
     */
    public NodeRegistry ingest(Path dumpFile) {
        String fileKey = dumpFile.getFileName().toString();
        NodeRegistry registry = new NodeRegistry(fileKey);
        System.err.println("[flinspect] Ingesting " + dumpFile);

        ParseTreeReader reader = new ParseTreeReader(dumpFile, registry::recordDiagnostic);
        try (ParseTreeReader.TreeCursor trees = reader.open()) {
            new ConstructExtractor(registry).extract(trees);
        }
        Map<ResolutionStatus, Integer> counts = new CallResolver(registry).resolveAll();

        System.err.println("[flinspect] " + fileKey + ": " + registry.unitCount() + " units, "
                + registry.callSites().size() + " call sites (" + summary(counts) + ")");
        return registry;
    }

    static String summary(Map<ResolutionStatus, Integer> counts) {
        return counts.getOrDefault(ResolutionStatus.RESOLVED, 0) + " resolved, "
                + counts.getOrDefault(ResolutionStatus.AMBIGUOUS, 0) + " ambiguous, "
                + counts.getOrDefault(ResolutionStatus.UNKNOWN, 0) + " unknown";
    }
}
