package com.flinspect.core.graph;

import com.flinspect.core.config.ForestConfig;
import com.flinspect.core.model.ArgumentDescriptor;
import com.flinspect.core.model.CallEdge;
import com.flinspect.core.model.ComponentDescriptor;
import com.flinspect.core.model.ContainsEdge;
import com.flinspect.core.model.Diagnostic;
import com.flinspect.core.model.InterfaceMembers;
import com.flinspect.core.model.ProgramUnit;
import com.flinspect.core.model.Rank;
import com.flinspect.core.model.UnitId;
import com.flinspect.core.model.UnitKind;
import com.flinspect.core.model.UnitPayload.SubprogramPayload;
import com.flinspect.core.model.UsesEdge;
import com.flinspect.core.model.VariableDecl;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Serializes a {@link CodeGraph} to flinspect_graph.json.
 * Produces deterministic output by sorting all arrays before writing.
 */
public class GraphSerializer {

    static final String FORMAT_VERSION = "0.1";
    static final String TOOL_VERSION = "0.1.0";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg) { super(msg); }
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code graph} to {@code outputDir/flinspect_graph.json} and a
     * {@code outputDir/metadata.json} with counts and a timestamp.
     *
     * @param outputDir directory to write into (created if absent)
     */
    public void write(CodeGraph graph, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }
        var gson = new GsonBuilder().setPrettyPrinting().create();
        GraphModel.GraphRoot root = toModel(graph);

        Path graphPath = outputDir.resolve("flinspect_graph.json");
        try (Writer w = Files.newBufferedWriter(graphPath, StandardCharsets.UTF_8)) {
            gson.toJson(root, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write flinspect_graph.json: " + e.getMessage(), e);
        }
        System.err.println("[flinspect] flinspect_graph.json written: " + graphPath);

        var meta = new Metadata(TOOL_VERSION, FORMAT_VERSION, root.units.size(), root.calls.size(),
                root.diagnostics.size(), Instant.now().toString());
        Path metaPath = outputDir.resolve("metadata.json");
        try (Writer w = Files.newBufferedWriter(metaPath, StandardCharsets.UTF_8)) {
            gson.toJson(meta, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write metadata.json: " + e.getMessage(), e);
        }
        System.err.println("[flinspect] metadata.json written: " + metaPath);
    }

    /** Writes {@code graph} to the config's {@code output_dir}. */
    public void write(CodeGraph graph, ForestConfig config) {
        if (config.getOutputDir() == null) {
            throw new SerializerException("No output_dir configured");
        }
        write(graph, Path.of(config.getOutputDir()));
    }

    /** Builds the sorted export model of {@code graph}. */
    public GraphModel.GraphRoot toModel(CodeGraph graph) {
        GraphModel.GraphRoot root = new GraphModel.GraphRoot();
        root.formatVersion = FORMAT_VERSION;
        root.toolVersion = TOOL_VERSION;

        root.units = new ArrayList<>();
        for (ProgramUnit u : graph.units()) root.units.add(unit(graph, u));
        root.units.sort(Comparator.comparing(u -> u.id));

        root.contains = new ArrayList<>();
        for (ContainsEdge e : graph.containsEdges()) {
            GraphModel.GraphContains c = new GraphModel.GraphContains();
            c.parent = e.parent().value();
            c.child = e.child().value();
            root.contains.add(c);
        }
        root.contains.sort(Comparator.comparing((GraphModel.GraphContains c) -> c.parent).thenComparing(c -> c.child));

        root.uses = new ArrayList<>();
        for (UsesEdge e : graph.usesEdges()) {
            GraphModel.GraphUses u = new GraphModel.GraphUses();
            u.from = e.from().value();
            u.module = e.module().value();
            u.only = e.only();
            u.renames = e.renames().isEmpty() ? null : e.renames();
            u.line = e.line();
            root.uses.add(u);
        }
        root.uses.sort(Comparator.comparing((GraphModel.GraphUses u) -> u.from)
                .thenComparing(u -> u.module).thenComparingInt(u -> u.line));

        root.calls = new ArrayList<>();
        for (CallEdge e : graph.callEdges()) root.calls.add(call(e));
        root.calls.sort(Comparator.comparing(c -> c.id));

        root.diagnostics = new ArrayList<>();
        for (Diagnostic d : graph.diagnostics()) {
            GraphModel.GraphDiagnostic gd = new GraphModel.GraphDiagnostic();
            gd.kind = d.kind().name();
            gd.sourceFile = d.sourceFile();
            gd.line = d.line();
            gd.subject = d.subject() != null ? d.subject().value() : null;
            gd.message = d.message();
            root.diagnostics.add(gd);
        }
        root.diagnostics.sort(Comparator
                .comparing((GraphModel.GraphDiagnostic d) -> d.sourceFile, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparingInt(d -> d.line)
                .thenComparing(d -> d.kind)
                .thenComparing(d -> d.subject, Comparator.nullsFirst(Comparator.naturalOrder())));
        return root;
    }

    private static GraphModel.GraphUnit unit(CodeGraph graph, ProgramUnit u) {
        GraphModel.GraphUnit gu = new GraphModel.GraphUnit();
        gu.id = u.id().value();
        gu.kind = u.kind().tag();
        gu.name = u.name();
        gu.qualifiedName = u.qualifiedName();
        gu.container = u.container() != null ? u.container().value() : null;
        gu.sourceFile = u.isDefined() ? u.location().file() : null;
        gu.line = u.isDefined() ? u.location().line() : 0;
        gu.shadowed = graph.isShadowed(u.id());

        if (u.kind().isProcedure()) {
            gu.arguments = new ArrayList<>();
            for (ArgumentDescriptor a : graph.arguments(u.id())) {
                gu.arguments.add(entry(a.name(), a.type().toString(), a.rank(), a.optional(), a.intent().name()));
            }
            if (u.payload() instanceof SubprogramPayload sub && sub.resultType() != null) {
                gu.resultType = sub.resultType().toString();
            }
        }
        if (u.kind() == UnitKind.INTERFACE) {
            InterfaceMembers members = graph.interfaceMembers(u.id());
            gu.members = new ArrayList<>();
            for (UnitId m : members.bound()) gu.members.add(m.value());
            gu.unboundMembers = members.unbound().isEmpty() ? null : members.unbound();
        }
        if (u.kind() == UnitKind.DERIVED_TYPE) {
            gu.components = new ArrayList<>();
            for (ComponentDescriptor c : graph.components(u.id())) {
                gu.components.add(entry(c.name(), c.type().toString(), c.rank(), null, null));
            }
        }
        List<VariableDecl> vars = graph.variables(u.id());
        if (!vars.isEmpty()) {
            gu.variables = new ArrayList<>();
            for (VariableDecl v : vars) {
                gu.variables.add(entry(v.name(), v.type().toString(), v.rank(), v.optional() ? Boolean.TRUE : null, null));
            }
            gu.variables.sort(Comparator.comparing(v -> v.name));
        }
        return gu;
    }

    private static GraphModel.GraphArgument entry(String name, String type, int rank, Boolean optional, String intent) {
        GraphModel.GraphArgument ga = new GraphModel.GraphArgument();
        ga.name = name;
        ga.type = type;
        ga.rank = Rank.isKnown(rank) ? rank : null;
        ga.optional = optional;
        ga.intent = intent;
        return ga;
    }

    private static GraphModel.GraphCall call(CallEdge e) {
        GraphModel.GraphCall gc = new GraphModel.GraphCall();
        gc.id = e.site().id();
        gc.caller = e.caller().value();
        gc.calleeName = e.site().calleeName();
        gc.status = e.status().name();
        gc.candidates = new ArrayList<>();
        for (UnitId c : e.resolution().candidates()) gc.candidates.add(c.value());
        gc.via = new ArrayList<>();
        for (UnitId v : e.resolution().via()) gc.via.add(v.value());
        gc.sourceFile = e.site().location().file();
        gc.line = e.site().location().line();
        gc.argumentCount = e.site().arguments().size();
        return gc;
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String toolVersion,
            String formatVersion,
            int unitCount,
            int callCount,
            int diagnosticCount,
            String timestamp
    ) {}
}
