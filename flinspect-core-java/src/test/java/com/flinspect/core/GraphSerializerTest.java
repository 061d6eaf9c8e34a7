package com.flinspect.core;

import com.flinspect.core.config.ForestConfig;
import com.flinspect.core.forest.ParseForest;
import com.flinspect.core.graph.CodeGraph;
import com.flinspect.core.graph.GraphModel;
import com.flinspect.core.graph.GraphSerializer;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphSerializerTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/ptree");

    private static CodeGraph graph;

    @BeforeAll
    static void buildForest() {
        ParseForest forest = new ParseForest();
        forest.ingest(List.of(FIXTURES.resolve("xfile_lib_ptree"), FIXTURES.resolve("xfile_app_ptree")));
        graph = forest.graph();
    }

    private static JsonObject findById(JsonArray array, String id) {
        for (JsonElement e : array) {
            JsonObject o = e.getAsJsonObject();
            if (o.get("id").getAsString().equals(id)) return o;
        }
        return null;
    }

    @Test
    void writesGraphAndMetadata(@TempDir Path tmp) throws IOException {
        Path out = tmp.resolve("out");
        new GraphSerializer().write(graph, out);

        assertTrue(Files.exists(out.resolve("flinspect_graph.json")));
        assertTrue(Files.exists(out.resolve("metadata.json")));

        JsonObject meta = JsonParser.parseString(Files.readString(out.resolve("metadata.json"))).getAsJsonObject();
        assertEquals(5, meta.get("callCount").getAsInt());
        assertTrue(meta.has("timestamp"));
    }

    @Test
    void configuredOutputDirIsUsed(@TempDir Path tmp) {
        Path out = tmp.resolve("configured");
        new GraphSerializer().write(graph, ForestConfig.defaults().withOutputDir(out.toString()));
        assertTrue(Files.exists(out.resolve("flinspect_graph.json")));

        assertThrows(GraphSerializer.SerializerException.class,
                () -> new GraphSerializer().write(graph, ForestConfig.defaults()));
    }

    @Test
    void jsonUsesSnakeCaseFields(@TempDir Path tmp) throws IOException {
        new GraphSerializer().write(graph, tmp);
        JsonObject root = JsonParser.parseString(Files.readString(tmp.resolve("flinspect_graph.json"))).getAsJsonObject();

        assertEquals("0.1", root.get("format_version").getAsString());
        JsonObject rect = findById(root.getAsJsonArray("units"), "module:geometry/subroutine:area_rect");
        assertNotNull(rect);
        assertEquals("geometry::area_rect", rect.get("qualified_name").getAsString());
        assertEquals("xfile_lib_ptree", rect.get("source_file").getAsString());
        JsonArray args = rect.getAsJsonArray("arguments");
        assertEquals("w", args.get(0).getAsJsonObject().get("name").getAsString());
        assertEquals("real", args.get(0).getAsJsonObject().get("type").getAsString());
        assertEquals("IN", args.get(0).getAsJsonObject().get("intent").getAsString());

        JsonObject area = findById(root.getAsJsonArray("units"), "module:geometry/interface:area");
        assertEquals(2, area.getAsJsonArray("members").size());
    }

    @Test
    void modelIsSortedAndComplete() {
        GraphModel.GraphRoot model = new GraphSerializer().toModel(graph);

        for (int i = 1; i < model.units.size(); i++) {
            assertTrue(model.units.get(i - 1).id.compareTo(model.units.get(i).id) < 0, "Units sorted by id");
        }
        assertEquals(5, model.calls.size());
        assertEquals(1, model.uses.size());
        assertEquals("program:shapes_app@xfile_app_ptree", model.uses.get(0).from);
        assertNull(model.uses.get(0).only);

        GraphModel.GraphCall first = model.calls.stream()
                .filter(c -> "area".equals(c.calleeName) && c.argumentCount == 1)
                .findFirst().orElseThrow();
        assertEquals("RESOLVED", first.status);
        assertEquals(List.of("module:geometry/subroutine:area_circle"), first.candidates);
        assertEquals(List.of("module:geometry/interface:area"), first.via);
    }

    @Test
    void unknownRankIsWrittenAsNull() {
        GraphModel.GraphRoot model = new GraphSerializer().toModel(graph);
        GraphModel.GraphUnit geometry = model.units.stream()
                .filter(u -> u.id.equals("module:geometry"))
                .findFirst().orElseThrow();
        assertEquals("xfile_lib_ptree", geometry.sourceFile);
        assertFalse(geometry.shadowed);

        String json = new Gson().toJson(model);
        assertFalse(json.contains("\"rank\":-1"));
    }
}
