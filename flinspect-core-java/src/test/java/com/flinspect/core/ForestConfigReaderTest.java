package com.flinspect.core;

import com.flinspect.core.config.ForestConfig;
import com.flinspect.core.config.ForestConfigReader;
import com.flinspect.core.config.ForestConfigReader.ConfigReadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ForestConfigReaderTest {

    private final ForestConfigReader reader = new ForestConfigReader();

    @Test
    void readsEveryField(@TempDir Path tmp) throws IOException {
        String json = """
            {
              "dump_suffix": ".ptree",
              "recursive": true,
              "worker_threads": 3,
              "output_dir": "/tmp/graph"
            }
            """;
        Path file = tmp.resolve("flinspect.json");
        Files.writeString(file, json);

        ForestConfig config = reader.read(file);
        assertEquals(".ptree", config.getDumpSuffix());
        assertTrue(config.isRecursive());
        assertEquals(3, config.getWorkerThreads());
        assertEquals("/tmp/graph", config.getOutputDir());
    }

    @Test
    void missingFieldsFallBackToDefaults(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("flinspect.json");
        Files.writeString(file, "{}");

        ForestConfig config = reader.read(file);
        assertEquals("_ptree", config.getDumpSuffix());
        assertFalse(config.isRecursive());
        assertTrue(config.getWorkerThreads() >= 1);
        assertNull(config.getOutputDir());
    }

    @Test
    void nonPositiveWorkerCountUsesProcessors(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("flinspect.json");
        Files.writeString(file, "{\"worker_threads\": 0}");

        assertEquals(Runtime.getRuntime().availableProcessors(), reader.read(file).getWorkerThreads());
    }

    @Test
    void withersLeaveTheOriginalUntouched() {
        ForestConfig base = ForestConfig.defaults();
        ForestConfig tuned = base.withWorkerThreads(2).withRecursive(true);

        assertEquals(2, tuned.getWorkerThreads());
        assertTrue(tuned.isRecursive());
        assertFalse(base.isRecursive());
    }

    @Test
    void missingFileThrows(@TempDir Path tmp) {
        assertThrows(ConfigReadException.class, () -> reader.read(tmp.resolve("absent.json")));
    }

    @Test
    void emptyFileThrows(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("flinspect.json");
        Files.writeString(file, "");
        assertThrows(ConfigReadException.class, () -> reader.read(file));
    }

    @Test
    void malformedJsonThrows(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("flinspect.json");
        Files.writeString(file, "{ \"recursive\": ");
        assertThrows(ConfigReadException.class, () -> reader.read(file));
    }
}
