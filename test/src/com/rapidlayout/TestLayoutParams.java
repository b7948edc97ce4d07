package com.rapidlayout;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestLayoutParams {

    @Test
    public void testDefaults() {
        LayoutParams params = new LayoutParams();
        Assertions.assertEquals(0, params.getCoordMin());
        Assertions.assertEquals(10000, params.getCoordMax());
        Assertions.assertEquals(60.0, params.getTimeLimitSec());
        Assertions.assertTrue(params.isDefaultFootprint());
        Assertions.assertEquals(10, params.getDefaultLeafWidth());
        Assertions.assertEquals(10, params.getDefaultLeafHeight());
    }

    @Test
    public void testLoadJsonFile(@TempDir Path tempDir) throws IOException {
        Path jsonPath = tempDir.resolve("layout.json");
        Files.writeString(jsonPath, "{\"coordMax\": 500, \"timeLimitSec\": 2.5, \"numWorkers\": 1,"
            + " \"defaultFootprint\": false, \"defaultLeafWidth\": 4, \"verbose\": true}");

        LayoutParams params = new LayoutParams(jsonPath);
        Assertions.assertEquals(500, params.getCoordMax());
        Assertions.assertEquals(2.5, params.getTimeLimitSec());
        Assertions.assertEquals(1, params.getNumWorkers());
        Assertions.assertFalse(params.isDefaultFootprint());
        Assertions.assertEquals(4, params.getDefaultLeafWidth());
        Assertions.assertEquals(10, params.getDefaultLeafHeight());
        Assertions.assertTrue(params.isVerbose());
        // untouched keys keep their defaults
        Assertions.assertEquals(999, params.getRandomSeed());
    }

    @Test
    public void testInvalidValuesRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> LayoutParams.fromJson(new StringReader("{\"coordMin\": 10, \"coordMax\": 10}")));
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> LayoutParams.fromJson(new StringReader("{\"timeLimitSec\": 0}")));
        Assertions.assertThrows(IllegalArgumentException.class,
            () -> LayoutParams.fromJson(new StringReader("{\"numWorkers\": ")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new LayoutParams().setDefaultLeafSize(0, 5));
    }

    @Test
    public void testCoordRangeBeyondIntRejected() {
        LayoutParams params = new LayoutParams();
        Assertions.assertThrows(IllegalArgumentException.class, () -> params.setCoordRange(0, 4_000_000_000L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> params.setCoordRange(-3_000_000_000L, 0));
        Assertions.assertEquals(10000, params.getCoordMax());

        params.setCoordRange(Integer.MIN_VALUE, Integer.MAX_VALUE);
        Assertions.assertEquals(Integer.MAX_VALUE, params.getCoordMax());

        Assertions.assertThrows(IllegalArgumentException.class,
            () -> LayoutParams.fromJson(new StringReader("{\"coordMax\": 4000000000}")));
    }

    @Test
    public void testMissingFile(@TempDir Path tempDir) {
        Assertions.assertThrows(UncheckedIOException.class, () -> new LayoutParams(tempDir.resolve("missing.json")));
    }
}
