package com.junctionvision.app;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @AfterEach
    void clearProps() {
        System.clearProperty("jv.fine.base");
        System.clearProperty("jv.sink");
    }

    @Test
    void emptyTreeGivesDefaults() {
        Config c = Config.parse(Map.of());
        assertEquals(100.0, c.fine().baseFine());
        assertEquals(1.5, c.fine().repeatMultiplier());
        assertEquals(22, c.fine().nightHourStart());
        assertEquals(6, c.fine().nightHourEnd());
        assertEquals("DEFAULT_LOCATION_000", c.location().id());
        assertEquals(5, c.pipeline().historySize());
        assertEquals(10, c.pipeline().bufferSeconds());
        assertEquals(3, c.pipeline().clipSeconds());
        assertEquals("db", c.sink().mode());
        assertTrue(c.ocr().enabled());
    }

    @Test
    void yamlValuesApplied() {
        Config c = Config.parse(Map.of(
                "location", Map.of("id", "X_1", "schoolZone", true, "zone", "Europe/Berlin"),
                "pipeline", Map.of("historySize", 1, "clipSeconds", 4),
                "sink", Map.of("mode", "log")));
        assertEquals("X_1", c.location().id());
        assertTrue(c.location().schoolZone());
        assertEquals(ZoneId.of("Europe/Berlin"), c.location().zone());
        assertEquals(2, c.pipeline().historySize()); // меньше двух не бывает
        assertEquals(4, c.pipeline().clipSeconds());
        assertEquals("log", c.sink().mode());
    }

    @Test
    void systemPropertiesOverrideYaml() {
        System.setProperty("jv.fine.base", "250");
        System.setProperty("jv.sink", "log");
        Config c = Config.parse(Map.of("fine", Map.of("baseFine", 80), "sink", Map.of("mode", "db")));
        assertEquals(250.0, c.fine().baseFine());
        assertEquals("log", c.sink().mode());
    }

    @Test
    void classpathYamlLoads() {
        Config c = Config.load();
        assertNotNull(c.db().url());
        assertEquals("output/images", c.output().images());
    }
}
