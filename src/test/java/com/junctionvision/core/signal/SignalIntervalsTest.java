package com.junctionvision.core.signal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalIntervalsTest {

    @TempDir
    Path dir;

    private Path write(String json) throws Exception {
        Path p = dir.resolve("signals.json");
        Files.writeString(p, json);
        return p;
    }

    @Test
    void objectFormWithOffsets() throws Exception {
        Path p = write("""
                {"red_intervals": [
                  {"start": "2024-05-01T10:00:00Z", "end": "2024-05-01T10:00:30Z"},
                  {"start": "2024-05-01T10:01:00+02:00", "end": "2024-05-01T10:01:30+02:00"}
                ]}
                """);
        List<RedInterval> iv = SignalIntervals.load(p, ZoneOffset.UTC);
        assertEquals(2, iv.size());
        assertEquals(Instant.parse("2024-05-01T08:01:00Z"), iv.get(1).start());
    }

    @Test
    void bareListWithLocalTimesUsesZone() throws Exception {
        Path p = write("""
                [{"start": "2024-05-01T10:00:00", "end": "2024-05-01T10:00:10"}]
                """);
        List<RedInterval> iv = SignalIntervals.load(p, ZoneId.of("Europe/Berlin"));
        assertEquals(Instant.parse("2024-05-01T08:00:00Z"), iv.get(0).start());
    }

    @Test
    void missingFileGivesEmpty() {
        assertTrue(SignalIntervals.load(dir.resolve("nope.json"), ZoneOffset.UTC).isEmpty());
    }

    @Test
    void endBeforeStartGivesEmpty() throws Exception {
        Path p = write("""
                {"red_intervals": [{"start": "2024-05-01T10:00:10Z", "end": "2024-05-01T10:00:00Z"}]}
                """);
        assertTrue(SignalIntervals.load(p, ZoneOffset.UTC).isEmpty());
    }

    @Test
    void missingFieldGivesEmpty() throws Exception {
        Path p = write("""
                {"red_intervals": [{"start": "2024-05-01T10:00:10Z"}]}
                """);
        assertTrue(SignalIntervals.load(p, ZoneOffset.UTC).isEmpty());
    }

    @Test
    void garbageGivesEmpty() throws Exception {
        assertTrue(SignalIntervals.load(write("{ not json"), ZoneOffset.UTC).isEmpty());
    }
}
