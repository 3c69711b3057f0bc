package com.junctionvision.app;

import com.junctionvision.core.db.Pg;
import com.junctionvision.core.detection.BoundingBox;
import com.junctionvision.core.detection.StopLine;
import com.junctionvision.core.detection.TrackedBox;
import com.junctionvision.core.evidence.EvidenceWriter;
import com.junctionvision.core.fine.FineCalculator;
import com.junctionvision.core.fine.ZoneFactors;
import com.junctionvision.core.ocr.PlateReaderChain;
import com.junctionvision.core.pipeline.RunSummary;
import com.junctionvision.core.pipeline.ViolationPipeline;
import com.junctionvision.core.pipeline.ViolationRecord;
import com.junctionvision.core.profile.ProfileStoreException;
import com.junctionvision.core.signal.FrameTimeline;
import com.junctionvision.core.video.VideoFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ViolationAppTest {

    @TempDir
    Path dir;

    @Test
    void parsesOptionsFlagsAndPositional() {
        ViolationApp.Args a = ViolationApp.parseArgs(new String[]{
                "merge", "--out=all.mp4", "--force-red", "a.mp4", "b.mp4"});
        assertEquals("merge", a.command());
        assertEquals(Map.of("out", "all.mp4", "force-red", "true"), a.options());
        assertEquals(List.of("a.mp4", "b.mp4"), a.positional());
    }

    @Test
    void noArgsIsUsageError() {
        assertEquals(ViolationApp.USAGE, ViolationApp.run(new String[0]));
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(ViolationApp.USAGE, ViolationApp.run(new String[]{"explode"}));
    }

    @Test
    void missingStopLineIsUsageError() {
        assertEquals(ViolationApp.USAGE, ViolationApp.run(new String[]{"process", "--video=x.mp4"}));
    }

    @Test
    void badStopLineIsUsageError() {
        assertEquals(ViolationApp.USAGE,
                ViolationApp.run(new String[]{"process", "--video=x.mp4", "--stop-line=1,2,3"}));
    }

    @Test
    void mergeWithoutClipsIsUsageError() {
        assertEquals(ViolationApp.USAGE,
                ViolationApp.run(new String[]{"merge", "--out=" + dir.resolve("m.mp4")}));
    }

    @Test
    void disabledOcrGivesEmptyChain() {
        Config.Ocr off = new Config.Ocr(false, "./tessdata", "eng", 7, 1, "0123456789");
        assertFalse(ViolationApp.ocrChain(off).isEnabled());
    }

    @Test
    void missingTessdataDisablesOcr() {
        Config.Ocr on = new Config.Ocr(true, dir.resolve("no-tessdata").toString(), "eng", 7, 1, "0123456789");
        assertFalse(ViolationApp.ocrChain(on).isEnabled());
    }

    @AfterEach
    void closePool() {
        Pg.close();
    }

    private static Config unreachableDb() {
        return Config.parse(Map.of(
                "db", Map.of("url", "jdbc:postgresql://127.0.0.1:1/none", "user", "jv", "pass", "jv"),
                "sink", Map.of("mode", "db"),
                "ocr", Map.of("enabled", false)));
    }

    @Test
    void unreachableDatabaseIsNotFatal() {
        ViolationApp.Storage storage = ViolationApp.storage(unreachableDb());

        assertFalse(Pg.isReady());
        assertThrows(ProfileStoreException.class, () -> storage.profiles().get("AB12"));
        assertThrows(ProfileStoreException.class, () -> storage.profiles().upsert("AB12", "v1"));
        ViolationRecord r = new ViolationRecord("v1", 7, 1, Instant.EPOCH, "LOC", "AB12", 100.0, "i", "c", 0.5);
        assertFalse(storage.sink().submit(r));
    }

    @Test
    void framesStillProcessedWithoutDatabase() {
        ViolationApp.Storage storage = ViolationApp.storage(unreachableDb());
        EvidenceWriter evidence = new EvidenceWriter() {
            @Override
            public String writeSnapshot(BufferedImage frame, String plate, Instant t) {
                return "img.jpg";
            }

            @Override
            public String writeClip(List<BufferedImage> frames, String plate, Instant t, double fps) {
                return "clip.mp4";
            }
        };
        int[] calls = {0};
        ViolationPipeline p = new ViolationPipeline(
                new ViolationPipeline.Settings(new StopLine(0, 500, 640, 500), "LOC", ZoneFactors.NONE,
                        ZoneOffset.UTC, FineCalculator.Params.DEFAULTS, 5, 10, 3, 150, 100),
                new FrameTimeline(Instant.parse("2024-05-01T12:00:00Z"), 10.0, List.of(), true),
                frame -> List.of(new TrackedBox(7, new BoundingBox(100, 400, 200, calls[0]++ == 0 ? 490 : 505))),
                PlateReaderChain.disabled(), storage.profiles(), evidence, storage.sink());

        for (int i = 0; i < 3; i++) p.processFrame(new VideoFrame(i, new BufferedImage(640, 640, BufferedImage.TYPE_3BYTE_BGR)));

        RunSummary s = p.summary();
        assertEquals(3, s.frames());
        assertEquals(1, s.violations());
        assertEquals(1, s.profileFailures());
        assertEquals(1, s.sinkFailures());
    }
}
