package com.junctionvision.core.ocr;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PlateReaderChainTest {

    private static final BufferedImage ROI = new BufferedImage(40, 20, BufferedImage.TYPE_3BYTE_BGR);

    @Test
    void disabledChainIsUnknown() {
        OcrReading r = PlateReaderChain.disabled().read(ROI);
        assertEquals(OcrReading.UNKNOWN_TEXT, r.text());
        assertEquals(0.0, r.confidence());
    }

    @Test
    void firstNonEmptyWins() {
        AtomicInteger secondCalls = new AtomicInteger();
        PlateReader first = roi -> Optional.of(new OcrReading("AB123", 0.91234));
        PlateReader second = roi -> {
            secondCalls.incrementAndGet();
            return Optional.of(new OcrReading("ZZZ", 0.5));
        };
        OcrReading r = new PlateReaderChain(List.of(first, second)).read(ROI);
        assertEquals("AB123", r.text());
        assertEquals(0.912, r.confidence(), 1e-9);
        assertEquals(0, secondCalls.get());
    }

    @Test
    void failingReaderFallsBackToNext() {
        PlateReader broken = roi -> {
            throw new OcrException("native crash");
        };
        PlateReader blank = roi -> Optional.of(new OcrReading("  ", 0.9));
        PlateReader text = roi -> Optional.of(new OcrReading("XY99", 0.7));
        OcrReading r = new PlateReaderChain(List.of(broken, blank, text)).read(ROI);
        assertEquals("XY99", r.text());
        assertEquals(0.7, r.confidence(), 1e-9);
    }

    @Test
    void allEmptyGivesUnknown() {
        PlateReader none = roi -> Optional.empty();
        assertEquals(OcrReading.UNKNOWN, new PlateReaderChain(List.of(none, none)).read(ROI));
    }

    @Test
    void nullRoiGivesUnknown() {
        PlateReader never = roi -> fail("must not be called");
        assertEquals(OcrReading.UNKNOWN, new PlateReaderChain(List.of(never)).read(null));
    }

    @Test
    void confidenceClamped() {
        assertEquals(1.0, new OcrReading("A", 87.0).confidence());
        assertEquals(0.0, new OcrReading("A", -1).confidence());
    }
}
