package com.junctionvision.core.ocr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Упорядоченный список OCR-бэкендов: первый непустой результат выигрывает,
 * упавший бэкенд логируется и пропускается. Пустая цепочка = OCR выключен.
 */
public final class PlateReaderChain {
    private static final Logger log = LoggerFactory.getLogger(PlateReaderChain.class);

    private final List<PlateReader> readers;

    public PlateReaderChain(List<PlateReader> readers) {
        this.readers = List.copyOf(readers);
    }

    public static PlateReaderChain disabled() {
        return new PlateReaderChain(List.of());
    }

    public boolean isEnabled() {
        return !readers.isEmpty();
    }

    /** Никогда не бросает: при любом исходе без текста возвращает UNKNOWN/0.0. */
    public OcrReading read(BufferedImage roi) {
        if (readers.isEmpty()) {
            log.debug("OCR: no backend configured");
            return OcrReading.UNKNOWN;
        }
        if (roi == null || roi.getWidth() == 0 || roi.getHeight() == 0) {
            log.warn("OCR: empty ROI");
            return OcrReading.UNKNOWN;
        }
        for (PlateReader r : readers) {
            try {
                Optional<OcrReading> got = r.read(roi);
                if (got.isPresent() && !got.get().text().isBlank()) {
                    OcrReading reading = got.get();
                    double conf = Math.round(reading.confidence() * 1000.0) / 1000.0;
                    log.debug("OCR {}: '{}' conf={}", r.name(), reading.text(), conf);
                    return new OcrReading(reading.text(), conf);
                }
                log.debug("OCR {}: nothing recognised, trying next", r.name());
            } catch (RuntimeException e) {
                log.error("OCR {} failed: {}. Falling back to next backend", r.name(), e.toString());
            }
        }
        return OcrReading.UNKNOWN;
    }
}
