package com.junctionvision.core.ocr;

import java.awt.image.BufferedImage;
import java.util.Optional;

@FunctionalInterface
public interface PlateReader {
    /**
     * Распознать текст номера в ROI.
     * Optional.empty() - бэкенд отработал, но ничего не нашёл; OcrException - бэкенд сломан.
     */
    Optional<OcrReading> read(BufferedImage roi);

    /** Имя для логов. */
    default String name() {
        return getClass().getSimpleName();
    }
}
