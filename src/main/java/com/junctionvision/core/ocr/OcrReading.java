package com.junctionvision.core.ocr;

/** Результат OCR: сырой текст и уверенность в диапазоне [0, 1]. */
public record OcrReading(String text, double confidence) {

    public static final String UNKNOWN_TEXT = "UNKNOWN";
    public static final OcrReading UNKNOWN = new OcrReading(UNKNOWN_TEXT, 0.0);

    public OcrReading {
        if (text == null) text = UNKNOWN_TEXT;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
