package com.junctionvision.core.ocr;

/** Сбой конкретного OCR-бэкенда; цепочка переходит к следующему. */
public class OcrException extends RuntimeException {
    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
