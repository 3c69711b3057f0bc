package com.junctionvision.core.ocr;

import java.util.Locale;

/**
 * Детерминированная чистка сырого OCR-текста в канонический номер:
 * только буквы/цифры, верхний регистр, затем O→0, I→1, Z→2.
 */
public final class PlateNormalizer {

    private PlateNormalizer() {
        // no-op
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(raw.length());
        raw.codePoints()
                .filter(Character::isLetterOrDigit)
                .forEach(sb::appendCodePoint);
        return sb.toString().toUpperCase(Locale.ROOT)
                .replace('O', '0')
                .replace('I', '1')
                .replace('Z', '2');
    }
}
